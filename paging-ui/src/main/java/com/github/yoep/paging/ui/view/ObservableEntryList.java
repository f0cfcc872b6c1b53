package com.github.yoep.paging.ui.view;

import com.github.yoep.paging.core.model.ListEntry;
import com.github.yoep.paging.core.view.AbstractPagingView;
import com.github.yoep.paging.core.view.EntrySource;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A {@link com.github.yoep.paging.core.view.PagingView} which mirrors the entries of the attached paging controller into a
 * JavaFX {@link ObservableList}.
 * The mirror is updated on each notification of the controller, which are always invoked on the renderer thread.
 *
 * @param <T> The application item type.
 */
@Slf4j
public class ObservableEntryList<T> extends AbstractPagingView<T> {
    private final ObservableList<ListEntry<T>> entries = FXCollections.observableArrayList();
    private final ObservableList<ListEntry<T>> readOnlyEntries = FXCollections.unmodifiableObservableList(entries);

    private EntrySource<T> source;

    //region Properties

    /**
     * Get the mirrored entries of the paging controller.
     *
     * @return Returns the read-only observable entries.
     */
    public ObservableList<ListEntry<T>> getEntries() {
        return readOnlyEntries;
    }

    public boolean isAttached() {
        return source != null;
    }

    //endregion

    //region PagingView

    @Override
    public void onAttached(EntrySource<T> source) {
        this.source = source;
        notifyReset();
    }

    @Override
    public void onDetached() {
        this.source = null;
        entries.clear();
    }

    @Override
    public void notifyInserted(int index) {
        entryAt(index).ifPresent(e -> entries.add(index, e));
    }

    @Override
    public void notifyRangeInserted(int start, int count) {
        var inserted = new ArrayList<ListEntry<T>>(count);

        for (int i = start; i < start + count; i++) {
            entryAt(i).ifPresent(inserted::add);
        }

        entries.addAll(start, inserted);
    }

    @Override
    public void notifyChanged(int index) {
        entryAt(index).ifPresent(e -> entries.set(index, e));
    }

    @Override
    public void notifyRemoved(int index) {
        if (index >= 0 && index < entries.size())
            entries.remove(index);
    }

    @Override
    public void notifyReset() {
        entries.setAll(snapshot());
    }

    //endregion

    //region Methods

    /**
     * Report a new scroll position of the rendered list.
     *
     * @param lastVisibleIndex The index of the last visible entry.
     */
    public void scrolled(int lastVisibleIndex) {
        log.trace("Last visible entry is now {}", lastVisibleIndex);
        onScrolled(lastVisibleIndex);
    }

    //endregion

    //region Functions

    private Optional<ListEntry<T>> entryAt(int index) {
        if (source == null)
            return Optional.empty();

        return source.getItem(index);
    }

    private List<ListEntry<T>> snapshot() {
        if (source == null)
            return List.of();

        var snapshot = new ArrayList<ListEntry<T>>(source.getItemCount());
        for (int i = 0; i < source.getItemCount(); i++) {
            source.getItem(i).ifPresent(snapshot::add);
        }
        return snapshot;
    }

    //endregion
}
