package com.github.yoep.paging.core;

import com.github.yoep.paging.core.channel.PagingChannel;
import com.github.yoep.paging.core.channel.Subscription;
import com.github.yoep.paging.core.environment.PlatformProvider;
import com.github.yoep.paging.core.model.FooterMarker;
import com.github.yoep.paging.core.model.ItemEntry;
import com.github.yoep.paging.core.model.ListEntry;
import com.github.yoep.paging.core.model.LoadingState;
import com.github.yoep.paging.core.view.EntrySource;
import com.github.yoep.paging.core.view.PagingView;
import com.github.yoep.paging.core.view.ScrollListener;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The paging controller owns the entries of an infinitely scrolling list.
 * <p>
 * It requests the next page from its {@link PageLoader} when the last entry becomes visible within the {@link PagingView} and
 * applies the emitted items and loading states to the entries. While a page is being loaded, or has failed to load, the last entry
 * of the list is a footer entry which represents the {@link LoadingState}.
 * <p>
 * The emissions of the page loader are received through two channels (items and loading state) which deliver on the renderer
 * thread of the {@link PlatformProvider}. Emissions of a replaced loader, or of a pagination epoch which has been reset in the
 * meantime, are discarded when they're delivered. All methods of this controller should be invoked from that renderer thread.
 *
 * @param <T> The application item type.
 */
@Slf4j
@ToString(of = {"loadingState", "hasFooter", "disposed"})
public class PagingController<T> implements EntrySource<T>, AutoCloseable {
    static final String ITEMS_CHANNEL = "items";
    static final String LOADING_STATE_CHANNEL = "loadingState";

    private final List<ListEntry<T>> entries = new ArrayList<>();
    private final Set<T> knownItems = new HashSet<>();
    private final PagingChannel<PageEmission<List<T>>> itemsChannel;
    private final PagingChannel<PageEmission<LoadingState>> loadingStateChannel;
    private final ScrollListener scrollListener = this::onScrollPositionChanged;
    private final boolean eagerStart;

    private PageLoader<T> pageLoader;
    private PagingView<T> view;
    private Subscription itemsSubscription;
    private Subscription loadingStateSubscription;
    private LoadingState loadingState = LoadingState.DONE;
    private boolean hasFooter;
    private boolean disposed;

    //region Constructors

    public PagingController(PlatformProvider platformProvider) {
        this(platformProvider, true);
    }

    /**
     * Create a new paging controller.
     *
     * @param platformProvider The provider of the renderer thread.
     * @param eagerStart       Indicates if the first page should be loaded when a view is attached.
     */
    public PagingController(PlatformProvider platformProvider, boolean eagerStart) {
        Objects.requireNonNull(platformProvider, "platformProvider cannot be null");
        this.itemsChannel = new PagingChannel<>(ITEMS_CHANNEL, platformProvider);
        this.loadingStateChannel = new PagingChannel<>(LOADING_STATE_CHANNEL, platformProvider);
        this.eagerStart = eagerStart;
        init();
    }

    //endregion

    //region Properties

    @Override
    public int getItemCount() {
        return entries.size();
    }

    @Override
    public Optional<ListEntry<T>> getItem(int position) {
        if (position < 0 || position >= entries.size())
            return Optional.empty();

        return Optional.of(entries.get(position));
    }

    /**
     * Get all entries of the list, including the footer entry when present.
     *
     * @return Returns an unmodifiable copy of the entries.
     */
    public List<ListEntry<T>> getEntries() {
        return List.copyOf(entries);
    }

    /**
     * Get the application items of the list.
     *
     * @return Returns an unmodifiable copy of the items, without the footer.
     */
    public List<T> getItems() {
        return entries.stream()
                .filter(e -> e.getType() == ListEntry.Type.ITEM)
                .map(e -> ((ItemEntry<T>) e).item())
                .toList();
    }

    public LoadingState getLoadingState() {
        return loadingState;
    }

    /**
     * Check if the last entry of the list is currently a footer entry.
     *
     * @return Returns true when a footer is present, else false.
     */
    public boolean hasFooter() {
        return hasFooter;
    }

    public boolean isDisposed() {
        return disposed;
    }

    public Optional<PageLoader<T>> getPageLoader() {
        return Optional.ofNullable(pageLoader);
    }

    /**
     * Bind the page loader which retrieves the pages of this list.
     * Passing {@code null} unbinds the current loader, after which no more pages are requested.
     *
     * @param pageLoader The page loader to bind, or null.
     */
    public void setPageLoader(PageLoader<T> pageLoader) {
        if (this.pageLoader != null && this.pageLoader != pageLoader)
            this.pageLoader.unbind();

        this.pageLoader = pageLoader;

        if (pageLoader != null && !disposed) {
            log.debug("Binding page loader {}", pageLoader);
            pageLoader.bind(new ControllerSink(pageLoader));
        }
    }

    //endregion

    //region Methods

    /**
     * Attach this controller to the given view.
     * The controller starts listening to the scroll position of the view and, when configured for an eager start, loads the first
     * page.
     *
     * @param view The view to attach to.
     * @throws IllegalStateException Is thrown when this controller has been disposed.
     */
    public void attachTo(PagingView<T> view) {
        Objects.requireNonNull(view, "view cannot be null");
        if (disposed)
            throw new IllegalStateException("Paging controller has been disposed");

        if (this.view != null)
            detach();

        log.debug("Attaching paging controller to view {}", view);
        this.view = view;
        subscribe();
        view.addScrollListener(scrollListener);
        view.onAttached(this);
        settleLoadingState();

        if (eagerStart && pageLoader != null && !pageLoader.isReachedEnd())
            pageLoader.fetchNextPage();
    }

    /**
     * Detach this controller from its current view.
     * This releases the channel subscriptions, emissions received while detached are dropped.
     * A page which completes while detached is settled on the next attach.
     */
    public void detach() {
        unsubscribe();

        if (view == null)
            return;

        log.debug("Detaching paging controller from view {}", view);
        view.removeScrollListener(scrollListener);
        view.onDetached();
        view = null;
    }

    /**
     * Handle a new scroll position of the view.
     * When the last entry is visible, the next page is requested from the page loader.
     *
     * @param lastVisibleIndex The index of the last visible entry.
     */
    public void onScrollPositionChanged(int lastVisibleIndex) {
        if (disposed || lastVisibleIndex != entries.size() - 1)
            return;

        if (isFetching()) {
            log.trace("Page is already being loaded, ignoring scroll to end");
            return;
        }

        if (pageLoader == null || pageLoader.isReachedEnd()) {
            updateLoadingState(LoadingState.DONE);
        } else {
            pageLoader.fetchNextPage();
        }
    }

    /**
     * Add the given item at the end of the list.
     *
     * @param item The item to add.
     * @return Returns true when the item has been added, false when it was already present.
     */
    public boolean addItem(T item) {
        Objects.requireNonNull(item, "item cannot be null");
        return insertAt(contentSize(), item);
    }

    /**
     * Add the items which are not yet present at the end of the list.
     *
     * @param items The items to add.
     * @return Returns the number of items which have been added.
     */
    public int addItems(Collection<? extends T> items) {
        Objects.requireNonNull(items, "items cannot be null");
        var newItems = new LinkedHashSet<T>();

        for (T item : items) {
            Objects.requireNonNull(item, "items cannot contain null");
            if (!knownItems.contains(item))
                newItems.add(item);
        }

        if (newItems.isEmpty()) {
            log.trace("All {} items are already present, ignoring batch", items.size());
            return 0;
        }

        var newEntries = newItems.stream()
                .map(ListEntry::<T>item)
                .toList();
        var wasEmpty = contentSize() == 0;
        var start = contentSize();
        knownItems.addAll(newItems);
        entries.addAll(start, newEntries);
        log.trace("Added {} items at position {}", newEntries.size(), start);
        notifyView(e -> e.notifyRangeInserted(start, newEntries.size()));

        if (wasEmpty)
            getPageLoader().ifPresent(PageLoader::hidePlaceholder);

        return newEntries.size();
    }

    /**
     * Insert the given item at the given position.
     * The item is rejected when it's already present or the position is outside the items of the list.
     *
     * @param item     The item to insert.
     * @param position The position to insert the item at.
     * @return Returns true when the item has been inserted, else false.
     */
    public boolean insertItem(T item, int position) {
        Objects.requireNonNull(item, "item cannot be null");
        if (position < 0 || position > contentSize()) {
            log.debug("Position {} is out of range, ignoring insert of {}", position, item);
            return false;
        }

        return insertAt(position, item);
    }

    /**
     * Remove the item at the given position.
     * Removal is only allowed while no page is being loaded.
     *
     * @param position The position of the item to remove.
     * @return Returns true when the item has been removed, else false.
     */
    public boolean removeItemAt(int position) {
        if (loadingState != LoadingState.DONE || isFetching()) {
            log.debug("List is {}, ignoring removal of position {}", loadingState, position);
            return false;
        }
        if (position < 0 || position >= entries.size() || entries.get(position).isFooter()) {
            log.debug("Position {} is out of range, ignoring removal", position);
            return false;
        }

        var entry = (ItemEntry<T>) entries.remove(position);
        knownItems.remove(entry.item());
        log.trace("Removed item {} at position {}", entry.item(), position);
        notifyView(e -> e.notifyRemoved(position));

        if (entries.isEmpty())
            getPageLoader().ifPresent(PageLoader::showPlaceholder);

        return true;
    }

    /**
     * Remove all entries of the list and load the first page again.
     * Emissions of the pagination before the reload which are still awaiting delivery are discarded.
     */
    public void clearAndReload() {
        log.debug("Clearing the list and reloading the first page");
        entries.clear();
        knownItems.clear();
        hasFooter = false;
        loadingState = LoadingState.DONE;
        notifyView(PagingView::notifyReset);

        if (pageLoader != null) {
            pageLoader.resetPosition();
            pageLoader.fetchNextPage();
        }
    }

    /**
     * Dispose this controller.
     * The view is detached and all emissions of the page loader received afterwards are dropped.
     */
    @Override
    public void close() {
        if (disposed)
            return;

        log.debug("Disposing paging controller");
        detach();
        disposed = true;

        if (pageLoader != null)
            pageLoader.unbind();
    }

    //endregion

    //region Functions

    private void init() {
        subscribe();
    }

    private void subscribe() {
        if (itemsSubscription == null || itemsSubscription.isUnsubscribed())
            itemsSubscription = itemsChannel.subscribe(this::onItemsEmitted);
        if (loadingStateSubscription == null || loadingStateSubscription.isUnsubscribed())
            loadingStateSubscription = loadingStateChannel.subscribe(this::onLoadingStateEmitted);
    }

    private void unsubscribe() {
        if (itemsSubscription != null)
            itemsSubscription.unsubscribe();
        if (loadingStateSubscription != null)
            loadingStateSubscription.unsubscribe();
    }

    private void onItemsEmitted(PageEmission<List<T>> emission) {
        if (isCurrent(emission))
            onItemsLoaded(emission.value());
    }

    private void onLoadingStateEmitted(PageEmission<LoadingState> emission) {
        if (isCurrent(emission))
            onLoadingStateChanged(emission.value());
    }

    private boolean isCurrent(PageEmission<?> emission) {
        if (pageLoader == null || emission.source() != pageLoader) {
            log.trace("Dropping {} of an unbound page loader", emission.value());
            return false;
        }
        if (emission.epoch() != pageLoader.getEpoch()) {
            log.trace("Dropping {} of pagination epoch {}, the list has been reloaded", emission.value(), emission.epoch());
            return false;
        }

        return true;
    }

    void onItemsLoaded(List<T> items) {
        if (disposed)
            return;

        addItems(items);
    }

    void onLoadingStateChanged(LoadingState state) {
        if (disposed)
            return;

        updateLoadingState(state);

        if (state == LoadingState.DONE && contentSize() == 0)
            getPageLoader().ifPresent(PageLoader::showPlaceholder);
    }

    private boolean isFetching() {
        return pageLoader != null && pageLoader.isLoading();
    }

    /**
     * Settle a loading state of which the terminal emission has been missed, e.g. because the page completed while detached.
     */
    private void settleLoadingState() {
        if (loadingState == LoadingState.DONE || isFetching())
            return;

        var state = getPageLoader()
                .flatMap(PageLoader::getLastError)
                .map(e -> LoadingState.ERROR)
                .orElse(LoadingState.DONE);

        if (state != loadingState) {
            log.debug("Settling stale loading state {} to {}", loadingState, state);
            onLoadingStateChanged(state);
        }
    }

    private void updateLoadingState(LoadingState state) {
        log.trace("Updating loading state from {} to {}", loadingState, state);
        switch (state) {
            case LOADING, ERROR -> showFooter(FooterMarker.from(state));
            case DONE -> removeFooter();
        }

        loadingState = state;
    }

    private void showFooter(FooterMarker marker) {
        hasFooter = true;
        var footerIndex = footerIndex();

        if (footerIndex >= 0) {
            entries.set(footerIndex, ListEntry.footer(marker));
            notifyView(e -> e.notifyChanged(footerIndex));
        } else {
            entries.add(ListEntry.footer(marker));
            var index = entries.size() - 1;
            notifyView(e -> e.notifyInserted(index));
        }
    }

    private void removeFooter() {
        if (!hasFooter)
            return;

        hasFooter = false;
        var footerIndex = footerIndex();

        if (footerIndex >= 0) {
            entries.remove(footerIndex);
            notifyView(e -> e.notifyRemoved(footerIndex));
        }
    }

    private boolean insertAt(int position, T item) {
        if (!knownItems.add(item)) {
            log.trace("Item {} is already present, ignoring insert", item);
            return false;
        }

        var wasEmpty = contentSize() == 0;
        entries.add(position, ListEntry.item(item));
        log.trace("Inserted item {} at position {}", item, position);
        notifyView(e -> e.notifyInserted(position));

        if (wasEmpty)
            getPageLoader().ifPresent(PageLoader::hidePlaceholder);

        return true;
    }

    /**
     * Get the index of the footer entry.
     *
     * @return Returns the index of the footer, or -1 when the last entry is not a footer.
     */
    private int footerIndex() {
        var lastIndex = entries.size() - 1;
        return lastIndex >= 0 && entries.get(lastIndex).isFooter() ? lastIndex : -1;
    }

    /**
     * @return Returns the number of entries without the footer.
     */
    private int contentSize() {
        return footerIndex() >= 0 ? entries.size() - 1 : entries.size();
    }

    private void notifyView(Consumer<PagingView<T>> action) {
        if (view == null)
            return;

        try {
            action.accept(view);
        } catch (Exception ex) {
            log.warn("Failed to notify view {}, {}", view, ex.getMessage(), ex);
        }
    }

    //endregion

    private class ControllerSink implements PageSink<T> {
        private final PageLoader<T> source;

        private ControllerSink(PageLoader<T> source) {
            this.source = source;
        }

        @Override
        public void emitLoadingState(int epoch, LoadingState state) {
            loadingStateChannel.publish(new PageEmission<>(source, epoch, state));
        }

        @Override
        public void emitItems(int epoch, List<T> items) {
            itemsChannel.publish(new PageEmission<>(source, epoch, items));
        }
    }
}
