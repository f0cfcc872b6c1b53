package com.github.yoep.paging.core.view;

/**
 * The view which renders a paginated collection.
 * The view is informed about each mutation of the collection through the notify methods and reports its scroll position to the
 * registered {@link ScrollListener}'s.
 *
 * @param <T> The application item type.
 */
public interface PagingView<T> {
    /**
     * Notify the view that an entry has been inserted.
     *
     * @param index The index of the inserted entry.
     */
    void notifyInserted(int index);

    /**
     * Notify the view that a consecutive range of entries has been inserted.
     *
     * @param start The index of the first inserted entry.
     * @param count The number of inserted entries.
     */
    void notifyRangeInserted(int start, int count);

    /**
     * Notify the view that the entry at the given index has been replaced.
     *
     * @param index The index of the changed entry.
     */
    void notifyChanged(int index);

    /**
     * Notify the view that an entry has been removed.
     *
     * @param index The index the entry had before its removal.
     */
    void notifyRemoved(int index);

    /**
     * Notify the view that the complete collection has changed.
     */
    void notifyReset();

    /**
     * Register a new scroll listener on this view.
     *
     * @param listener The listener to register.
     */
    void addScrollListener(ScrollListener listener);

    /**
     * Remove a registered scroll listener from this view.
     *
     * @param listener The listener to remove.
     */
    void removeScrollListener(ScrollListener listener);

    /**
     * Invoked when the view has been attached to a paginated collection.
     *
     * @param source The entries of the collection.
     */
    default void onAttached(EntrySource<T> source) {
        // no-op
    }

    /**
     * Invoked when the view has been detached from its paginated collection.
     */
    default void onDetached() {
        // no-op
    }
}
