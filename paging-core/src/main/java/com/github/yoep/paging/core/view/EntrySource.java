package com.github.yoep.paging.core.view;

import com.github.yoep.paging.core.model.ListEntry;

import java.util.Optional;

/**
 * Read access to the entries of a paginated collection.
 *
 * @param <T> The application item type.
 */
public interface EntrySource<T> {
    /**
     * Get the total number of entries, including the footer entry when present.
     *
     * @return Returns the number of entries.
     */
    int getItemCount();

    /**
     * Get the entry at the given position.
     *
     * @param position The position of the entry.
     * @return Returns the entry when the position is within range, else {@link Optional#empty()}.
     */
    Optional<ListEntry<T>> getItem(int position);
}
