package com.github.yoep.paging.core.model;

/**
 * An entry within a paginated collection.
 * An entry is either an application item or the footer which represents the current loading progress.
 *
 * @param <T> The application item type.
 */
public interface ListEntry<T> {
    /**
     * Get the type of this entry.
     *
     * @return Returns the entry type.
     */
    Type getType();

    /**
     * Check if this entry is the footer of the collection.
     *
     * @return Returns true if this entry is a footer, else false.
     */
    default boolean isFooter() {
        return getType() == Type.FOOTER;
    }

    /**
     * Create a new entry for the given item.
     *
     * @param item The application item.
     * @param <T>  The application item type.
     * @return Returns the item entry.
     */
    static <T> ItemEntry<T> item(T item) {
        return new ItemEntry<>(item);
    }

    /**
     * Create a new footer entry for the given marker.
     *
     * @param marker The footer marker.
     * @param <T>    The application item type of the collection.
     * @return Returns the footer entry.
     */
    static <T> FooterEntry<T> footer(FooterMarker marker) {
        return new FooterEntry<>(marker);
    }

    enum Type {
        ITEM,
        FOOTER
    }
}
