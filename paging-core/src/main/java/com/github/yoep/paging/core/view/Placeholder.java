package com.github.yoep.paging.core.view;

/**
 * The empty-state of a paginated collection which is shown when the collection contains no items.
 */
public interface Placeholder {
    void showPlaceholder();

    void hidePlaceholder();
}
