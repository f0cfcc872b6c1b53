package com.github.yoep.paging.ui.view.controls;

import javafx.scene.Node;

/**
 * Factory which creates the graphic of an application item within an {@link InfiniteListView}.
 *
 * @param <T> The application item type.
 */
@FunctionalInterface
public interface ItemFactory<T> {
    /**
     * Create the graphic for the given item.
     * The factory is invoked each time a list cell is updated with a new item.
     *
     * @param item The item to render.
     * @return Returns the graphic node of the item.
     */
    Node createNode(T item);
}
