package com.github.yoep.paging.ui.view.controls;

import javafx.scene.layout.Pane;

import java.util.function.Supplier;

/**
 * Supplies the graphic of the loading footer of an {@link InfiniteListView}.
 * A new pane is requested each time a cell starts rendering the loading footer.
 */
@FunctionalInterface
public interface LoaderFactory extends Supplier<Pane> {
}
