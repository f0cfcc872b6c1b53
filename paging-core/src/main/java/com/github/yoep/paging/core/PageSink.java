package com.github.yoep.paging.core;

import com.github.yoep.paging.core.model.LoadingState;

import java.util.List;

/**
 * Receiver of the emissions of a {@link PageLoader}.
 * Each emission carries the pagination epoch of the loader in which it was produced.
 *
 * @param <T> The application item type.
 */
interface PageSink<T> {
    void emitLoadingState(int epoch, LoadingState state);

    void emitItems(int epoch, List<T> items);
}
