package com.github.yoep.paging.core;

import com.github.yoep.paging.core.model.PageRequest;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The application specific data access which retrieves a single page of items.
 * The retrieval should be executed off the renderer thread.
 *
 * @param <T> The application item type.
 */
@FunctionalInterface
public interface PageFetcher<T> {
    /**
     * Retrieve the page of items for the given request.
     * A page which contains fewer items than {@link PageRequest#pageSize()} indicates the end of the data source.
     *
     * @param request The page to retrieve.
     * @return Returns the future of the page items, completed exceptionally when the page couldn't be retrieved.
     */
    CompletableFuture<List<T>> fetch(PageRequest request);
}
