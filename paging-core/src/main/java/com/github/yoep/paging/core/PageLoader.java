package com.github.yoep.paging.core;

import com.github.yoep.paging.core.model.LoadingState;
import com.github.yoep.paging.core.model.PagePosition;
import com.github.yoep.paging.core.model.PageRequest;
import com.github.yoep.paging.core.view.Placeholder;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * The page loader keeps track of the pagination position of a paginated collection and retrieves the next page through the
 * {@link PageFetcher} of the application.
 * <p>
 * Each invocation of {@link #fetchNextPage()} emits {@link LoadingState#LOADING}, followed by the retrieved items (if any) and
 * {@link LoadingState#DONE}, or by {@link LoadingState#ERROR} when the page couldn't be retrieved.
 * Pages which complete after {@link #resetPosition()} belong to an older epoch and are discarded without any emission.
 * Only one page is retrieved at a time, additional fetch invocations while a page is being retrieved are ignored.
 *
 * @param <T> The application item type.
 */
@Slf4j
@ToString(of = {"offset", "pageSize", "currentPosition", "reachedEnd"})
public class PageLoader<T> {
    private final PageFetcher<T> fetcher;
    private final Object lock = new Object();

    private int offset;
    private int pageSize;
    private int currentPosition;
    private boolean reachedEnd;
    /**
     * Indicates that no page has been requested yet within the current pagination epoch.
     */
    private boolean firstLoad = true;
    /**
     * Increased on each reset, results of older epochs are discarded.
     */
    private int epoch;
    private Placeholder placeholder;
    private PageSink<T> sink;
    private CompletableFuture<List<T>> currentRequest;
    private PageLoadException lastError;

    //region Constructors

    public PageLoader(PageFetcher<T> fetcher) {
        Objects.requireNonNull(fetcher, "fetcher cannot be null");
        this.fetcher = fetcher;
    }

    public PageLoader(PageFetcher<T> fetcher, int offset, int pageSize) {
        this(fetcher);
        configure(offset, pageSize, null);
    }

    //endregion

    //region Properties

    public int getOffset() {
        synchronized (lock) {
            return offset;
        }
    }

    public int getPageSize() {
        synchronized (lock) {
            return pageSize;
        }
    }

    public int getCurrentPosition() {
        synchronized (lock) {
            return currentPosition;
        }
    }

    /**
     * Check if the end of the data source has been reached.
     *
     * @return Returns true when the last retrieved page contained fewer items than the page size.
     */
    public boolean isReachedEnd() {
        synchronized (lock) {
            return reachedEnd;
        }
    }

    /**
     * Check if a page is currently being retrieved.
     *
     * @return Returns true when a fetch is in progress, else false.
     */
    public boolean isLoading() {
        synchronized (lock) {
            return currentRequest != null && !currentRequest.isDone();
        }
    }

    /**
     * Get a snapshot of the current pagination position.
     *
     * @return Returns the pagination position.
     */
    public PagePosition getPosition() {
        synchronized (lock) {
            return new PagePosition(offset, pageSize, currentPosition, reachedEnd);
        }
    }

    /**
     * Get the failure of the last page retrieval.
     * The error is cleared once a page has been retrieved successfully or the position has been reset.
     *
     * @return Returns the last failure if the last retrieval failed, else {@link Optional#empty()}.
     */
    public Optional<PageLoadException> getLastError() {
        synchronized (lock) {
            return Optional.ofNullable(lastError);
        }
    }

    //endregion

    //region Methods

    /**
     * Update the configuration of this loader.
     * Only the given (non-null) values are updated.
     * The offset only moves the current position when no page has been requested yet, an ongoing pagination is never rewound.
     *
     * @param offset      The new offset, or null to keep the current one.
     * @param pageSize    The new page size, or null to keep the current one.
     * @param placeholder The new placeholder, or null to keep the current one.
     */
    public void configure(Integer offset, Integer pageSize, Placeholder placeholder) {
        synchronized (lock) {
            if (offset != null) {
                Assert.isTrue(offset >= 0, "offset must be zero or positive");
                this.offset = offset;

                if (firstLoad)
                    this.currentPosition = offset;
            }
            if (pageSize != null) {
                Assert.isTrue(pageSize >= 0, "pageSize must be zero or positive");
                this.pageSize = pageSize;
            }
            if (placeholder != null) {
                this.placeholder = placeholder;
            }
        }

        log.debug("Page loader has been configured to {}", this);
    }

    /**
     * Retrieve the next page of items.
     * This method is ignored when the loader is not bound to a paginated collection or a page is already being retrieved.
     */
    public void fetchNextPage() {
        PageSink<T> target;
        PageRequest request = null;
        int requestEpoch = 0;

        synchronized (lock) {
            if (sink == null) {
                log.debug("Page loader is not bound to a collection, ignoring fetch");
                return;
            }
            if (currentRequest != null && !currentRequest.isDone()) {
                log.debug("Page {} is still being retrieved, ignoring fetch", currentPosition);
                return;
            }

            target = sink;
            requestEpoch = epoch;

            if (!reachedEnd) {
                firstLoad = false;
                request = new PageRequest(currentPosition, pageSize);
                // reserve the slot before the fetcher is invoked as it might complete synchronously
                currentRequest = new CompletableFuture<>();
            }
        }

        if (request == null) {
            log.trace("End of the data source has been reached, ignoring fetch");
            target.emitLoadingState(requestEpoch, LoadingState.DONE);
            return;
        }

        startFetch(request, requestEpoch, target);
    }

    /**
     * Advance the current position with the given number of loaded items.
     * When fewer items than the page size were loaded, the end of the data source has been reached.
     *
     * @param itemsLoaded The number of items which have been loaded.
     */
    public void advancePosition(int itemsLoaded) {
        Assert.isTrue(itemsLoaded >= 0, "itemsLoaded must be zero or positive");
        synchronized (lock) {
            advance(itemsLoaded);
        }
    }

    /**
     * Reset the pagination to the offset.
     * A page which is still being retrieved is cancelled and its result is discarded.
     */
    public void resetPosition() {
        CompletableFuture<List<T>> pendingRequest;

        synchronized (lock) {
            pendingRequest = currentRequest;
            currentRequest = null;
            currentPosition = offset;
            reachedEnd = false;
            firstLoad = true;
            lastError = null;
            epoch++;
        }

        if (pendingRequest != null && !pendingRequest.isDone()) {
            log.debug("Cancelling the page which is still being retrieved");
            pendingRequest.cancel(true);
        }
    }

    public void showPlaceholder() {
        getPlaceholder().ifPresent(Placeholder::showPlaceholder);
    }

    public void hidePlaceholder() {
        getPlaceholder().ifPresent(Placeholder::hidePlaceholder);
    }

    //endregion

    //region Functions

    int getEpoch() {
        synchronized (lock) {
            return epoch;
        }
    }

    void bind(PageSink<T> sink) {
        Objects.requireNonNull(sink, "sink cannot be null");
        synchronized (lock) {
            this.sink = sink;
        }
    }

    void unbind() {
        synchronized (lock) {
            this.sink = null;
        }
    }

    private Optional<Placeholder> getPlaceholder() {
        synchronized (lock) {
            return Optional.ofNullable(placeholder);
        }
    }

    private void startFetch(PageRequest request, int requestEpoch, PageSink<T> target) {
        log.debug("Retrieving page {}", request);
        target.emitLoadingState(requestEpoch, LoadingState.LOADING);

        CompletableFuture<List<T>> future;
        try {
            future = Objects.requireNonNull(fetcher.fetch(request), "fetcher returned no page future");
        } catch (Exception ex) {
            future = CompletableFuture.failedFuture(ex);
        }

        synchronized (lock) {
            if (requestEpoch == epoch)
                currentRequest = future;
        }

        future.whenComplete((items, throwable) -> onFetchCompleted(request, requestEpoch, target, items, throwable));
    }

    private void onFetchCompleted(PageRequest request, int requestEpoch, PageSink<T> target, List<T> items, Throwable throwable) {
        if (throwable != null) {
            onFetchFailed(request, requestEpoch, target, unwrap(throwable));
            return;
        }

        try {
            var batch = items != null ? List.copyOf(items) : List.<T>of();

            if (!advanceWithinEpoch(requestEpoch, batch.size())) {
                log.debug("Discarding page {} as the pagination has been reset", request);
                return;
            }

            log.debug("Retrieved {} items for page {}", batch.size(), request);
            if (!batch.isEmpty())
                target.emitItems(requestEpoch, batch);

            if (isCurrentEpoch(requestEpoch))
                target.emitLoadingState(requestEpoch, LoadingState.DONE);
        } catch (Exception ex) {
            onFetchFailed(request, requestEpoch, target, ex);
        }
    }

    private void onFetchFailed(PageRequest request, int requestEpoch, PageSink<T> target, Throwable cause) {
        var error = cause instanceof PageLoadException pageLoadException
                ? pageLoadException
                : new PageLoadException(request, "Failed to retrieve page " + request, cause);

        synchronized (lock) {
            if (requestEpoch != epoch) {
                log.debug("Discarding failure of page {} as the pagination has been reset", request);
                return;
            }

            lastError = error;
        }

        if (cause instanceof CancellationException) {
            log.debug("Retrieval of page {} has been cancelled", request);
        } else {
            log.warn("Failed to retrieve page {}, {}", request, cause.getMessage(), cause);
        }

        target.emitLoadingState(requestEpoch, LoadingState.ERROR);
    }

    /**
     * Advance the position, but only when the pagination epoch hasn't changed since the page was requested.
     *
     * @return Returns true when the position has been advanced, false when the epoch is stale.
     */
    private boolean advanceWithinEpoch(int requestEpoch, int itemsLoaded) {
        synchronized (lock) {
            if (requestEpoch != epoch)
                return false;

            lastError = null;
            advance(itemsLoaded);
            return true;
        }
    }

    private boolean isCurrentEpoch(int requestEpoch) {
        synchronized (lock) {
            return requestEpoch == epoch;
        }
    }

    private void advance(int itemsLoaded) {
        currentPosition += itemsLoaded;

        if (itemsLoaded < pageSize) {
            log.debug("Page contained {} of {} items, end of the data source has been reached", itemsLoaded, pageSize);
            reachedEnd = true;
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        if (throwable instanceof CompletionException && throwable.getCause() != null)
            return throwable.getCause();

        return throwable;
    }

    //endregion
}
