package com.github.yoep.paging.core.view;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Abstract implementation of {@link PagingView} which manages the registered {@link ScrollListener}'s.
 *
 * @param <T> The application item type.
 */
@Slf4j
public abstract class AbstractPagingView<T> implements PagingView<T> {
    protected final Queue<ScrollListener> listeners = new ConcurrentLinkedQueue<>();

    @Override
    public void addScrollListener(ScrollListener listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        listeners.add(listener);
    }

    @Override
    public void removeScrollListener(ScrollListener listener) {
        listeners.remove(listener);
    }

    /**
     * Inform the registered listeners about a new scroll position of the view.
     *
     * @param lastVisibleIndex The index of the last visible entry.
     */
    protected void onScrolled(int lastVisibleIndex) {
        listeners.forEach(e -> {
            try {
                e.onScrollPositionChanged(lastVisibleIndex);
            } catch (Exception ex) {
                log.warn("Failed to invoke scroll listener {}, {}", e, ex.getMessage(), ex);
            }
        });
    }
}
