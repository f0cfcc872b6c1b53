package com.github.yoep.paging.core.view;

@FunctionalInterface
public interface ScrollListener {
    /**
     * Invoked when the scroll position of the view has changed.
     *
     * @param lastVisibleIndex The index of the last entry which is visible within the view.
     */
    void onScrollPositionChanged(int lastVisibleIndex);
}
