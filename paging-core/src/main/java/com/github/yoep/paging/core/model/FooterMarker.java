package com.github.yoep.paging.core.model;

import java.util.Objects;

/**
 * The marker which is displayed as the last entry of a paginated collection while a page is being loaded or has failed to load.
 */
public enum FooterMarker {
    LOADING,
    ERROR;

    /**
     * Get the footer marker for the given loading state.
     *
     * @param state The loading state to convert.
     * @return Returns the footer marker of the state.
     * @throws IllegalArgumentException Is thrown when the state is {@link LoadingState#DONE} as it has no footer.
     */
    public static FooterMarker from(LoadingState state) {
        Objects.requireNonNull(state, "state cannot be null");
        return switch (state) {
            case LOADING -> LOADING;
            case ERROR -> ERROR;
            case DONE -> throw new IllegalArgumentException("Loading state DONE has no footer marker");
        };
    }
}
