package com.github.yoep.paging.core.model;

/**
 * The loading state of a paginated collection.
 * Any state other than {@link #DONE} is represented by a footer entry at the end of the collection.
 */
public enum LoadingState {
    DONE,
    LOADING,
    ERROR
}
