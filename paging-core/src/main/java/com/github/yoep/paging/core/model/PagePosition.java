package com.github.yoep.paging.core.model;

/**
 * Snapshot of the pagination state of a page loader.
 *
 * @param offset          The position at which the pagination starts.
 * @param pageSize        The number of items requested per page.
 * @param currentPosition The position of the next page to retrieve.
 * @param reachedEnd      Indicates if the data source has been exhausted.
 */
public record PagePosition(int offset, int pageSize, int currentPosition, boolean reachedEnd) {
}
