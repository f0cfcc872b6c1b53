package com.github.yoep.paging.core.model;

/**
 * The request for a single page of items.
 *
 * @param position The position of the first item to retrieve.
 * @param pageSize The number of items which should be retrieved.
 */
public record PageRequest(int position, int pageSize) {
}
