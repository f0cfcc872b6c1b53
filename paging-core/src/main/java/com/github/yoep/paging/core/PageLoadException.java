package com.github.yoep.paging.core;

import com.github.yoep.paging.core.model.PageRequest;
import lombok.Getter;

/**
 * Indicates that a page of items couldn't be retrieved.
 */
@Getter
public class PageLoadException extends RuntimeException {
    private final PageRequest request;

    public PageLoadException(PageRequest request, String message) {
        super(message);
        this.request = request;
    }

    public PageLoadException(PageRequest request, String message, Throwable cause) {
        super(message, cause);
        this.request = request;
    }
}
