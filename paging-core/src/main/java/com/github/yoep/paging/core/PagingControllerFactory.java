package com.github.yoep.paging.core;

import com.github.yoep.paging.core.config.properties.PagingProperties;
import com.github.yoep.paging.core.environment.PlatformProvider;
import com.github.yoep.paging.core.view.Placeholder;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Factory which creates {@link PagingController}'s based on the configured {@link PagingProperties}.
 */
@Slf4j
public class PagingControllerFactory {
    private final PagingProperties properties;
    private final PlatformProvider platformProvider;

    public PagingControllerFactory(PagingProperties properties, PlatformProvider platformProvider) {
        Objects.requireNonNull(properties, "properties cannot be null");
        Objects.requireNonNull(platformProvider, "platformProvider cannot be null");
        this.properties = properties;
        this.platformProvider = platformProvider;
    }

    /**
     * Create a new paging controller which retrieves its pages through the given fetcher.
     *
     * @param fetcher The fetcher of the pages.
     * @param <T>     The application item type.
     * @return Returns the new paging controller.
     */
    public <T> PagingController<T> create(PageFetcher<T> fetcher) {
        return create(fetcher, null);
    }

    /**
     * Create a new paging controller which retrieves its pages through the given fetcher.
     *
     * @param fetcher     The fetcher of the pages.
     * @param placeholder The empty-state of the list, or null.
     * @param <T>         The application item type.
     * @return Returns the new paging controller.
     */
    public <T> PagingController<T> create(PageFetcher<T> fetcher, Placeholder placeholder) {
        Objects.requireNonNull(fetcher, "fetcher cannot be null");
        var loader = new PageLoader<>(fetcher);
        loader.configure(properties.getOffset(), properties.getPageSize(), placeholder);

        var controller = new PagingController<T>(platformProvider, properties.isEagerStart());
        controller.setPageLoader(loader);

        log.trace("Created new paging controller with {}", properties);
        return controller;
    }
}
