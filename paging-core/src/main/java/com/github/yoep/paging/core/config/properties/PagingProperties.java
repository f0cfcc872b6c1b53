package com.github.yoep.paging.core.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.PositiveOrZero;

@Data
@Validated
@ConfigurationProperties("paging")
public class PagingProperties {
    public static final int DEFAULT_PAGE_SIZE = 20;

    /**
     * The position at which the pagination starts.
     */
    @PositiveOrZero
    private int offset;
    /**
     * The number of items which are requested per page.
     */
    @PositiveOrZero
    private int pageSize = DEFAULT_PAGE_SIZE;
    /**
     * Indicates if the first page is loaded as soon as a view is attached.
     */
    private boolean eagerStart = true;
}
