package com.github.yoep.paging.core.model;

import java.util.Objects;

/**
 * A {@link ListEntry} which holds an application item.
 *
 * @param item The application item.
 * @param <T>  The application item type.
 */
public record ItemEntry<T>(T item) implements ListEntry<T> {
    public ItemEntry {
        Objects.requireNonNull(item, "item cannot be null");
    }

    @Override
    public Type getType() {
        return Type.ITEM;
    }
}
