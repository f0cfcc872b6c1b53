package com.github.yoep.paging.core.model;

import java.util.Objects;

/**
 * A {@link ListEntry} which represents the loading progress at the end of the collection.
 *
 * @param marker The current footer marker.
 * @param <T>    The application item type of the collection.
 */
public record FooterEntry<T>(FooterMarker marker) implements ListEntry<T> {
    public FooterEntry {
        Objects.requireNonNull(marker, "marker cannot be null");
    }

    @Override
    public Type getType() {
        return Type.FOOTER;
    }
}
