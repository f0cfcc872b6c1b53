package com.github.yoep.paging.core;

/**
 * A value emitted by a {@link PageLoader}, tagged with the loader and the pagination epoch it originates from.
 *
 * @param source The page loader which emitted the value.
 * @param epoch  The pagination epoch of the loader at the time of the emission.
 * @param value  The emitted value.
 * @param <V>    The value type.
 */
record PageEmission<V>(PageLoader<?> source, int epoch, V value) {
}
