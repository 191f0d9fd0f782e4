package com.example.boundedcache.memory;

/**
 * Explicit size function for payload types the {@link MemoryEstimator} cannot decompose.
 *
 * <p>The returned value is taken as the complete footprint of the value in bytes: the estimator
 * does not look inside a weighed value. Results must be non-negative.
 *
 * <pre>{@code
 * MemoryEstimator estimator = MemoryEstimator.builder()
 *     .weigher(ByteBuffer.class, buffer -> MemoryEstimator.OBJECT_HEADER + buffer.capacity())
 *     .build();
 * }</pre>
 *
 * @param <T> the weighed type
 */
@FunctionalInterface
public interface Weigher<T> {

    long weigh(T value);
}
