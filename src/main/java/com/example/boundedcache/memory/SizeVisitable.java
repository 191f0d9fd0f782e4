package com.example.boundedcache.memory;

import java.util.function.Consumer;

/**
 * Lets a composite payload describe its own layout to the {@link MemoryEstimator}.
 *
 * <p>{@link #shallowSize()} is the object's own footprint: header, primitive fields and one
 * {@link MemoryEstimator#REFERENCE_SIZE} slot per reference field. {@link #visitReferences}
 * hands every referenced object (nulls allowed) to the visitor so it can be sized in turn.
 * Back-references are fine; the estimator counts each object once.
 */
public interface SizeVisitable {

    long shallowSize();

    void visitReferences(Consumer<Object> visitor);
}
