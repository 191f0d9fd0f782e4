package com.example.boundedcache.memory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates the deep byte footprint of a value.
 *
 * <p>Values are dispatched over a small set of shapes: scalar, text, sequence, mapping,
 * reference and record. Types outside those shapes are opaque and cost a bare object header
 * unless a {@link Weigher} is registered for them.
 *
 * <p>Every non-null object is counted at most once per {@link #estimate} call, by identity, so a
 * cyclic graph costs the same as the acyclic graph with its back-references set to {@code null}.
 * Instances are immutable and safe to share between threads.
 */
public class MemoryEstimator {

    private static final Logger log = LoggerFactory.getLogger(MemoryEstimator.class);

    /** Size of one reference slot on the running JVM. */
    public static final int REFERENCE_SIZE =
        "32".equals(System.getProperty("sun.arch.data.model")) ? 4 : 8;

    /** Mark word plus class pointer. */
    public static final int OBJECT_HEADER = 2 * REFERENCE_SIZE;

    static final int ARRAY_HEADER = OBJECT_HEADER + 4;

    // String object (value ref, hash, coder) plus the header of its backing array
    static final int TEXT_HEADER = OBJECT_HEADER + REFERENCE_SIZE + 8 + ARRAY_HEADER;

    // size and modCount, elementData ref, backing array header
    static final int SEQUENCE_HEADER = OBJECT_HEADER + 8 + REFERENCE_SIZE + ARRAY_HEADER;

    // HashMap fields plus its table header
    static final int MAPPING_HEADER = OBJECT_HEADER + 4 * REFERENCE_SIZE + 16 + ARRAY_HEADER;

    // hash, key, value, next
    static final int MAPPING_NODE = OBJECT_HEADER + 4 + 3 * REFERENCE_SIZE;

    static final int REFERENCE_HOLDER = OBJECT_HEADER + REFERENCE_SIZE;

    static final int DEFAULT_LIST_CAPACITY = 10;
    static final int MIN_BUCKETS = 16;

    private static final MemoryEstimator STANDARD =
        new MemoryEstimator(new LinkedHashMap<>(), Method::trySetAccessible);

    private final Map<Class<?>, ToLongFunction<Object>> weighers;
    private final Predicate<Method> accessorOpener;

    private MemoryEstimator(Map<Class<?>, ToLongFunction<Object>> weighers, Predicate<Method> accessorOpener) {
        this.weighers = weighers;
        this.accessorOpener = accessorOpener;
    }

    /** Estimator with no registered weighers. */
    public static MemoryEstimator standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    public long estimate(Object value) {
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Object> pending = new ArrayDeque<>();
        push(pending, value);

        long total = 0;
        while (!pending.isEmpty()) {
            Object next = pending.pop();
            if (!seen.add(next)) {
                continue;
            }
            total += visit(next, pending);
        }
        return total;
    }

    /**
     * Returns the object's own cost and queues the objects it references.
     */
    private long visit(Object value, Deque<Object> pending) {
        ToLongFunction<Object> weigher = weigherFor(value.getClass());
        if (weigher != null) {
            long weight = weigher.applyAsLong(value);
            if (weight < 0) {
                throw new IllegalStateException(
                    "Weigher for " + value.getClass().getName() + " returned " + weight);
            }
            return weight;
        }

        Long scalar = scalarSize(value);
        if (scalar != null) {
            return scalar;
        }
        if (value instanceof CharSequence) {
            return TEXT_HEADER + utf8Length((CharSequence) value);
        }
        if (value instanceof Object[]) {
            return referenceArraySize((Object[]) value, pending);
        }
        Long primitiveArray = primitiveArraySize(value);
        if (primitiveArray != null) {
            return primitiveArray;
        }
        if (value instanceof Collection) {
            return sequenceSize((Collection<?>) value, pending);
        }
        if (value instanceof Map) {
            return mappingSize((Map<?, ?>) value, pending);
        }
        if (value instanceof Optional) {
            push(pending, ((Optional<?>) value).orElse(null));
            return REFERENCE_HOLDER;
        }
        if (value instanceof AtomicReference) {
            push(pending, ((AtomicReference<?>) value).get());
            return REFERENCE_HOLDER;
        }
        if (value instanceof SizeVisitable) {
            SizeVisitable composite = (SizeVisitable) value;
            composite.visitReferences(child -> push(pending, child));
            return composite.shallowSize();
        }
        if (value instanceof Record) {
            Long recordSize = recordSize((Record) value, pending);
            if (recordSize != null) {
                return recordSize;
            }
        }

        log.trace("No shape for {}, charging an object header", value.getClass().getName());
        return OBJECT_HEADER;
    }

    private static Long scalarSize(Object value) {
        if (value instanceof Enum) {
            return 0L;
        }
        if (value instanceof Boolean || value instanceof Byte) {
            return (long) OBJECT_HEADER + 1;
        }
        if (value instanceof Short || value instanceof Character) {
            return (long) OBJECT_HEADER + 2;
        }
        if (value instanceof Integer || value instanceof Float) {
            return (long) OBJECT_HEADER + 4;
        }
        if (value instanceof Long || value instanceof Double) {
            return (long) OBJECT_HEADER + 8;
        }
        return null;
    }

    private static long referenceArraySize(Object[] array, Deque<Object> pending) {
        for (Object element : array) {
            push(pending, element);
        }
        return ARRAY_HEADER + (long) array.length * REFERENCE_SIZE;
    }

    private static Long primitiveArraySize(Object value) {
        if (value instanceof byte[]) {
            return ARRAY_HEADER + (long) ((byte[]) value).length;
        }
        if (value instanceof boolean[]) {
            return ARRAY_HEADER + (long) ((boolean[]) value).length;
        }
        if (value instanceof char[]) {
            return ARRAY_HEADER + 2L * ((char[]) value).length;
        }
        if (value instanceof short[]) {
            return ARRAY_HEADER + 2L * ((short[]) value).length;
        }
        if (value instanceof int[]) {
            return ARRAY_HEADER + 4L * ((int[]) value).length;
        }
        if (value instanceof float[]) {
            return ARRAY_HEADER + 4L * ((float[]) value).length;
        }
        if (value instanceof long[]) {
            return ARRAY_HEADER + 8L * ((long[]) value).length;
        }
        if (value instanceof double[]) {
            return ARRAY_HEADER + 8L * ((double[]) value).length;
        }
        return null;
    }

    private static long sequenceSize(Collection<?> sequence, Deque<Object> pending) {
        int length = 0;
        for (Object element : sequence) {
            push(pending, element);
            length++;
        }
        long slots = sequence instanceof ArrayList ? reservedSlots(length) : length;
        return SEQUENCE_HEADER + slots * REFERENCE_SIZE;
    }

    private static long mappingSize(Map<?, ?> mapping, Deque<Object> pending) {
        int entries = 0;
        for (Map.Entry<?, ?> entry : mapping.entrySet()) {
            push(pending, entry.getKey());
            push(pending, entry.getValue());
            entries++;
        }
        // unfilled buckets are paid as empty slots
        long buckets = bucketCount(entries);
        return MAPPING_HEADER + buckets * REFERENCE_SIZE + (long) entries * MAPPING_NODE;
    }

    /**
     * Records are the one shape read through reflection: their components are only reachable
     * through the generated accessors. Every accessor is opened before any component is read, so
     * a record that cannot be read is charged as opaque without any of its children.
     *
     * @return {@code null} if the record cannot be read
     */
    private Long recordSize(Record record, Deque<Object> pending) {
        RecordComponent[] components = record.getClass().getRecordComponents();
        for (RecordComponent component : components) {
            if (!component.getType().isPrimitive() && !accessorOpener.test(component.getAccessor())) {
                log.debug("Cannot read components of {}, treating it as opaque", record.getClass().getName());
                return null;
            }
        }

        long size = OBJECT_HEADER;
        List<Object> children = new ArrayList<>(components.length);
        for (RecordComponent component : components) {
            Class<?> type = component.getType();
            if (type.isPrimitive()) {
                size += primitiveWidth(type);
                continue;
            }
            size += REFERENCE_SIZE;
            try {
                children.add(component.getAccessor().invoke(record));
            } catch (IllegalAccessException e) {
                log.debug("Cannot read {} of {}", component.getName(), record.getClass().getName(), e);
                return null;
            } catch (InvocationTargetException e) {
                throw new IllegalStateException(
                    "Accessor " + component.getName() + " of " + record.getClass().getName() + " failed",
                    e.getCause());
            }
        }
        for (Object child : children) {
            push(pending, child);
        }
        return size;
    }

    /**
     * Slots an {@link ArrayList} grown one element at a time holds for {@code length} elements.
     */
    static long reservedSlots(int length) {
        if (length == 0) {
            return 0;
        }
        long capacity = DEFAULT_LIST_CAPACITY;
        while (capacity < length) {
            capacity += capacity >> 1;
        }
        return capacity;
    }

    static long bucketCount(int entries) {
        long buckets = MIN_BUCKETS;
        while (entries > buckets * 3 / 4) {
            buckets <<= 1;
        }
        return buckets;
    }

    static int primitiveWidth(Class<?> type) {
        if (type == long.class || type == double.class) {
            return 8;
        }
        if (type == int.class || type == float.class) {
            return 4;
        }
        if (type == short.class || type == char.class) {
            return 2;
        }
        return 1;
    }

    static long utf8Length(CharSequence text) {
        long bytes = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < text.length()
                && Character.isLowSurrogate(text.charAt(i + 1))) {
                bytes += 4;
                i++;
            } else {
                bytes += 3;
            }
        }
        return bytes;
    }

    private static void push(Deque<Object> pending, Object value) {
        if (value != null) {
            pending.push(value);
        }
    }

    private ToLongFunction<Object> weigherFor(Class<?> type) {
        if (weighers.isEmpty()) {
            return null;
        }
        ToLongFunction<Object> exact = weighers.get(type);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<Class<?>, ToLongFunction<Object>> entry : weighers.entrySet()) {
            if (entry.getKey().isAssignableFrom(type)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public static class Builder {

        private final Map<Class<?>, ToLongFunction<Object>> weighers = new LinkedHashMap<>();
        private Predicate<Method> accessorOpener = Method::trySetAccessible;

        private Builder() {
        }

        /**
         * Registers an explicit size function for {@code type} and its subtypes. Exact matches win,
         * otherwise the first registered supertype applies.
         */
        public <T> Builder weigher(Class<T> type, Weigher<? super T> weigher) {
            Objects.requireNonNull(weigher, "weigher");
            weighers.put(Objects.requireNonNull(type, "type"), value -> weigher.weigh(type.cast(value)));
            return this;
        }

        // Replaces how record accessors are opened. Tests use it to simulate unreadable records.
        Builder accessorOpener(Predicate<Method> accessorOpener) {
            this.accessorOpener = Objects.requireNonNull(accessorOpener, "accessorOpener");
            return this;
        }

        public MemoryEstimator build() {
            return new MemoryEstimator(new LinkedHashMap<>(weighers), accessorOpener);
        }
    }
}
