package com.example.boundedcache.memory;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static com.example.boundedcache.memory.MemoryEstimator.ARRAY_HEADER;
import static com.example.boundedcache.memory.MemoryEstimator.MAPPING_HEADER;
import static com.example.boundedcache.memory.MemoryEstimator.MAPPING_NODE;
import static com.example.boundedcache.memory.MemoryEstimator.OBJECT_HEADER;
import static com.example.boundedcache.memory.MemoryEstimator.REFERENCE_HOLDER;
import static com.example.boundedcache.memory.MemoryEstimator.REFERENCE_SIZE;
import static com.example.boundedcache.memory.MemoryEstimator.SEQUENCE_HEADER;
import static com.example.boundedcache.memory.MemoryEstimator.TEXT_HEADER;
import static org.junit.jupiter.api.Assertions.*;

public class MemoryEstimatorTest {

    private final MemoryEstimator estimator = MemoryEstimator.standard();

    static class Node implements SizeVisitable {
        final int value;
        Node next;

        Node(int value) {
            this.value = value;
        }

        @Override
        public long shallowSize() {
            return OBJECT_HEADER + 4 + REFERENCE_SIZE;
        }

        @Override
        public void visitReferences(Consumer<Object> visitor) {
            visitor.accept(next);
        }
    }

    record Point(int x, long y) {
    }

    record Labeled(String label, AtomicReference<Object> link) {
    }

    record Pair(String first, String second) {
    }

    @Test
    public void testScalars() {
        assertEquals(0, estimator.estimate(null));
        assertEquals(OBJECT_HEADER + 1, estimator.estimate(Boolean.TRUE));
        assertEquals(OBJECT_HEADER + 2, estimator.estimate('c'));
        assertEquals(OBJECT_HEADER + 4, estimator.estimate(42));
        assertEquals(OBJECT_HEADER + 8, estimator.estimate(42L));
        assertEquals(OBJECT_HEADER + 8, estimator.estimate(4.2d));
        assertEquals(0, estimator.estimate(DayOfWeek.MONDAY));
    }

    @Test
    public void testTextCountsUtf8Bytes() {
        assertEquals(TEXT_HEADER, estimator.estimate(""));
        assertEquals(TEXT_HEADER + 5, estimator.estimate("Hello"));
        assertEquals(TEXT_HEADER + 2, estimator.estimate("é"));
        assertEquals(TEXT_HEADER + 3, estimator.estimate("€"));
        assertEquals(TEXT_HEADER + 4, estimator.estimate("😀"));
        assertEquals(TEXT_HEADER + 3, estimator.estimate(new StringBuilder("abc")));
    }

    @Test
    public void testArrays() {
        assertEquals(ARRAY_HEADER + 4 * 8, estimator.estimate(new long[4]));
        assertEquals(ARRAY_HEADER + 10, estimator.estimate(new byte[10]));

        String a = "a";
        String b = "bb";
        assertEquals(ARRAY_HEADER + 3L * REFERENCE_SIZE + (TEXT_HEADER + 1) + (TEXT_HEADER + 2),
            estimator.estimate(new Object[] {a, b, null}));
    }

    @Test
    public void testEveryPrimitiveArrayType() {
        assertEquals(ARRAY_HEADER + 3, estimator.estimate(new boolean[3]));
        assertEquals(ARRAY_HEADER + 3, estimator.estimate(new byte[3]));
        assertEquals(ARRAY_HEADER + 6, estimator.estimate(new char[3]));
        assertEquals(ARRAY_HEADER + 6, estimator.estimate(new short[3]));
        assertEquals(ARRAY_HEADER + 12, estimator.estimate(new int[3]));
        assertEquals(ARRAY_HEADER + 12, estimator.estimate(new float[3]));
        assertEquals(ARRAY_HEADER + 24, estimator.estimate(new long[3]));
        assertEquals(ARRAY_HEADER + 24, estimator.estimate(new double[3]));
        assertEquals(ARRAY_HEADER + (TEXT_HEADER + 1) + REFERENCE_SIZE, estimator.estimate(new String[] {"s"}));
        assertEquals(ARRAY_HEADER + 2L * REFERENCE_SIZE + 2L * (ARRAY_HEADER + 4),
            estimator.estimate(new int[][] {{1}, {2}}));
    }

    @Test
    public void testSharedElementCountedOnce() {
        String shared = "shared";
        long once = estimator.estimate(shared);

        assertEquals(ARRAY_HEADER + 2L * REFERENCE_SIZE + once, estimator.estimate(new Object[] {shared, shared}));
    }

    @Test
    public void testListChargesReservedCapacity() {
        List<Integer> list = new ArrayList<>();
        list.add(1000);
        list.add(2000);
        list.add(3000);

        long elements = 3L * (OBJECT_HEADER + 4);
        assertEquals(SEQUENCE_HEADER + 10L * REFERENCE_SIZE + elements, estimator.estimate(list));
        assertEquals(SEQUENCE_HEADER + 3L * REFERENCE_SIZE + elements, estimator.estimate(List.of(1000, 2000, 3000)));

        assertEquals(0, MemoryEstimator.reservedSlots(0));
        assertEquals(10, MemoryEstimator.reservedSlots(10));
        assertEquals(15, MemoryEstimator.reservedSlots(11));
        assertEquals(22, MemoryEstimator.reservedSlots(16));
    }

    @Test
    public void testMappingChargesBucketsAndNodes() {
        Map<String, Long> map = new HashMap<>();
        map.put("k", 7L);

        long expected = MAPPING_HEADER + 16L * REFERENCE_SIZE + MAPPING_NODE
            + (TEXT_HEADER + 1) + (OBJECT_HEADER + 8);
        assertEquals(expected, estimator.estimate(map));

        assertEquals(16, MemoryEstimator.bucketCount(0));
        assertEquals(16, MemoryEstimator.bucketCount(12));
        assertEquals(32, MemoryEstimator.bucketCount(13));
        assertEquals(128, MemoryEstimator.bucketCount(96));
        assertEquals(256, MemoryEstimator.bucketCount(97));
    }

    @Test
    public void testReferencesAddTheirTarget() {
        assertEquals(REFERENCE_HOLDER + TEXT_HEADER + 1, estimator.estimate(Optional.of("x")));
        assertEquals(REFERENCE_HOLDER, estimator.estimate(Optional.empty()));
        assertEquals(REFERENCE_HOLDER + OBJECT_HEADER + 8, estimator.estimate(new AtomicReference<>(1L)));
    }

    @Test
    public void testRecords() {
        assertEquals(OBJECT_HEADER + 4 + 8, estimator.estimate(new Point(1, 2)));
        assertEquals(OBJECT_HEADER + 2L * REFERENCE_SIZE + (TEXT_HEADER + 2) + REFERENCE_HOLDER,
            estimator.estimate(new Labeled("ab", new AtomicReference<>())));
    }

    @Test
    public void testUnreadableRecordIsOpaqueWithoutChildren() {
        MemoryEstimator refusing = MemoryEstimator.builder()
            .accessorOpener(accessor -> !accessor.getName().equals("second"))
            .build();

        assertEquals(OBJECT_HEADER, refusing.estimate(new Pair("first text", "second text")));
        assertEquals(OBJECT_HEADER + 2L * REFERENCE_SIZE + (TEXT_HEADER + 10) + (TEXT_HEADER + 11),
            estimator.estimate(new Pair("first text", "second text")));
    }

    @Test
    public void testSelfReferenceCostsNothingExtra() {
        Node node = new Node(25);
        long acyclic = estimator.estimate(node);

        node.next = node;
        assertEquals(acyclic, estimator.estimate(node));
    }

    @Test
    public void testMutualReferenceCostsNothingExtra() {
        Node a = new Node(1);
        Node b = new Node(2);
        a.next = b;
        long acyclic = estimator.estimate(a);

        b.next = a;
        assertEquals(acyclic, estimator.estimate(a));
        assertEquals(2 * a.shallowSize(), acyclic);
    }

    @Test
    public void testCyclesThroughContainers() {
        List<Object> list = new ArrayList<>();
        list.add("x");
        list.add(null);
        long listAcyclic = estimator.estimate(list);
        list.set(1, list);
        assertEquals(listAcyclic, estimator.estimate(list));

        Map<String, Object> map = new HashMap<>();
        map.put("self", null);
        long mapAcyclic = estimator.estimate(map);
        map.put("self", map);
        assertEquals(mapAcyclic, estimator.estimate(map));

        Labeled record = new Labeled("r", new AtomicReference<>());
        long recordAcyclic = estimator.estimate(record);
        record.link().set(record);
        assertEquals(recordAcyclic, estimator.estimate(record));
    }

    @Test
    public void testLongChainDoesNotOverflowTheStack() {
        Node head = new Node(0);
        Node tail = head;
        for (int i = 1; i < 200_000; i++) {
            tail.next = new Node(i);
            tail = tail.next;
        }

        assertEquals(200_000L * head.shallowSize(), estimator.estimate(head));
    }

    @Test
    public void testOpaqueValuesCostAHeader() {
        assertEquals(OBJECT_HEADER, estimator.estimate(new Object()));
    }

    @Test
    public void testWeigherOverridesShapes() {
        MemoryEstimator weighing = MemoryEstimator.builder()
            .weigher(Number.class, n -> 100)
            .weigher(Integer.class, n -> 7)
            .build();

        assertEquals(7, weighing.estimate(1));
        assertEquals(100, weighing.estimate(BigDecimal.ONE));
        assertEquals(100, weighing.estimate(1L));
        assertEquals(SEQUENCE_HEADER + 2L * REFERENCE_SIZE + 7 + 100, weighing.estimate(List.of(1, 2L)));
    }

    @Test
    public void testWeigherReceivesItsOwnType() {
        List<Object> seen = new ArrayList<>();
        MemoryEstimator weighing = MemoryEstimator.builder()
            .weigher(CharSequence.class, text -> {
                seen.add(text);
                return text.length();
            })
            .build();

        assertEquals(3 + 5, weighing.estimate(new StringBuilder("abc")) + weighing.estimate("hello"));
        assertEquals(2, seen.size());
    }

    @Test
    public void testNegativeWeightIsRejected() {
        MemoryEstimator broken = MemoryEstimator.builder()
            .weigher(String.class, s -> -1)
            .build();

        assertThrows(IllegalStateException.class, () -> broken.estimate("x"));
    }
}
