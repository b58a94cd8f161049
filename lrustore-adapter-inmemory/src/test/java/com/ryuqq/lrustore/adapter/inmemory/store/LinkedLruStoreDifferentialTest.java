package com.ryuqq.lrustore.adapter.inmemory.store;

import com.ryuqq.lrustore.core.config.LruStoreConfig;
import com.ryuqq.lrustore.core.exception.EmptyStoreException;
import com.ryuqq.lrustore.core.exception.KeyNotFoundException;
import com.ryuqq.lrustore.core.store.LruStore;
import com.ryuqq.lrustore.testkit.reference.ListBackedLruStore;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * LinkedLruStore 와 ListBackedLruStore 를 동일한 무작위 연산 시퀀스로 구동하여
 * 관찰 가능한 상태가 항상 같은지 검증합니다.
 *
 * <p>각 반복은 반복 번호를 시드로 사용하므로 실패 시 같은 시퀀스를 재현할 수 있습니다.</p>
 *
 * @author LruStore Team
 * @since 1.0.0
 */
class LinkedLruStoreDifferentialTest {

    private static final int OPERATIONS = 2_000;
    private static final int KEY_SPACE = 24;

    @RepeatedTest(20)
    void randomOperations_MatchReferenceStore(RepetitionInfo repetitionInfo) {
        // Given
        long seed = repetitionInfo.getCurrentRepetition();
        Random random = new Random(seed);
        int capacity = 1 + random.nextInt(12);
        List<String> linkedEvictions = new ArrayList<>();
        List<String> referenceEvictions = new ArrayList<>();
        LruStore<Integer, Integer> linked = new LinkedLruStore<>(
                new LruStoreConfig(capacity),
                (key, value, cause) -> linkedEvictions.add(key + "=" + value + ":" + cause));
        LruStore<Integer, Integer> reference = new ListBackedLruStore<>(
                capacity,
                (key, value, cause) -> referenceEvictions.add(key + "=" + value + ":" + cause));

        // When & Then
        for (int step = 0; step < OPERATIONS; step++) {
            int key = random.nextInt(KEY_SPACE);
            int op = random.nextInt(100);
            String context = "seed=" + seed + " step=" + step + " op=" + op + " key=" + key;

            if (op < 45) {
                linked.write(key, step);
                reference.write(key, step);
            } else if (op < 65) {
                assertSameOutcome(() -> linked.read(key), () -> reference.read(key), context);
            } else if (op < 75) {
                assertSameOutcome(() -> linked.peek(key), () -> reference.peek(key), context);
            } else if (op < 85) {
                assertSameOutcome(() -> linked.remove(key), () -> reference.remove(key), context);
            } else if (op < 90) {
                assertSameOutcome(() -> linked.removeLeastRecentlyUsed(),
                        () -> reference.removeLeastRecentlyUsed(), context);
            } else if (op < 97) {
                int newCapacity = 1 + random.nextInt(12);
                linked.resize(newCapacity);
                reference.resize(newCapacity);
            } else {
                assertEquals(reference.find(key), linked.find(key), context);
            }

            assertEquals(reference, linked, context);
            assertThat(linked.keys()).as(context).containsExactlyElementsOf(reference.keys());
            assertThat(linked.filled()).as(context).isLessThanOrEqualTo(linked.capacity());
            assertEquals(referenceEvictions, linkedEvictions, context);
        }
    }

    private static void assertSameOutcome(Supplier<Object> linked, Supplier<Object> reference, String context) {
        Object expected;
        Class<? extends RuntimeException> expectedFailure = null;
        try {
            expected = reference.get();
        } catch (KeyNotFoundException | EmptyStoreException e) {
            expected = null;
            expectedFailure = e.getClass();
        }

        if (expectedFailure != null) {
            assertThrows(expectedFailure, linked::get, context);
        } else {
            assertEquals(expected, linked.get(), context);
        }
    }
}
