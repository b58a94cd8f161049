package com.ryuqq.lrustore.adapter.inmemory.store;

import com.ryuqq.lrustore.core.config.LruStoreConfig;
import com.ryuqq.lrustore.core.spi.EvictionCause;
import com.ryuqq.lrustore.core.spi.EvictionListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * LinkedLruStore 의 EvictionListener 호출 테스트.
 *
 * @author LruStore Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class LinkedLruStoreEvictionListenerTest {

    @Mock
    private EvictionListener<String, Integer> listener;

    private LinkedLruStore<String, Integer> store;

    @BeforeEach
    void setUp() {
        store = new LinkedLruStore<>(new LruStoreConfig(3), listener);
    }

    @Test
    void write_WithinCapacity_DoesNotNotify() {
        // When
        store.write("a", 1);
        store.write("b", 2);
        store.write("a", 3);

        // Then
        verifyNoInteractions(listener);
    }

    @Test
    void write_Overflow_NotifiesOnceWithCapacityCause() {
        // Given
        store.write("a", 1);
        store.write("b", 2);
        store.write("c", 3);

        // When
        store.write("d", 4);

        // Then
        verify(listener, times(1)).onEviction("a", 1, EvictionCause.CAPACITY);
        verifyNoMoreInteractions(listener);
    }

    @Test
    void resize_Truncation_NotifiesOldestFirst() {
        // Given
        store.write("a", 1);
        store.write("b", 2);
        store.write("c", 3);

        // When
        store.resize(1);

        // Then
        InOrder inOrder = inOrder(listener);
        inOrder.verify(listener).onEviction("a", 1, EvictionCause.RESIZE);
        inOrder.verify(listener).onEviction("b", 2, EvictionCause.RESIZE);
        verifyNoMoreInteractions(listener);
    }

    @Test
    void explicitRemovals_DoNotNotify() {
        // Given
        store.write("a", 1);
        store.write("b", 2);
        store.write("c", 3);

        // When
        store.delete("a");
        store.remove("b");
        store.removeLeastRecentlyUsed();
        store.write("d", 4);
        store.clear();

        // Then
        verify(listener, never()).onEviction(any(), any(), any());
    }

    @Test
    void listener_SeesEvictedKeyAlreadyAbsent() {
        // Given
        store.write("a", 1);
        store.write("b", 2);
        store.write("c", 3);
        doAnswer(invocation -> {
            String key = invocation.getArgument(0);
            assertFalse(store.contains(key));
            assertEquals(3, store.filled());
            return null;
        }).when(listener).onEviction(any(), any(), any());

        // When
        store.write("d", 4);

        // Then
        verify(listener).onEviction("a", 1, EvictionCause.CAPACITY);
    }

    @Test
    void listener_Throws_ExceptionPropagatesAfterEviction() {
        // Given
        store.write("a", 1);
        store.write("b", 2);
        store.write("c", 3);
        doThrow(new IllegalStateException("listener failed"))
                .when(listener).onEviction(any(), any(), any());

        // When & Then
        assertThatThrownBy(() -> store.write("d", 4))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("listener failed");
        assertFalse(store.contains("a"));
        assertTrue(store.contains("d"));
        assertEquals("d", store.mostRecentlyUsed());
        assertEquals(3, store.filled());
    }

    @Test
    void listener_ThrowsDuringResize_EveryTruncatedEntryStillNotified() {
        // Given
        store.write("a", 1);
        store.write("b", 2);
        store.write("c", 3);
        IllegalStateException first = new IllegalStateException("close failed: a");
        IllegalStateException second = new IllegalStateException("close failed: b");
        doThrow(first).when(listener).onEviction("a", 1, EvictionCause.RESIZE);
        doThrow(second).when(listener).onEviction("b", 2, EvictionCause.RESIZE);

        // When & Then
        assertThatThrownBy(() -> store.resize(1))
                .isSameAs(first)
                .hasSuppressedException(second);
        InOrder inOrder = inOrder(listener);
        inOrder.verify(listener).onEviction("a", 1, EvictionCause.RESIZE);
        inOrder.verify(listener).onEviction("b", 2, EvictionCause.RESIZE);
        verifyNoMoreInteractions(listener);
        assertEquals("c", store.leastRecentlyUsed());
        assertEquals(1, store.filled());
    }
}
