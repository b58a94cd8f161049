package com.ryuqq.lrustore.adapter.inmemory.listener;

import com.ryuqq.lrustore.adapter.inmemory.store.LinkedLruStore;
import com.ryuqq.lrustore.core.config.LruStoreConfig;
import com.ryuqq.lrustore.core.spi.EvictionCause;
import com.ryuqq.lrustore.core.spi.EvictionListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * LoggingEvictionListener 테스트.
 *
 * @author LruStore Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("LoggingEvictionListener 테스트")
class LoggingEvictionListenerTest {

    @Mock
    private EvictionListener<String, String> delegate;

    @Test
    @DisplayName("로그를 남긴 뒤 delegate 에 그대로 위임한다")
    void onEviction_DelegatesAfterLogging() {
        // Given
        LoggingEvictionListener<String, String> listener = new LoggingEvictionListener<>("sessions", delegate);

        // When
        listener.onEviction("k1", "v1", EvictionCause.CAPACITY);

        // Then
        verify(delegate).onEviction("k1", "v1", EvictionCause.CAPACITY);
        verifyNoMoreInteractions(delegate);
    }

    @Test
    @DisplayName("delegate 없이 생성하면 로그만 남긴다")
    void onEviction_WithoutDelegate_DoesNotThrow() {
        // Given
        LoggingEvictionListener<String, String> listener = new LoggingEvictionListener<>("sessions");

        // When & Then
        assertThatCode(() -> listener.onEviction("k1", "v1", EvictionCause.RESIZE))
                .doesNotThrowAnyException();
        assertThat(listener.getStoreName()).isEqualTo("sessions");
    }

    @Test
    @DisplayName("storeName 이 비어있으면 IllegalArgumentException 이 발생한다")
    void constructor_BlankName_ThrowsException() {
        assertThatThrownBy(() -> new LoggingEvictionListener<String, String>("  "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("storeName cannot be null or blank");
    }

    @Test
    @DisplayName("delegate 가 null 이면 IllegalArgumentException 이 발생한다")
    void constructor_NullDelegate_ThrowsException() {
        assertThatThrownBy(() -> new LoggingEvictionListener<String, String>("sessions", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("delegate cannot be null");
    }

    @Test
    @DisplayName("LinkedLruStore 에 연결하면 축출마다 delegate 가 호출된다")
    void attachedToStore_ForwardsEvictions() {
        // Given
        LinkedLruStore<String, String> store = new LinkedLruStore<>(
                new LruStoreConfig(2), new LoggingEvictionListener<String, String>("sessions", delegate));
        store.write("a", "1");
        store.write("b", "2");

        // When
        store.write("c", "3");
        store.resize(1);

        // Then
        verify(delegate).onEviction("a", "1", EvictionCause.CAPACITY);
        verify(delegate).onEviction("b", "2", EvictionCause.RESIZE);
        verifyNoMoreInteractions(delegate);
        assertThat(store.keys()).containsExactly("c");
    }
}
