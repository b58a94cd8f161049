package com.ryuqq.lrustore.core.spi;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * EvictionListener 테스트.
 *
 * @author LruStore Team
 * @since 1.0.0
 */
@DisplayName("EvictionListener 테스트")
class EvictionListenerTest {

    @Test
    @DisplayName("noop() 은 예외 없이 실행된다")
    void noop_IgnoresEvictions() {
        // Given
        EvictionListener<String, Integer> listener = EvictionListener.noop();

        // When & Then
        assertThatCode(() -> {
            listener.onEviction("a", 1, EvictionCause.CAPACITY);
            listener.onEviction("b", 2, EvictionCause.RESIZE);
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("람다로 구현할 수 있다")
    void lambda_ReceivesArguments() {
        // Given
        List<String> received = new ArrayList<>();
        EvictionListener<String, Integer> listener =
                (key, value, cause) -> received.add(key + "=" + value + ":" + cause);

        // When
        listener.onEviction("k", 3, EvictionCause.RESIZE);

        // Then
        assertThat(received).containsExactly("k=3:RESIZE");
    }
}
