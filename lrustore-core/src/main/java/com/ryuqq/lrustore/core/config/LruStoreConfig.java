package com.ryuqq.lrustore.core.config;

import com.ryuqq.lrustore.core.exception.InvalidCapacityException;

/**
 * LruStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>capacity: 최대 항목 수 (기본 128)</li>
 *   <li>initialTableSize: 내부 해시 테이블 초기 크기 힌트 (기본 16)</li>
 * </ul>
 *
 * <p>실제 테이블 크기 힌트는 {@code min(initialTableSize, capacity)}입니다.
 * 용량보다 큰 테이블은 채워질 수 없기 때문입니다.</p>
 *
 * @author LruStore Team
 * @since 1.0.0
 * @param capacity 최대 항목 수 (1 이상이어야 함)
 * @param initialTableSize 해시 테이블 초기 크기 힌트 (0 이상이어야 함)
 */
public record LruStoreConfig(
    int capacity,
    int initialTableSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: capacity=128, initialTableSize=16</p>
     */
    public LruStoreConfig() {
        this(128, 16);
    }

    /**
     * 용량만 지정하는 생성자. initialTableSize는 기본값 16을 사용합니다.
     *
     * @param capacity 최대 항목 수
     */
    public LruStoreConfig(int capacity) {
        this(capacity, 16);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws InvalidCapacityException capacity가 1 미만인 경우
     * @throws IllegalArgumentException initialTableSize가 음수인 경우
     */
    public LruStoreConfig {
        if (capacity < 1) {
            throw new InvalidCapacityException(capacity);
        }
        if (initialTableSize < 0) {
            throw new IllegalArgumentException(
                "initialTableSize cannot be negative (current: " + initialTableSize + ")"
            );
        }
    }

    /**
     * 실제로 사용할 해시 테이블 크기 힌트.
     *
     * @return min(initialTableSize, capacity)
     */
    public int effectiveTableSize() {
        return Math.min(initialTableSize, capacity);
    }

    /**
     * capacity만 변경한 새 인스턴스 생성.
     */
    public LruStoreConfig withCapacity(int capacity) {
        return new LruStoreConfig(capacity, initialTableSize);
    }

    /**
     * initialTableSize만 변경한 새 인스턴스 생성.
     */
    public LruStoreConfig withInitialTableSize(int initialTableSize) {
        return new LruStoreConfig(capacity, initialTableSize);
    }
}
