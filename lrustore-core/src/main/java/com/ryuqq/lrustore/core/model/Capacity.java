package com.ryuqq.lrustore.core.model;

import com.ryuqq.lrustore.core.exception.InvalidCapacityException;

/**
 * 저장소가 보관할 수 있는 최대 항목 수.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. 저장소의 용량 변경은
 * 새 Capacity 인스턴스로 교체하는 방식으로 이루어집니다.</p>
 * <p><strong>유효성 검증:</strong> 1 이상</p>
 *
 * @author LruStore Team
 * @since 1.0.0
 */
public final class Capacity {

    private final int value;

    private Capacity(int value) {
        if (value < 1) {
            throw new InvalidCapacityException(value);
        }
        this.value = value;
    }

    /**
     * Capacity 생성.
     *
     * @param value 용량
     * @return Capacity 인스턴스
     * @throws InvalidCapacityException value가 1 미만인 경우
     */
    public static Capacity of(int value) {
        return new Capacity(value);
    }

    /**
     * 용량 값 조회.
     *
     * @return 용량
     */
    public int getValue() {
        return value;
    }

    /**
     * 주어진 항목 수가 용량을 초과하는지 확인.
     *
     * @param filled 현재 항목 수
     * @return 초과한 항목 수 (초과하지 않으면 0)
     */
    public int overflow(int filled) {
        return Math.max(0, filled - value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Capacity capacity = (Capacity) o;
        return value == capacity.value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return "Capacity{" + value + '}';
    }
}
