package com.ryuqq.lrustore.core.exception;

/**
 * 용량이 1 미만으로 지정된 경우 발생.
 *
 * <p>생성자, {@code resize}, {@code Capacity.of}, {@code LruStoreConfig}에서 검증합니다.
 * 내부적으로 복구되지 않으며 호출자가 유효한 값을 다시 전달해야 합니다.</p>
 *
 * @author LruStore Team
 * @since 1.0.0
 */
public class InvalidCapacityException extends IllegalArgumentException {

    private final int requested;

    /**
     * 생성자.
     *
     * @param requested 요청된 (유효하지 않은) 용량
     */
    public InvalidCapacityException(int requested) {
        super("capacity must be at least 1 (current: " + requested + ")");
        this.requested = requested;
    }

    /**
     * 요청된 용량 조회.
     *
     * @return 요청된 용량
     */
    public int getRequested() {
        return requested;
    }
}
