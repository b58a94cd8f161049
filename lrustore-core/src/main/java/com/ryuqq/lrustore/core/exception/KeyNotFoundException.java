package com.ryuqq.lrustore.core.exception;

/**
 * 존재하지 않는 키로 read, peek, delete, remove를 호출한 경우 발생.
 *
 * <p>복구 가능한 실패입니다. 호출자는 {@code contains}로 먼저 확인하거나
 * 이 예외를 처리해야 합니다.</p>
 *
 * @author LruStore Team
 * @since 1.0.0
 */
public class KeyNotFoundException extends LruStoreException {

    private final transient Object key;

    /**
     * 생성자.
     *
     * @param key 찾지 못한 키
     */
    public KeyNotFoundException(Object key) {
        super("No entry found for key: " + key);
        this.key = key;
    }

    /**
     * 찾지 못한 키 조회.
     *
     * @return 키
     */
    public Object getKey() {
        return key;
    }
}
