package com.ryuqq.lrustore.core.exception;

/**
 * 비어있는 저장소에서 가장 오래된/최근 항목을 요청한 경우 발생.
 *
 * @author LruStore Team
 * @since 1.0.0
 */
public class EmptyStoreException extends LruStoreException {

    /**
     * 생성자.
     *
     * @param operation 실패한 연산 이름 (예: "leastRecentlyUsed")
     */
    public EmptyStoreException(String operation) {
        super("Cannot call " + operation + " on an empty store");
    }
}
