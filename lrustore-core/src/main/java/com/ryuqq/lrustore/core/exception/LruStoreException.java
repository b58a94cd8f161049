package com.ryuqq.lrustore.core.exception;

/**
 * LruStore 조회 실패의 공통 상위 예외.
 *
 * <p>요청한 항목이 저장소에 존재하지 않아 연산을 완료할 수 없을 때 발생합니다.
 * 실패한 연산은 저장소 상태(값, 최근 사용 순서)를 변경하지 않습니다.</p>
 *
 * @author LruStore Team
 * @since 1.0.0
 */
public abstract class LruStoreException extends IllegalStateException {

    protected LruStoreException(String message) {
        super(message);
    }
}
