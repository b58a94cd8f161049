package com.ryuqq.lrustore.adapter.inmemory.listener;

import com.ryuqq.lrustore.core.spi.EvictionCause;
import com.ryuqq.lrustore.core.spi.EvictionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 축출(eviction) 발생 시 로그를 남기는 {@link EvictionListener}.
 *
 * <p>DEBUG 레벨로 키와 축출 원인을 기록한 뒤, 위임 리스너가 있으면 그대로 전달합니다.
 * 값은 크기가 클 수 있으므로 로그에 남기지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EvictionListener&lt;String, Session&gt; listener =
 *         new LoggingEvictionListener&lt;&gt;("sessions", (key, session, cause) -&gt; session.close());
 * LruStore&lt;String, Session&gt; store = new LinkedLruStore&lt;&gt;(new LruStoreConfig(1000), listener);
 * </pre>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author LruStore Team
 * @since 1.0.0
 */
public final class LoggingEvictionListener<K, V> implements EvictionListener<K, V> {

    private static final Logger log = LoggerFactory.getLogger(LoggingEvictionListener.class);

    private final String storeName;
    private final EvictionListener<? super K, ? super V> delegate;

    /**
     * 로그만 남기는 리스너 생성.
     *
     * @param storeName 로그에 표시할 저장소 이름
     * @throws IllegalArgumentException storeName이 null 또는 빈 문자열인 경우
     */
    public LoggingEvictionListener(String storeName) {
        this(storeName, EvictionListener.noop());
    }

    /**
     * 로그를 남긴 뒤 delegate에 위임하는 리스너 생성.
     *
     * @param storeName 로그에 표시할 저장소 이름
     * @param delegate 로그 이후 호출할 리스너
     * @throws IllegalArgumentException storeName이 null 또는 빈 문자열이거나 delegate가 null인 경우
     */
    public LoggingEvictionListener(String storeName, EvictionListener<? super K, ? super V> delegate) {
        if (storeName == null || storeName.isBlank()) {
            throw new IllegalArgumentException("storeName cannot be null or blank");
        }
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.storeName = storeName;
        this.delegate = delegate;
    }

    @Override
    public void onEviction(K key, V value, EvictionCause cause) {
        log.debug("[{}] evicted key {} ({})", storeName, key, cause);
        delegate.onEviction(key, value, cause);
    }

    /**
     * 로그에 표시되는 저장소 이름 조회.
     *
     * @return 저장소 이름
     */
    public String getStoreName() {
        return storeName;
    }
}
