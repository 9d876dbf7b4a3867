package com.ryuqq.imagebatch.core.protection;

/**
 * 분당 요청 수 제한 SPI.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * concurrencyLimiter.acquire();   // 동시성 허가가 먼저
 * rateLimiter.acquire();          // 그 다음 RPM 허가
 * generator.generate(...);
 * }</pre>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 토큰 1개 소비 시도 (비블로킹).
     *
     * @return true: 토큰 소비, false: 용량 부족
     */
    boolean tryAcquire();

    /**
     * 토큰 1개를 얻을 때까지 대기 후 소비 (블로킹, 타임아웃 없음).
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void acquire() throws InterruptedException;

    /**
     * 현재 사용 가능한 용량 조회 (상태 변경 없음).
     *
     * @return 0 이상 maxPerMinute 이하의 실수 용량
     */
    double getAvailable();

    RateLimiterConfig getConfig();
}
