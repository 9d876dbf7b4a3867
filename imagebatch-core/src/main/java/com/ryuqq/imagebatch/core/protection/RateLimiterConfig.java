package com.ryuqq.imagebatch.core.protection;

/**
 * Token bucket RPM limiter 설정.
 *
 * @param maxPerMinute 분당 최대 요청 수 (버킷 크기 겸 분당 충전량)
 * @param pollIntervalMs 용량 부족 시 재확인 간격 (밀리초, 기본 100)
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record RateLimiterConfig(double maxPerMinute, long pollIntervalMs) {

    public static final long DEFAULT_POLL_INTERVAL_MS = 100;

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxPerMinute is not positive
     * @throws IllegalArgumentException if pollIntervalMs is not positive
     */
    public RateLimiterConfig {
        if (maxPerMinute <= 0) {
            throw new IllegalArgumentException("maxPerMinute must be positive (current: " + maxPerMinute + ")");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive (current: " + pollIntervalMs + ")");
        }
    }

    public static RateLimiterConfig perMinute(double maxPerMinute) {
        return new RateLimiterConfig(maxPerMinute, DEFAULT_POLL_INTERVAL_MS);
    }
}
