package com.ryuqq.imagebatch.core.protection;

/**
 * 적응형 동시성 limiter 설정.
 *
 * @param initial 초기 윈도우 크기
 * @param min 최소 윈도우 크기 (1 이상)
 * @param max 최대 윈도우 크기 (min 이상)
 * @param growthThreshold 윈도우를 1 키우는 데 필요한 연속 성공 횟수 (기본 10)
 * @param shrinkStep rate-limit 1회당 축소 폭 (기본 2)
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record ConcurrencyLimiterConfig(
    int initial,
    int min,
    int max,
    int growthThreshold,
    int shrinkStep
) {

    public static final int DEFAULT_GROWTH_THRESHOLD = 10;
    public static final int DEFAULT_SHRINK_STEP = 2;

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException min ≤ initial ≤ max 관계가 깨지거나 값이 양수가 아닌 경우
     */
    public ConcurrencyLimiterConfig {
        if (min < 1) {
            throw new IllegalArgumentException("min must be positive (current: " + min + ")");
        }
        if (max < min) {
            throw new IllegalArgumentException("max must be >= min (min: " + min + ", max: " + max + ")");
        }
        if (initial < min || initial > max) {
            throw new IllegalArgumentException(
                "initial must be between min and max (min: " + min + ", max: " + max + ", current: " + initial + ")");
        }
        if (growthThreshold < 1) {
            throw new IllegalArgumentException("growthThreshold must be positive (current: " + growthThreshold + ")");
        }
        if (shrinkStep < 1) {
            throw new IllegalArgumentException("shrinkStep must be positive (current: " + shrinkStep + ")");
        }
    }

    public ConcurrencyLimiterConfig(int initial, int min, int max) {
        this(initial, min, max, DEFAULT_GROWTH_THRESHOLD, DEFAULT_SHRINK_STEP);
    }

    /**
     * 호출자가 허용한 최대 동시성으로부터 설정 생성.
     *
     * <p>초기 크기는 {@code min(maxConcurrency, initialCap)}로 보수적으로 시작합니다.
     * maxConcurrency가 minFloor보다 작으면 min은 maxConcurrency로 낮춰집니다.</p>
     *
     * @param maxConcurrency 허용 최대 동시성
     * @param minFloor 최소 윈도우 크기 (기본 2)
     * @param initialCap 초기 크기 상한 (기본 8)
     * @return 설정
     * @throws IllegalArgumentException 값이 양수가 아닌 경우
     */
    public static ConcurrencyLimiterConfig forMaxConcurrency(int maxConcurrency, int minFloor, int initialCap) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be positive (current: " + maxConcurrency + ")");
        }
        if (initialCap < 1) {
            throw new IllegalArgumentException("initialCap must be positive (current: " + initialCap + ")");
        }
        int min = Math.min(minFloor, maxConcurrency);
        int initial = Math.max(min, Math.min(maxConcurrency, initialCap));
        return new ConcurrencyLimiterConfig(initial, min, maxConcurrency);
    }
}
