package com.ryuqq.imagebatch.adapter.runner;

import com.ryuqq.imagebatch.application.batch.BatchConfig;

/**
 * Exponential Backoff 계산기.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^attemptIndex, maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=2000ms):</strong></p>
 * <ul>
 *   <li>attemptIndex=0: 2000ms</li>
 *   <li>attemptIndex=1: 4000ms</li>
 *   <li>attemptIndex=4: 32000ms</li>
 *   <li>attemptIndex=20: maxDelay (300000ms)</li>
 * </ul>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public final class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=2000ms, maxDelay=300000ms</p>
     */
    public BackoffCalculator() {
        this(2000, 300_000);
    }

    /**
     * 배치 설정의 baseDelayMs / maxDelayMs로 생성.
     *
     * @param config 배치 설정
     * @return BackoffCalculator
     */
    public static BackoffCalculator from(BatchConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new BackoffCalculator(config.baseDelayMs(), config.maxDelayMs());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptIndex 실패한 시도의 인덱스 (0부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attemptIndex가 음수인 경우
     */
    public long calculate(int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException(
                "attemptIndex must be non-negative (current: " + attemptIndex + ")"
            );
        }

        // base * 2^n 이 long 범위를 넘으면 maxDelay로 고정
        if (attemptIndex >= Long.numberOfLeadingZeros(baseDelayMs) - 1) {
            return maxDelayMs;
        }
        return Math.min(baseDelayMs << attemptIndex, maxDelayMs);
    }
}
