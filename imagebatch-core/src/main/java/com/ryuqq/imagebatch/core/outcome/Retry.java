package com.ryuqq.imagebatch.core.outcome;

import com.ryuqq.imagebatch.core.error.ErrorKind;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p>RATE_LIMITED 또는 SERVICE_OVERLOADED 실패 후, 다음 시도 전 대기할 시간을 담습니다.</p>
 *
 * @param kind 실패 종류 (재시도 가능한 종류만 허용)
 * @param reason 재시도 사유
 * @param attemptCount 현재까지 시도 횟수 (1 이상)
 * @param nextRetryAfterMillis 다음 재시도까지 대기 시간 (밀리초, 0 이상)
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record Retry(
    ErrorKind kind,
    String reason,
    int attemptCount,
    long nextRetryAfterMillis
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Retry {
        if (kind == null || !kind.isRetryable()) {
            throw new IllegalArgumentException("kind must be retryable (current: " + kind + ")");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        if (nextRetryAfterMillis < 0) {
            throw new IllegalArgumentException("nextRetryAfterMillis must be non-negative (current: " + nextRetryAfterMillis + ")");
        }
    }
}
