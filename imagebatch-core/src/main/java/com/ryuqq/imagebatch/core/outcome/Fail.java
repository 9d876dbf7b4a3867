package com.ryuqq.imagebatch.core.outcome;

import com.ryuqq.imagebatch.core.error.ErrorKind;

/**
 * 영구적 실패.
 *
 * <p>OTHER 실패로 즉시 종료되었거나, 재시도 가능한 실패가 maxRetries만큼 반복된 경우입니다.
 * 호출자 입장에서는 두 경우 모두 동일하게 실패 1건으로 집계됩니다.</p>
 *
 * @param kind 마지막 실패 종류
 * @param message 오류 메시지
 * @param attempts 수행한 시도 횟수 (0 이상, 시작 전 취소된 경우 0)
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record Fail(
    ErrorKind kind,
    String message,
    int attempts
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 message가 유효하지 않은 경우
     */
    public Fail {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
    }

    /**
     * 재시도 소진 여부.
     *
     * @return 마지막 실패가 재시도 가능한 종류였던 경우 true
     */
    public boolean isExhausted() {
        return kind.isRetryable();
    }
}
