package com.ryuqq.imagebatch.core.statemachine;

/**
 * 배치 항목의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ─┬─► SKIPPED (결과물 존재)
 *          ├─► IN_FLIGHT (permit + token 획득)
 *          └─► FAILED (시작 전 취소)
 *
 * IN_FLIGHT ─┬─► SUCCESS
 *            ├─► BACKOFF (RATE_LIMITED / SERVICE_OVERLOADED)
 *            └─► FAILED (OTHER)
 *
 * BACKOFF ─┬─► IN_FLIGHT (attemptIndex &lt; maxRetries)
 *          └─► FAILED (재시도 소진 또는 취소)
 * </pre>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public enum ItemState {

    /**
     * 대기 중 (아직 어떤 자원도 획득하지 않음).
     */
    PENDING,

    /**
     * 생성 호출 진행 중 (concurrency permit 보유).
     */
    IN_FLIGHT,

    /**
     * 재시도 전 대기 중 (permit 반납 완료).
     */
    BACKOFF,

    SUCCESS,

    FAILED,

    SKIPPED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCESS, FAILED, SKIPPED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == SKIPPED;
    }
}
