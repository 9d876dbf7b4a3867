package com.ryuqq.imagebatch.core.error;

/**
 * 생성 호출 실패 분류.
 *
 * <p>생성 협력자는 모든 실패를 정확히 하나의 종류로 분류해야 합니다.</p>
 *
 * <table>
 *   <caption>종류별 처리</caption>
 *   <tr><th>종류</th><th>재시도</th><th>동시성 축소</th></tr>
 *   <tr><td>RATE_LIMITED</td><td>O</td><td>O</td></tr>
 *   <tr><td>SERVICE_OVERLOADED</td><td>O</td><td>X</td></tr>
 *   <tr><td>OTHER</td><td>X</td><td>X</td></tr>
 * </table>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 할당량 초과 (예: 429 Too Many Requests).
     */
    RATE_LIMITED,

    /**
     * 일시적인 서버 측 과부하 (예: 503 Service Unavailable).
     */
    SERVICE_OVERLOADED,

    /**
     * 그 밖의 모든 실패 (재시도 불가).
     */
    OTHER;

    public boolean isRetryable() {
        return this == RATE_LIMITED || this == SERVICE_OVERLOADED;
    }

    /**
     * 동시성 윈도우를 축소해야 하는 실패인지 확인.
     *
     * @return RATE_LIMITED인 경우 true
     */
    public boolean reducesConcurrency() {
        return this == RATE_LIMITED;
    }
}
