package com.ryuqq.imagebatch.core.protection;

/**
 * 크기가 변하는 동시 실행 permit pool SPI.
 *
 * <p>permit 하나는 진행 중인 생성 호출 하나를 허가합니다. pool의 크기는
 * 성공/rate-limit 신호에 따라 조정됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * limiter.acquire();
 * try {
 *     generator.generate(...);
 *     limiter.reportSuccess();
 * } catch (GenerationException e) {
 *     if (e.getKind().reducesConcurrency()) {
 *         limiter.reportRateLimited();
 *     }
 * } finally {
 *     limiter.release();
 * }
 * }</pre>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public interface ConcurrencyLimiter {

    /**
     * permit 획득 (블로킹).
     *
     * <p>permit을 얻을 때까지 대기하며 타임아웃은 없습니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void acquire() throws InterruptedException;

    /**
     * permit 반납.
     *
     * <p>pool이 목표 크기를 초과한 상태라면 반납된 permit은 순환에서 제거됩니다.
     * 반드시 finally 블록에서 호출되어야 합니다.</p>
     */
    void release();

    /**
     * 성공 신호. 연속 성공이 누적되면 윈도우가 커질 수 있습니다.
     */
    void reportSuccess();

    /**
     * rate-limit 신호. 윈도우를 축소하고 연속 성공 카운터를 초기화합니다.
     */
    void reportRateLimited();

    /**
     * 현재 윈도우 크기 (논리적 목표 크기).
     *
     * @return min 이상 max 이하의 값
     */
    int getCurrent();

    ConcurrencyLimiterConfig getConfig();
}
