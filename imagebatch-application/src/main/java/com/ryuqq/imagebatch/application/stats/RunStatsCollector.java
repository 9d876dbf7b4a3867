package com.ryuqq.imagebatch.application.stats;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 배치 실행 중 갱신되는 통계 카운터.
 *
 * <p>여러 항목 워커가 동시에 증가시키므로 모든 카운터는 원자적으로 갱신됩니다.
 * 배치 한 번의 수명 동안만 유지되며 배치 간에 공유되지 않습니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public final class RunStatsCollector {

    private final int total;
    private final AtomicInteger successful = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger rateLimited = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param total 제출된 항목 수
     * @throws IllegalArgumentException total이 음수인 경우
     */
    public RunStatsCollector(int total) {
        if (total < 0) {
            throw new IllegalArgumentException("total must be non-negative (current: " + total + ")");
        }
        this.total = total;
    }

    public void recordSuccess() {
        successful.incrementAndGet();
    }

    public void recordFailure() {
        failed.incrementAndGet();
    }

    public void recordSkip() {
        skipped.incrementAndGet();
    }

    /**
     * RATE_LIMITED 시도 1회 기록 (항목이 아닌 시도 단위).
     */
    public void recordRateLimited() {
        rateLimited.incrementAndGet();
    }

    /**
     * 현재 값의 스냅샷.
     *
     * @return RunStats
     */
    public RunStats snapshot() {
        return new RunStats(total, successful.get(), failed.get(), skipped.get(), rateLimited.get());
    }
}
