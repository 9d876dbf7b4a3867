package com.ryuqq.imagebatch.application.batch;

import com.ryuqq.imagebatch.application.stats.RunStats;

/**
 * 호출자가 배치를 취소한 경우 발생.
 *
 * <p>배치 수준의 유일한 실패입니다. 모든 시작된 항목 워커가 종료된 뒤의 통계를 담으며,
 * 각 항목은 정확히 한 번 집계되었거나 (시작되지 않았다면) 집계되지 않습니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public class BatchCancelledException extends RuntimeException {

    private final transient RunStats stats;

    public BatchCancelledException(RunStats stats, Throwable cause) {
        super("Batch cancelled: " + stats, cause);
        this.stats = stats;
    }

    public RunStats getStats() {
        return stats;
    }
}
