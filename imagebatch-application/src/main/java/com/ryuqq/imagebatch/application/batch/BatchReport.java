package com.ryuqq.imagebatch.application.batch;

import com.ryuqq.imagebatch.application.stats.RunStats;
import com.ryuqq.imagebatch.core.model.ImageResult;
import com.ryuqq.imagebatch.core.outcome.Outcome;

import java.util.List;

/**
 * 배치 실행 결과.
 *
 * @param results 성공 결과 (제출 순서 유지, 건너뛴/실패 항목은 제외)
 * @param outcomes 항목별 종료 결과 (제출 순서와 1:1 대응)
 * @param stats 통계 스냅샷
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record BatchReport(
    List<ImageResult> results,
    List<Outcome> outcomes,
    RunStats stats
) {

    public BatchReport {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        if (stats == null) {
            throw new IllegalArgumentException("stats cannot be null");
        }
        results = List.copyOf(results);
        outcomes = List.copyOf(outcomes);
    }
}
