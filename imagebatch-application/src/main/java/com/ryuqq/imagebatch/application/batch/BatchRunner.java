package com.ryuqq.imagebatch.application.batch;

import com.ryuqq.imagebatch.core.model.BatchItem;

import java.util.List;

/**
 * 배치 생성 실행기.
 *
 * <p>이 하위 시스템의 유일한 공개 진입점입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BatchReport report = runner.runBatch(items, new BatchConfig().withMaxConcurrency(5));
 * for (ImageResult result : report.results()) {
 *     // 제출 순서대로 성공 결과만 포함
 * }
 * RunStats stats = report.stats();
 * </pre>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public interface BatchRunner {

    /**
     * 배치 실행 (모든 항목이 종료될 때까지 블로킹).
     *
     * <p>항목 하나의 실패는 다른 항목을 중단시키지 않으며 예외로 전파되지 않습니다.
     * 실패는 {@code stats.failed()}와 로그로만 관찰됩니다.</p>
     *
     * @param items 생성 요청 목록
     * @param config 배치 설정
     * @return 성공 결과와 통계
     * @throws IllegalArgumentException items 또는 config가 null인 경우
     * @throws BatchCancelledException 대기 중 호출 스레드가 인터럽트된 경우
     */
    BatchReport runBatch(List<BatchItem> items, BatchConfig config);
}
