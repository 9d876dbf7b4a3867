package com.ryuqq.imagebatch.application.stats;

/**
 * 배치 실행 통계 스냅샷 (불변 record).
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>successful + failed + skipped ≤ total (실행 중 언제나)</li>
 *   <li>successful + failed + skipped == total (배치 완료 시)</li>
 * </ul>
 *
 * <p>rateLimited는 항목 수가 아니라 RATE_LIMITED 실패가 발생한 시도 횟수입니다.
 * 한 항목이 4번 rate-limit 후 성공하면 rateLimited는 4 증가합니다.</p>
 *
 * @param total 제출된 항목 수
 * @param successful 성공 항목 수
 * @param failed 실패 항목 수
 * @param skipped 건너뛴 항목 수
 * @param rateLimited RATE_LIMITED 시도 횟수
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record RunStats(
    int total,
    int successful,
    int failed,
    int skipped,
    int rateLimited
) {

    public RunStats {
        if (total < 0 || successful < 0 || failed < 0 || skipped < 0 || rateLimited < 0) {
            throw new IllegalArgumentException("counters must be non-negative");
        }
    }

    public static RunStats empty(int total) {
        return new RunStats(total, 0, 0, 0, 0);
    }

    /**
     * 종료된 항목 수.
     *
     * @return successful + failed + skipped
     */
    public int finished() {
        return successful + failed + skipped;
    }

    public boolean isComplete() {
        return finished() == total;
    }

    @Override
    public String toString() {
        return String.format("RunStats{total=%d, successful=%d, failed=%d, skipped=%d, rateLimited=%d}",
            total, successful, failed, skipped, rateLimited);
    }
}
