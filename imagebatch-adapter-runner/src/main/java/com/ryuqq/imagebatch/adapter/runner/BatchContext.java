package com.ryuqq.imagebatch.adapter.runner;

import com.ryuqq.imagebatch.application.stats.RunStatsCollector;
import com.ryuqq.imagebatch.core.model.ImageConfig;
import com.ryuqq.imagebatch.core.protection.ConcurrencyLimiter;
import com.ryuqq.imagebatch.core.protection.RateLimiter;
import com.ryuqq.imagebatch.core.spi.ImageGenerator;
import com.ryuqq.imagebatch.core.spi.OutputStore;
import com.ryuqq.imagebatch.core.time.Sleeper;

/**
 * 배치 한 번 동안 모든 RetryOrchestrator가 공유하는 자원.
 *
 * <p>BatchCoordinator가 배치마다 새로 만들며, 배치 간에 공유되지 않습니다.</p>
 *
 * @param concurrencyLimiter 공유 동시성 윈도우
 * @param rateLimiter 공유 RPM token bucket
 * @param generator 생성 협력자
 * @param outputStore 결과물 존재 확인 협력자
 * @param stats 공유 통계 카운터
 * @param backoff backoff 계산기
 * @param sleeper backoff 대기 전략
 * @param maxRetries 항목당 최대 시도 횟수
 * @param skipExisting 결과물 존재 시 건너뛰기 여부
 * @param defaultImageConfig 항목별 설정이 없을 때 사용할 설정
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public record BatchContext(
    ConcurrencyLimiter concurrencyLimiter,
    RateLimiter rateLimiter,
    ImageGenerator generator,
    OutputStore outputStore,
    RunStatsCollector stats,
    BackoffCalculator backoff,
    Sleeper sleeper,
    int maxRetries,
    boolean skipExisting,
    ImageConfig defaultImageConfig
) {

    public BatchContext {
        if (concurrencyLimiter == null) {
            throw new IllegalArgumentException("concurrencyLimiter cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
        if (outputStore == null) {
            throw new IllegalArgumentException("outputStore cannot be null");
        }
        if (stats == null) {
            throw new IllegalArgumentException("stats cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive (current: " + maxRetries + ")");
        }
        if (defaultImageConfig == null) {
            throw new IllegalArgumentException("defaultImageConfig cannot be null");
        }
    }
}
