package com.ryuqq.imagebatch.adapter.runner;

import com.ryuqq.imagebatch.application.batch.BatchCancelledException;
import com.ryuqq.imagebatch.application.batch.BatchConfig;
import com.ryuqq.imagebatch.application.batch.BatchReport;
import com.ryuqq.imagebatch.application.batch.BatchRunner;
import com.ryuqq.imagebatch.application.stats.RunStats;
import com.ryuqq.imagebatch.application.stats.RunStatsCollector;
import com.ryuqq.imagebatch.core.error.ErrorKind;
import com.ryuqq.imagebatch.core.model.BatchItem;
import com.ryuqq.imagebatch.core.model.ImageResult;
import com.ryuqq.imagebatch.core.outcome.Fail;
import com.ryuqq.imagebatch.core.outcome.Ok;
import com.ryuqq.imagebatch.core.outcome.Outcome;
import com.ryuqq.imagebatch.core.protection.AdaptiveConcurrencyLimiter;
import com.ryuqq.imagebatch.core.protection.ConcurrencyLimiterConfig;
import com.ryuqq.imagebatch.core.protection.RateLimiterConfig;
import com.ryuqq.imagebatch.core.protection.TokenBucketLimiter;
import com.ryuqq.imagebatch.core.spi.ImageGenerator;
import com.ryuqq.imagebatch.core.spi.OutputStore;
import com.ryuqq.imagebatch.core.time.Clock;
import com.ryuqq.imagebatch.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * BatchRunner 구현체 (fan-out / fan-in).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runBatch(items, config)
 *   ↓
 * 배치 전용 자원 생성:
 *   - AdaptiveConcurrencyLimiter (min=2, max=maxConcurrency, initial=min(maxConcurrency, 8))
 *   - TokenBucketLimiter (rpmLimit)
 *   - RunStatsCollector (total=items.size())
 *   ↓
 * 항목마다 RetryOrchestrator 1개를 워커 풀에 제출 (fan-out)
 *   ↓
 * 제출 순서대로 Future 대기 (fan-in)
 *   ↓
 * Ok 결과만 제출 순서대로 수집 + 통계 스냅샷
 * </pre>
 *
 * <p><strong>격리:</strong> 한 항목의 실패는 다른 항목을 취소하지 않습니다.
 * 배치 수준 실패는 호출 스레드의 인터럽트(취소)뿐이며, 이 경우 모든 워커를 인터럽트하고
 * 종료를 기다린 뒤 {@link BatchCancelledException}을 던집니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public final class BatchCoordinator implements BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private static final long CANCEL_AWAIT_SECONDS = 30;

    private final ImageGenerator generator;
    private final OutputStore outputStore;
    private final Clock clock;
    private final Sleeper sleeper;

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param generator 생성 협력자
     * @param outputStore 결과물 존재 확인 협력자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public BatchCoordinator(ImageGenerator generator, OutputStore outputStore) {
        this(generator, outputStore, Clock.system(), Sleeper.system());
    }

    /**
     * 생성자 (시계/대기 전략 주입).
     *
     * @param generator 생성 협력자
     * @param outputStore 결과물 존재 확인 협력자
     * @param clock token bucket 시계
     * @param sleeper token bucket 폴링 및 backoff 대기 전략
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public BatchCoordinator(ImageGenerator generator, OutputStore outputStore, Clock clock, Sleeper sleeper) {
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
        if (outputStore == null) {
            throw new IllegalArgumentException("outputStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.generator = generator;
        this.outputStore = outputStore;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public BatchReport runBatch(List<BatchItem> items, BatchConfig config) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        RunStatsCollector stats = new RunStatsCollector(items.size());
        if (items.isEmpty()) {
            return new BatchReport(List.of(), List.of(), stats.snapshot());
        }

        BatchContext context = createContext(config, stats);
        ExecutorService workers = Executors.newFixedThreadPool(Math.min(items.size(), config.maxWorkerThreads()));

        try {
            List<Future<Outcome>> futures = new ArrayList<>(items.size());
            for (BatchItem item : items) {
                futures.add(workers.submit(new RetryOrchestrator(item, context)));
            }

            List<Outcome> outcomes = awaitAll(futures, workers, stats);
            List<ImageResult> results = new ArrayList<>();
            for (Outcome outcome : outcomes) {
                if (outcome instanceof Ok ok) {
                    results.add(ok.result());
                }
            }

            RunStats snapshot = stats.snapshot();
            log.info("Batch complete: {}/{} successful, {} skipped, {} failed, {} rate limited",
                snapshot.successful(), snapshot.total(), snapshot.skipped(), snapshot.failed(), snapshot.rateLimited());
            return new BatchReport(results, outcomes, snapshot);
        } finally {
            workers.shutdown();
        }
    }

    private BatchContext createContext(BatchConfig config, RunStatsCollector stats) {
        AdaptiveConcurrencyLimiter concurrencyLimiter = new AdaptiveConcurrencyLimiter(
            ConcurrencyLimiterConfig.forMaxConcurrency(
                config.maxConcurrency(),
                config.minConcurrency(),
                config.initialConcurrencyCap()
            )
        );
        TokenBucketLimiter rateLimiter = new TokenBucketLimiter(
            new RateLimiterConfig(config.rpmLimit(), config.pollIntervalMs()),
            clock,
            sleeper
        );

        return new BatchContext(
            concurrencyLimiter,
            rateLimiter,
            generator,
            outputStore,
            stats,
            BackoffCalculator.from(config),
            sleeper,
            config.maxRetries(),
            config.skipExisting(),
            config.defaultImageConfig()
        );
    }

    /**
     * 제출 순서대로 모든 항목의 종료를 대기.
     *
     * @param futures 항목별 Future (제출 순서)
     * @param workers 워커 풀
     * @param stats 공유 통계
     * @return 제출 순서의 종료 결과
     * @throws BatchCancelledException 대기 중 인터럽트 발생 시
     */
    private List<Outcome> awaitAll(List<Future<Outcome>> futures, ExecutorService workers, RunStatsCollector stats) {
        List<Outcome> outcomes = new ArrayList<>(futures.size());
        try {
            for (Future<Outcome> future : futures) {
                outcomes.add(awaitOne(future, stats));
            }
            return outcomes;
        } catch (InterruptedException e) {
            throw cancel(workers, stats, e);
        }
    }

    /**
     * 항목 하나의 종료 대기.
     *
     * <p>워커가 Outcome 없이 비정상 종료하면 (RetryOrchestrator가 잡지 않는 Error 등)
     * 해당 항목만 FAILED로 집계하고 나머지 항목의 fan-in은 계속합니다.</p>
     */
    private Outcome awaitOne(Future<Outcome> future, RunStatsCollector stats) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Item worker terminated abnormally", cause);
            stats.recordFailure();
            String message = cause.getMessage() == null || cause.getMessage().isBlank()
                ? cause.getClass().getSimpleName()
                : cause.getMessage();
            return new Fail(ErrorKind.OTHER, "Item worker terminated abnormally: " + message, 0);
        }
    }

    /**
     * 취소 처리: 모든 워커 인터럽트 → 종료 대기 → 일관된 통계와 함께 예외 생성.
     *
     * <p>시작되지 않은 항목은 집계되지 않고, 시작된 항목은 FAILED로 한 번 집계됩니다.</p>
     */
    private BatchCancelledException cancel(ExecutorService workers, RunStatsCollector stats, InterruptedException cause) {
        List<Runnable> neverStarted = workers.shutdownNow();
        // awaitTermination이 즉시 InterruptedException을 던지지 않도록 플래그를 잠시 해제
        Thread.interrupted();
        try {
            if (!workers.awaitTermination(CANCEL_AWAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Item workers did not terminate within {}s after cancellation", CANCEL_AWAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            cause.addSuppressed(e);
        } finally {
            Thread.currentThread().interrupt();
        }

        RunStats snapshot = stats.snapshot();
        log.warn("Batch cancelled: {} items never started, {}", neverStarted.size(), snapshot);
        return new BatchCancelledException(snapshot, cause);
    }
}
