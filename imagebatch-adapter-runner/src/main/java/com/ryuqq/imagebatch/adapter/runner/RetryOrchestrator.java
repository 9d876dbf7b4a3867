package com.ryuqq.imagebatch.adapter.runner;

import com.ryuqq.imagebatch.core.error.ErrorKind;
import com.ryuqq.imagebatch.core.error.GenerationException;
import com.ryuqq.imagebatch.core.model.BatchItem;
import com.ryuqq.imagebatch.core.model.ImageResult;
import com.ryuqq.imagebatch.core.model.OutputTarget;
import com.ryuqq.imagebatch.core.outcome.Fail;
import com.ryuqq.imagebatch.core.outcome.Ok;
import com.ryuqq.imagebatch.core.outcome.Outcome;
import com.ryuqq.imagebatch.core.outcome.Retry;
import com.ryuqq.imagebatch.core.outcome.Skip;
import com.ryuqq.imagebatch.core.statemachine.ItemState;
import com.ryuqq.imagebatch.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.concurrent.Callable;

/**
 * 항목 하나의 재시도 제어 루프.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * PENDING
 *   ├─ skipExisting && exists(outputTarget) → SKIPPED (limiter 획득 없음)
 *   ↓
 * for attemptIndex in [0, maxRetries):
 *   1. concurrencyLimiter.acquire()  → rateLimiter.acquire()   (이 순서)
 *   2. IN_FLIGHT: generator.generate(...)
 *   3. 결과 분기:
 *      - 성공 → reportSuccess → release → SUCCESS
 *      - RATE_LIMITED → rateLimited++ → reportRateLimited → release → BACKOFF
 *      - SERVICE_OVERLOADED → release → BACKOFF
 *      - OTHER (또는 예상치 못한 예외) → release → FAILED
 *   4. BACKOFF: sleep(baseDelay * 2^attemptIndex)
 * 시도 소진 → FAILED
 * </pre>
 *
 * <p><strong>자원 보장:</strong> permit은 IN_FLIGHT를 벗어나는 모든 경로(성공, 재시도 가능한 실패,
 * 영구 실패, 예상치 못한 예외, 인터럽트)에서 반납됩니다. backoff 대기 중에는 permit을 보유하지 않습니다.</p>
 *
 * <p><strong>취소:</strong> 워커 스레드가 인터럽트되면 인터럽트 플래그를 복원하고
 * FAILED로 종료합니다. 시작된 항목은 정확히 한 번 집계됩니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public final class RetryOrchestrator implements Callable<Outcome> {

    private static final Logger log = LoggerFactory.getLogger(RetryOrchestrator.class);

    static final String MDC_ITEM_ID = "itemId";

    private final BatchItem item;
    private final BatchContext context;

    private volatile ItemState state = ItemState.PENDING;
    private volatile int attempts;

    /**
     * 생성자.
     *
     * @param item 처리할 항목
     * @param context 배치 공유 자원
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RetryOrchestrator(BatchItem item, BatchContext context) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.item = item;
        this.context = context;
    }

    /**
     * 항목을 종료 상태까지 처리.
     *
     * <p>실패는 예외로 전파되지 않고 {@link Fail}로 반환됩니다.</p>
     *
     * @return 종료 결과 (Ok, Fail, Skip)
     */
    @Override
    public Outcome call() {
        OutputTarget target = item.outputTarget();
        try {
            MDC.put(MDC_ITEM_ID, target.name());
            if (shouldSkip(target)) {
                moveTo(ItemState.SKIPPED);
                context.stats().recordSkip();
                log.info("Skipped (exists): {}", target);
                return new Skip(target);
            }
            return runAttempts(target);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(new Fail(ErrorKind.OTHER, "Interrupted while processing " + target.name(), attempts));
        } catch (RuntimeException e) {
            log.error("Unexpected error before generation: {}", target, e);
            return fail(new Fail(ErrorKind.OTHER, describe(e), attempts));
        } finally {
            MDC.remove(MDC_ITEM_ID);
        }
    }

    private boolean shouldSkip(OutputTarget target) {
        return context.skipExisting() && context.outputStore().exists(target);
    }

    private Outcome runAttempts(OutputTarget target) throws InterruptedException {
        int maxRetries = context.maxRetries();
        Retry lastRetry = null;

        for (int attemptIndex = 0; attemptIndex < maxRetries; attemptIndex++) {
            Outcome outcome = attempt(attemptIndex);

            if (outcome instanceof Ok ok) {
                moveTo(ItemState.SUCCESS);
                context.stats().recordSuccess();
                log.info("Generated: {} ({}x{})", target.name(), ok.result().width(), ok.result().height());
                return ok;
            }
            if (outcome instanceof Fail failure) {
                log.error("Failed: {} - {}", target.name(), failure.message());
                return fail(failure);
            }

            lastRetry = (Retry) outcome;
            moveTo(ItemState.BACKOFF);
            log.warn("{}: {}, retry {}/{} in {}ms",
                lastRetry.kind() == ErrorKind.RATE_LIMITED ? "Rate limited" : "Service overloaded",
                target.name(), attemptIndex + 1, maxRetries, lastRetry.nextRetryAfterMillis());
            context.sleeper().sleep(lastRetry.nextRetryAfterMillis());
        }

        log.error("Failed after {} attempts: {}", maxRetries, target.name());
        return fail(new Fail(lastRetry.kind(), lastRetry.reason(), attempts));
    }

    /**
     * 시도 1회: permit → token → generate → 분류.
     *
     * @param attemptIndex 시도 인덱스 (0부터)
     * @return Ok, Retry, Fail 중 하나
     * @throws InterruptedException limiter 대기 또는 생성 호출 중 인터럽트 발생 시
     */
    private Outcome attempt(int attemptIndex) throws InterruptedException {
        context.concurrencyLimiter().acquire();
        try {
            context.rateLimiter().acquire();
            moveTo(ItemState.IN_FLIGHT);
            attempts = attemptIndex + 1;

            ImageResult result = context.generator().generate(
                item.prompt(),
                item.outputTarget(),
                item.effectiveConfig(context.defaultImageConfig())
            );
            context.concurrencyLimiter().reportSuccess();
            return new Ok(result, attempts);

        } catch (GenerationException e) {
            return classify(e.getKind(), describe(e), attemptIndex);
        } catch (RuntimeException e) {
            return classify(ErrorKind.OTHER, describe(e), attemptIndex);
        } finally {
            context.concurrencyLimiter().release();
        }
    }

    private Outcome classify(ErrorKind kind, String message, int attemptIndex) {
        if (!kind.isRetryable()) {
            return new Fail(kind, message, attempts);
        }
        if (kind.reducesConcurrency()) {
            context.stats().recordRateLimited();
            context.concurrencyLimiter().reportRateLimited();
        }
        return new Retry(kind, message, attemptIndex + 1, context.backoff().calculate(attemptIndex));
    }

    private Fail fail(Fail failure) {
        moveTo(ItemState.FAILED);
        context.stats().recordFailure();
        return failure;
    }

    private void moveTo(ItemState next) {
        state = StateTransition.transition(state, next);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    public ItemState getState() {
        return state;
    }

    /**
     * 생성 호출까지 도달한 시도 횟수.
     *
     * @return 0 이상 maxRetries 이하
     */
    public int getAttempts() {
        return attempts;
    }
}
