package com.ryuqq.imagebatch.testkit;

import com.ryuqq.imagebatch.core.error.ErrorKind;
import com.ryuqq.imagebatch.core.error.GenerationException;
import com.ryuqq.imagebatch.core.model.ImageConfig;
import com.ryuqq.imagebatch.core.model.ImageResult;
import com.ryuqq.imagebatch.core.model.OutputTarget;
import com.ryuqq.imagebatch.core.spi.ImageGenerator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 프롬프트별로 실패 시나리오를 지정할 수 있는 ImageGenerator (테스트용).
 *
 * <p><strong>시나리오:</strong></p>
 * <ul>
 *   <li>{@link #failFirst(String, ErrorKind, int)}: 처음 n번 실패 후 성공</li>
 *   <li>{@link #alwaysFail(String, ErrorKind)}: 항상 실패</li>
 *   <li>지정하지 않은 프롬프트: 항상 성공</li>
 * </ul>
 *
 * <p>호출 중인 요청 수의 최대값(high-water mark)을 기록하여 동시성 상한 검증에 사용합니다.
 * {@link #withCallDelayMillis(long)}로 호출마다 실제 대기를 추가할 수 있으며, 이 대기는 인터럽트에 반응합니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public final class ScriptedImageGenerator implements ImageGenerator {

    public static final int WIDTH = 832;
    public static final int HEIGHT = 1248;

    private final Map<String, Deque<ErrorKind>> scripts = new ConcurrentHashMap<>();
    private final Map<String, ErrorKind> permanentFailures = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> callCounts = new ConcurrentHashMap<>();
    private final AtomicInteger totalCalls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private volatile long callDelayMillis;

    /**
     * 처음 times번 호출을 kind로 실패시킴.
     *
     * @param prompt 대상 프롬프트
     * @param kind 실패 종류
     * @param times 실패 횟수
     * @return this
     */
    public ScriptedImageGenerator failFirst(String prompt, ErrorKind kind, int times) {
        Deque<ErrorKind> script = scripts.computeIfAbsent(prompt, p -> new ArrayDeque<>());
        synchronized (script) {
            for (int i = 0; i < times; i++) {
                script.addLast(kind);
            }
        }
        return this;
    }

    public ScriptedImageGenerator alwaysFail(String prompt, ErrorKind kind) {
        permanentFailures.put(prompt, kind);
        return this;
    }

    public ScriptedImageGenerator withCallDelayMillis(long millis) {
        this.callDelayMillis = millis;
        return this;
    }

    @Override
    public ImageResult generate(String prompt, OutputTarget target, ImageConfig config)
            throws GenerationException, InterruptedException {
        callCounts.computeIfAbsent(prompt, p -> new AtomicInteger()).incrementAndGet();
        totalCalls.incrementAndGet();
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            long delay = callDelayMillis;
            if (delay > 0) {
                Thread.sleep(delay);
            }
            ErrorKind failure = nextFailure(prompt);
            if (failure != null) {
                throw toException(failure, prompt);
            }
            return new ImageResult(target, WIDTH, HEIGHT, prompt, delay, config.model(), config.aspectRatio());
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private ErrorKind nextFailure(String prompt) {
        ErrorKind permanent = permanentFailures.get(prompt);
        if (permanent != null) {
            return permanent;
        }
        Deque<ErrorKind> script = scripts.get(prompt);
        if (script == null) {
            return null;
        }
        synchronized (script) {
            return script.pollFirst();
        }
    }

    private static GenerationException toException(ErrorKind kind, String prompt) {
        return switch (kind) {
            case RATE_LIMITED -> GenerationException.rateLimited("429 RESOURCE_EXHAUSTED for " + prompt);
            case SERVICE_OVERLOADED -> GenerationException.overloaded("503 UNAVAILABLE for " + prompt);
            case OTHER -> GenerationException.other("400 INVALID_ARGUMENT for " + prompt, null);
        };
    }

    public int getCallCount(String prompt) {
        AtomicInteger count = callCounts.get(prompt);
        return count == null ? 0 : count.get();
    }

    public int getTotalCalls() {
        return totalCalls.get();
    }

    public int getMaxInFlight() {
        return maxInFlight.get();
    }

    public int getInFlight() {
        return inFlight.get();
    }
}
