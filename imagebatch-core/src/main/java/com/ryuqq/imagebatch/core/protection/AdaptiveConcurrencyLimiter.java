package com.ryuqq.imagebatch.core.protection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 성공/rate-limit 신호에 따라 크기가 조정되는 permit pool.
 *
 * <p><strong>목표 크기와 순환 permit 수의 분리:</strong></p>
 * <ul>
 *   <li>{@code current}: 논리적 목표 크기. 항상 min ≤ current ≤ max</li>
 *   <li>{@code circulating}: 실제로 순환 중인 permit 수 (대기 중인 permit + 보유 중인 permit)</li>
 * </ul>
 *
 * <p><strong>조정 규칙:</strong></p>
 * <pre>
 * reportSuccess()      : 연속 성공 10회마다 current + 1 (max 상한), permit 1개 주입
 * reportRateLimited()  : current - 2 (min 하한), 연속 성공 0으로 초기화,
 *                        지금 대기 중인 permit만 최대 2개 즉시 회수 (논블로킹)
 * release()            : circulating > current 이면 반납된 permit을 순환에서 제거 (지연 회수)
 * </pre>
 *
 * <p>모든 크기/카운터 변경은 하나의 lock 안에서 수행되며,
 * lock을 보유한 채로 대기하는 연산은 없습니다. 대기는 {@link #acquire()}의 semaphore에서만 발생합니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public final class AdaptiveConcurrencyLimiter implements ConcurrencyLimiter {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveConcurrencyLimiter.class);

    private final ConcurrencyLimiterConfig config;
    private final Semaphore permits;
    private final ReentrantLock lock = new ReentrantLock();

    private int current;
    private int circulating;
    private int consecutiveSuccesses;

    /**
     * 생성자.
     *
     * @param config limiter 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public AdaptiveConcurrencyLimiter(ConcurrencyLimiterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.current = config.initial();
        this.circulating = config.initial();
        this.permits = new Semaphore(config.initial(), true);
    }

    @Override
    public void acquire() throws InterruptedException {
        permits.acquire();
    }

    @Override
    public void release() {
        lock.lock();
        try {
            if (circulating > current) {
                circulating--;
                log.debug("Reclaimed released permit: circulating {} -> target {}", circulating, current);
                return;
            }
            permits.release();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reportSuccess() {
        lock.lock();
        try {
            consecutiveSuccesses++;
            if (consecutiveSuccesses % config.growthThreshold() == 0) {
                grow();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reportRateLimited() {
        lock.lock();
        try {
            consecutiveSuccesses = 0;
            shrink();
        } finally {
            lock.unlock();
        }
    }

    private void grow() {
        if (current >= config.max()) {
            return;
        }
        int old = current;
        current = current + 1;
        if (circulating < current) {
            circulating++;
            permits.release();
        }
        log.info("Increased concurrency: {} -> {}", old, current);
    }

    private void shrink() {
        if (current <= config.min()) {
            return;
        }
        int old = current;
        current = Math.max(current - config.shrinkStep(), config.min());

        int reclaimable = Math.min(old - current, circulating - current);
        int reclaimed = 0;
        while (reclaimed < reclaimable && permits.tryAcquire()) {
            reclaimed++;
        }
        circulating -= reclaimed;
        log.warn("Decreased concurrency: {} -> {} (reclaimed {} idle permits, {} pending release)",
            old, current, reclaimed, circulating - current);
    }

    @Override
    public int getCurrent() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 실제로 순환 중인 permit 수 조회.
     *
     * <p>지연 회수가 끝나지 않은 동안에는 {@link #getCurrent()}보다 클 수 있습니다.</p>
     *
     * @return 대기 중 + 보유 중인 permit 수
     */
    public int getCirculatingPermits() {
        lock.lock();
        try {
            return circulating;
        } finally {
            lock.unlock();
        }
    }

    public int getAvailablePermits() {
        return permits.availablePermits();
    }

    public int getConsecutiveSuccesses() {
        lock.lock();
        try {
            return consecutiveSuccesses;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ConcurrencyLimiterConfig getConfig() {
        return config;
    }
}
