package com.ryuqq.imagebatch.core.protection;

import com.ryuqq.imagebatch.core.time.Clock;
import com.ryuqq.imagebatch.core.time.Sleeper;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Token Bucket RPM limiter.
 *
 * <ul>
 *   <li>capacity: 실수 용량. 0 ≤ capacity ≤ maxPerMinute, 가득 찬 상태로 시작</li>
 *   <li>refill: 경과 시간에 비례해 연속 충전 ({@code maxPerMinute * elapsed / 60s})</li>
 *   <li>consume: 용량이 1 이상일 때만 정수 단위 1개 소비</li>
 * </ul>
 *
 * <p>refill과 consume은 하나의 lock 안에서 수행되어 두 호출자가 같은 부분 토큰을
 * 소비할 수 없습니다. 용량이 부족하면 lock을 풀고 pollIntervalMs만큼 대기한 뒤 다시 시도합니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public final class TokenBucketLimiter implements RateLimiter {

    private static final double NANOS_PER_MINUTE = 60_000_000_000d;

    private final RateLimiterConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();

    private double capacity;
    private long lastRefillNanos;

    public TokenBucketLimiter(RateLimiterConfig config) {
        this(config, Clock.system(), Sleeper.system());
    }

    /**
     * 생성자 (시계/대기 전략 주입).
     *
     * @param config limiter 설정
     * @param clock 시계
     * @param sleeper 폴링 대기 전략
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TokenBucketLimiter(RateLimiterConfig config, Clock clock, Sleeper sleeper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.capacity = config.maxPerMinute();
        this.lastRefillNanos = clock.nowNanos();
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill();
            if (capacity >= 1.0) {
                capacity -= 1.0;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void acquire() throws InterruptedException {
        while (!tryAcquire()) {
            sleeper.sleep(config.pollIntervalMs());
        }
    }

    @Override
    public double getAvailable() {
        lock.lock();
        try {
            return Math.min(capacity + refillAmount(clock.nowNanos()), config.maxPerMinute());
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = clock.nowNanos();
        capacity = Math.min(capacity + refillAmount(now), config.maxPerMinute());
        lastRefillNanos = now;
    }

    private double refillAmount(long now) {
        long elapsed = Math.max(0L, now - lastRefillNanos);
        return config.maxPerMinute() * elapsed / NANOS_PER_MINUTE;
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }
}
