package com.ryuqq.imagebatch.testkit;

import com.ryuqq.imagebatch.core.time.Clock;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 테스트용 수동 시계.
 *
 * <p>명시적으로 {@link #advance(Duration)}를 호출할 때만 시간이 흐릅니다. 여러 스레드에서 안전하게 사용할 수 있습니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public final class ManualClock implements Clock {

    private final AtomicLong nanos;

    public ManualClock() {
        this(0L);
    }

    public ManualClock(long startNanos) {
        this.nanos = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return nanos.get();
    }

    public void advance(Duration duration) {
        advanceNanos(duration.toNanos());
    }

    public void advanceMillis(long millis) {
        advanceNanos(TimeUnit.MILLISECONDS.toNanos(millis));
    }

    public void advanceNanos(long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("delta must not be negative (current: " + delta + ")");
        }
        nanos.addAndGet(delta);
    }
}
