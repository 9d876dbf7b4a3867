package com.ryuqq.imagebatch.core.protection;

import com.ryuqq.imagebatch.core.time.Clock;
import com.ryuqq.imagebatch.core.time.Sleeper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TokenBucketLimiter 테스트.
 *
 * <p>용량 법칙은 testkit의 contract test가 검증합니다. 여기서는 인자 검증,
 * 인터럽트 전파, 다중 스레드 경쟁 시 초과 발급이 없는지를 확인합니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
class TokenBucketLimiterTest {

    @Test
    void 인자가_null이면_예외() {
        RateLimiterConfig config = RateLimiterConfig.perMinute(10);
        Sleeper sleeper = millis -> { };

        assertThatThrownBy(() -> new TokenBucketLimiter(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucketLimiter(config, null, sleeper))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("clock cannot be null");
        assertThatThrownBy(() -> new TokenBucketLimiter(config, () -> 0L, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sleeper cannot be null");
    }

    @Test
    void 대기_중_인터럽트는_전파된다() {
        // Given: 시간이 흐르지 않는 시계, 두 번째 poll에서 인터럽트
        AtomicInteger polls = new AtomicInteger();
        Sleeper sleeper = millis -> {
            if (polls.incrementAndGet() == 2) {
                throw new InterruptedException("cancelled");
            }
        };
        TokenBucketLimiter limiter = new TokenBucketLimiter(RateLimiterConfig.perMinute(1), () -> 0L, sleeper);
        assertThat(limiter.tryAcquire()).isTrue();

        // When & Then
        assertThatThrownBy(limiter::acquire).isInstanceOf(InterruptedException.class);
        assertThat(polls.get()).isEqualTo(2);
    }

    @Test
    void 시계가_역행해도_용량이_줄지_않는다() {
        AtomicLong now = new AtomicLong(TimeUnit.SECONDS.toNanos(10));
        Clock clock = now::get;
        TokenBucketLimiter limiter = new TokenBucketLimiter(RateLimiterConfig.perMinute(5), clock, millis -> { });
        limiter.tryAcquire();

        now.set(0L);

        assertThat(limiter.getAvailable()).isEqualTo(4.0);
    }

    @Test
    void 여러_스레드가_경쟁해도_초과_발급하지_않는다() throws Exception {
        // Given: 20/min, 시계는 poll마다 100ms 전진
        AtomicLong now = new AtomicLong();
        Sleeper sleeper = millis -> now.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
        TokenBucketLimiter limiter = new TokenBucketLimiter(RateLimiterConfig.perMinute(20), now::get, sleeper);
        AtomicInteger granted = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);

        try {
            // When
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    for (int j = 0; j < 5; j++) {
                        limiter.acquire();
                        granted.incrementAndGet();
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }

            // Then: 40 grants = 20 burst + 20 refilled → 최소 1분 경과
            assertThat(granted.get()).isEqualTo(40);
            assertThat(now.get()).isGreaterThanOrEqualTo(TimeUnit.SECONDS.toNanos(59));
        } finally {
            executor.shutdownNow();
        }
    }
}
