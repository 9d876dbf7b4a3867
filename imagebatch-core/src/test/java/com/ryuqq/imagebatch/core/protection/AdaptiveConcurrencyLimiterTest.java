package com.ryuqq.imagebatch.core.protection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AdaptiveConcurrencyLimiter 동시성 테스트.
 *
 * <p>윈도우 법칙(성장/축소/지연 회수)은 testkit의 contract test에서 검증하며,
 * 여기서는 여러 스레드가 경쟁하는 상황에서 보유 permit 수가 윈도우를 넘지 않는지 확인합니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
class AdaptiveConcurrencyLimiterTest {

    @Test
    void config가_null이면_예외() {
        assertThatThrownBy(() -> new AdaptiveConcurrencyLimiter(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("윈도우가 가득 차면 acquire는 release까지 대기한다")
    void acquire_가득_차면_대기() throws Exception {
        // Given
        AdaptiveConcurrencyLimiter limiter = new AdaptiveConcurrencyLimiter(new ConcurrencyLimiterConfig(2, 1, 2));
        limiter.acquire();
        limiter.acquire();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch acquired = new CountDownLatch(1);
        try {
            // When
            executor.submit(() -> {
                limiter.acquire();
                acquired.countDown();
                return null;
            });

            // Then
            assertThat(acquired.await(200, TimeUnit.MILLISECONDS)).isFalse();
            limiter.release();
            assertThat(acquired.await(2, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("경쟁 중 축소 후에도 동시 보유 수는 회수가 끝나면 윈도우 이하")
    void 동시_보유_수는_윈도우를_넘지_않는다() throws Exception {
        // Given
        AdaptiveConcurrencyLimiter limiter = new AdaptiveConcurrencyLimiter(new ConcurrencyLimiterConfig(8, 2, 8));
        AtomicInteger holding = new AtomicInteger();
        AtomicInteger maxAfterShrink = new AtomicInteger();
        CountDownLatch shrunk = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(16);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(executor.submit(() -> {
                    limiter.acquire();
                    try {
                        // 회수가 끝난 뒤에는 circulating이 다시 늘지 않는다
                        boolean settled = shrunk.getCount() == 0
                            && limiter.getCirculatingPermits() == limiter.getCurrent();
                        int now = holding.incrementAndGet();
                        if (settled) {
                            maxAfterShrink.accumulateAndGet(now, Math::max);
                        }
                        Thread.sleep(1);
                    } finally {
                        holding.decrementAndGet();
                        limiter.release();
                    }
                    return null;
                }));
                if (i == 50) {
                    limiter.reportRateLimited();
                    limiter.reportRateLimited();
                    shrunk.countDown();
                }
            }

            // When
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }

            // Then
            assertThat(limiter.getCurrent()).isEqualTo(4);
            assertThat(maxAfterShrink.get()).isLessThanOrEqualTo(4);
            assertThat(limiter.getCirculatingPermits()).isEqualTo(4);
            assertThat(limiter.getAvailablePermits()).isEqualTo(4);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void getConsecutiveSuccesses_축소시_초기화() {
        AdaptiveConcurrencyLimiter limiter = new AdaptiveConcurrencyLimiter(new ConcurrencyLimiterConfig(8, 2, 15));

        limiter.reportSuccess();
        limiter.reportSuccess();
        assertThat(limiter.getConsecutiveSuccesses()).isEqualTo(2);

        limiter.reportRateLimited();
        assertThat(limiter.getConsecutiveSuccesses()).isZero();
    }
}
