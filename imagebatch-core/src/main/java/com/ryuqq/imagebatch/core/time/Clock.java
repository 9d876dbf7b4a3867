package com.ryuqq.imagebatch.core.time;

/**
 * 단조 증가 시계.
 *
 * <p>limiter의 refill 계산에 사용됩니다. 테스트에서는 수동 시계로 대체합니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Clock {

    /**
     * 현재 시각 (나노초, 임의 기준점).
     *
     * @return 단조 증가 나노초 값
     */
    long nowNanos();

    static Clock system() {
        return SystemClock.instance();
    }
}
