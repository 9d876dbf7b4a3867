package com.ryuqq.imagebatch.core.time;

/**
 * 현재 스레드를 일정 시간 중단시키는 전략.
 *
 * <p>token bucket 폴링과 backoff 대기가 유일한 사용처입니다.
 * 인터럽트는 삼키지 않고 {@link InterruptedException}으로 전파해야 합니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정한 시간 동안 대기.
     *
     * @param millis 대기 시간 (밀리초, 0 이상)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(long millis) throws InterruptedException;

    /**
     * Thread.sleep 기반 Sleeper.
     *
     * @return 실제로 스레드를 중단시키는 Sleeper
     */
    static Sleeper system() {
        return Thread::sleep;
    }
}
