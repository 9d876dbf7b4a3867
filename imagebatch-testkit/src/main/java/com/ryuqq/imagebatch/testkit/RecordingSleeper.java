package com.ryuqq.imagebatch.testkit;

import com.ryuqq.imagebatch.core.time.Sleeper;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 대기 요청을 기록만 하는 Sleeper.
 *
 * <p>실제로 대기하지 않으며, {@link ManualClock}이 연결된 경우 요청된 만큼 시계를 전진시킵니다.
 * 인터럽트된 스레드에서 호출되면 실제 sleep과 동일하게 {@link InterruptedException}을 던집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ManualClock clock = new ManualClock();
 * RecordingSleeper sleeper = RecordingSleeper.advancing(clock);
 * TokenBucketLimiter limiter = new TokenBucketLimiter(config, clock, sleeper);
 * }</pre>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final ManualClock clock;
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();

    private RecordingSleeper(ManualClock clock) {
        this.clock = clock;
    }

    public static RecordingSleeper recording() {
        return new RecordingSleeper(null);
    }

    public static RecordingSleeper advancing(ManualClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return new RecordingSleeper(clock);
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted before sleep of " + millis + "ms");
        }
        sleeps.add(millis);
        if (clock != null) {
            clock.advanceMillis(millis);
        }
    }

    public List<Long> getSleeps() {
        return new ArrayList<>(sleeps);
    }

    /**
     * 지정된 길이의 대기만 추출 (polling 대기와 backoff 대기 구분용).
     *
     * @param millis 대기 길이
     * @return 해당 길이의 대기 횟수
     */
    public long countSleepsOf(long millis) {
        return sleeps.stream().filter(s -> s == millis).count();
    }
}
