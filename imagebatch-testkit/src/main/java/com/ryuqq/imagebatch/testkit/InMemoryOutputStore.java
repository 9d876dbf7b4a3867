package com.ryuqq.imagebatch.testkit;

import com.ryuqq.imagebatch.core.model.OutputTarget;
import com.ryuqq.imagebatch.core.spi.OutputStore;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-Memory OutputStore (테스트용).
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public final class InMemoryOutputStore implements OutputStore {

    private final Set<String> existing = ConcurrentHashMap.newKeySet();
    private final AtomicInteger checks = new AtomicInteger();

    public InMemoryOutputStore add(String location) {
        existing.add(location);
        return this;
    }

    @Override
    public boolean exists(OutputTarget target) {
        checks.incrementAndGet();
        return existing.contains(target.location());
    }

    public int getCheckCount() {
        return checks.get();
    }
}
