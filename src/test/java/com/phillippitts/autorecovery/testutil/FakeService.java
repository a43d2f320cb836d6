package com.phillippitts.autorecovery.testutil;

import com.phillippitts.autorecovery.service.capability.Restartable;
import com.phillippitts.autorecovery.service.registry.HealthCheckResult;
import com.phillippitts.autorecovery.service.registry.HealthCheckable;
import com.phillippitts.autorecovery.util.Deadline;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Supervised service whose health the test flips by hand. A restart makes it healthy again
 * unless {@link #failStarts(boolean)} is set.
 */
public class FakeService implements HealthCheckable, Restartable {

    private final AtomicBoolean healthy = new AtomicBoolean(true);
    private final AtomicBoolean failStarts = new AtomicBoolean(false);
    private final AtomicInteger checks = new AtomicInteger();
    private final List<String> calls = new CopyOnWriteArrayList<>();

    public void setHealthy(boolean value) {
        healthy.set(value);
    }

    public void failStarts(boolean value) {
        failStarts.set(value);
    }

    public int checkCount() {
        return checks.get();
    }

    /** Restart lifecycle calls in order: prepare, stop, clear, start. */
    public List<String> calls() {
        return List.copyOf(calls);
    }

    @Override
    public HealthCheckResult checkHealth(Deadline deadline) {
        checks.incrementAndGet();
        return HealthCheckResult.of(healthy.get());
    }

    @Override
    public void prepareRestart() {
        calls.add("prepare");
    }

    @Override
    public void stop() {
        calls.add("stop");
    }

    @Override
    public void clearResources() {
        calls.add("clear");
    }

    @Override
    public void start() {
        calls.add("start");
        if (failStarts.get()) {
            throw new IllegalStateException("start failed");
        }
        healthy.set(true);
    }
}
