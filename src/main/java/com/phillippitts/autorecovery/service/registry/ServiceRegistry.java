package com.phillippitts.autorecovery.service.registry;

import com.phillippitts.autorecovery.domain.ServiceHealth;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.service.events.ServiceHealthChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Holds the supervised service handles and their health records.
 *
 * <p>The registry is the only owner of health records. Readers get {@link ServiceHealth}
 * snapshots; writers go through {@link #update}, which serializes on the record and
 * publishes a {@link ServiceHealthChangedEvent} after the lock is released whenever the
 * status changed.
 */
@Component
public class ServiceRegistry {

    private static final Logger LOG = LogManager.getLogger(ServiceRegistry.class);

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public ServiceRegistry(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers (or re-registers) a service with a fresh HEALTHY record.
     *
     * @param name unique service name
     * @param service service object; checked through {@link HealthCheckable} when it implements it
     * @param dependencies names of services this one depends on, may be null
     * @throws IllegalArgumentException if name is null or blank
     */
    public void register(String name, Object service, List<String> dependencies) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("service name must not be empty");
        }
        List<String> deps = dependencies == null ? List.of() : List.copyOf(dependencies);
        Entry previous = entries.put(name, new Entry(service, new HealthRecord(name, deps, clock.instant())));
        LOG.info("Service registered for recovery monitoring: name={}, dependencies={}, replaced={}",
                name, deps, previous != null);
    }

    /**
     * Removes the service and its health record. Unknown names are ignored.
     *
     * @return true if the service was registered
     */
    public boolean unregister(String name) {
        if (name == null) {
            return false;
        }
        Entry removed = entries.remove(name);
        if (removed != null) {
            LOG.info("Service unregistered from recovery monitoring: name={}", name);
        }
        return removed != null;
    }

    public boolean isRegistered(String name) {
        return name != null && entries.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(entries.keySet());
    }

    public Optional<ServiceHealth> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return update(name, HealthRecord::snapshot);
    }

    public Map<String, ServiceHealth> getAll() {
        Map<String, ServiceHealth> all = new LinkedHashMap<>();
        for (String name : entries.keySet()) {
            get(name).ifPresent(h -> all.put(name, h));
        }
        return all;
    }

    /** Registered service object, empty if unknown or registered with a null handle. */
    public Optional<Object> handle(String name) {
        Entry entry = name == null ? null : entries.get(name);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.service);
    }

    /**
     * Runs {@code fn} against the service's record while holding the record's lock.
     *
     * @return the function's result, or empty if the service is not registered or {@code fn} returned null
     */
    public <R> Optional<R> update(String name, Function<HealthRecord, R> fn) {
        Entry entry = entries.get(name);
        if (entry == null) {
            return Optional.empty();
        }
        ServiceStatus before;
        ServiceStatus after;
        R result;
        ServiceHealth snapshot;
        synchronized (entry.record) {
            before = entry.record.getStatus();
            result = fn.apply(entry.record);
            after = entry.record.getStatus();
            snapshot = before != after ? entry.record.snapshot() : null;
        }
        if (snapshot != null) {
            LOG.info("Service status changed: service={}, {} -> {}, consecutiveFailures={}",
                    name, before, after, snapshot.consecutiveFailures());
            publisher.publishEvent(new ServiceHealthChangedEvent(name, before, after, snapshot, clock.instant()));
        }
        return Optional.ofNullable(result);
    }

    private static final class Entry {
        private final Object service;
        private final HealthRecord record;

        private Entry(Object service, HealthRecord record) {
            this.service = service;
            this.record = record;
        }
    }
}
