package com.phillippitts.autorecovery.service.registry;

import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers every {@link MonitoredService} bean of the application context at startup.
 */
@Component
class MonitoredServiceRegistrar {

    private static final Logger LOG = LogManager.getLogger(MonitoredServiceRegistrar.class);

    private final ServiceRegistry registry;
    private final List<MonitoredService> services;

    MonitoredServiceRegistrar(ServiceRegistry registry, ObjectProvider<MonitoredService> services) {
        this.registry = registry;
        this.services = services.orderedStream().toList();
    }

    @PostConstruct
    void registerAll() {
        for (MonitoredService service : services) {
            try {
                registry.register(service.serviceName(), service, service.dependencies());
            } catch (IllegalArgumentException e) {
                LOG.error("Skipping monitored service bean {}: {}", service.getClass().getName(), e.getMessage());
            }
        }
        LOG.info("Auto-registered {} monitored service(s)", services.size());
    }
}
