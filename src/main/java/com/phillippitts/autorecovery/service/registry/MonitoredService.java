package com.phillippitts.autorecovery.service.registry;

import java.util.List;

/**
 * Spring bean that registers itself for supervision when the application starts.
 */
public interface MonitoredService extends HealthCheckable {

    String serviceName();

    default List<String> dependencies() {
        return List.of();
    }
}
