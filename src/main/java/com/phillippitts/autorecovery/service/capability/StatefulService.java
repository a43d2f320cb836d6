package com.phillippitts.autorecovery.service.capability;

/**
 * Service whose state can be moved to a backup during failover.
 */
public interface StatefulService {

    Object exportState() throws Exception;

    void importState(Object state) throws Exception;
}
