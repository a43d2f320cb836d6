package com.phillippitts.autorecovery.exception;

/**
 * Thrown at the API boundary when a lookup names a service or execution that is not known.
 */
public class ServiceNotFoundException extends RecoveryManagerException {

    private final String name;

    public ServiceNotFoundException(String kind, String name) {
        super(kind + " not found: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
