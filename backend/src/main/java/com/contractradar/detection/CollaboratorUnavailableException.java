package com.contractradar.detection;

/**
 * A step's required collaborator returned no data. Ends that step with a step error; later steps still run.
 */
public class CollaboratorUnavailableException extends RuntimeException {

    public CollaboratorUnavailableException(String collaborator) {
        super(collaborator + " unavailable");
    }
}
