package com.prpulse.pipeline.sync;

/**
 * No credential can be resolved for an organization. Fatal for the whole run.
 */
public class MissingAuthorizationException extends Exception {

    public MissingAuthorizationException(String message) {
        super(message);
    }
}
