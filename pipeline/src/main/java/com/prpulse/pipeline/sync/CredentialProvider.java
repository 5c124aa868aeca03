package com.prpulse.pipeline.sync;

import com.prpulse.pipeline.domain.Organization;

/**
 * Supplies the opaque data-source token to sync an organization with.
 */
public interface CredentialProvider {

    /**
     * @throws MissingAuthorizationException if the organization has no usable authorization handle
     */
    String tokenFor(Organization organization) throws MissingAuthorizationException;
}
