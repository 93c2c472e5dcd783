package io.cinerelay.sink;

import io.cinerelay.error.AuthExpiredException;

/**
 * Supplies the upload credential. Obtaining and renewing it is handled elsewhere;
 * the pipeline only tells an expired credential apart from other failures.
 */
public interface CredentialProvider {

    String accessToken() throws AuthExpiredException;
}
