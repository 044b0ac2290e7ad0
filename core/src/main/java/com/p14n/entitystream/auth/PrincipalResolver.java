package com.p14n.entitystream.auth;

import java.util.concurrent.CompletableFuture;

/**
 * Turns a bearer token into an authenticated {@link Principal}.
 * Token issuing lives outside this service; implementations only validate.
 */
public interface PrincipalResolver {

    /**
     * @param token the raw bearer token
     * @return a future with the principal, or completing exceptionally with an
     *         {@link AuthenticationException} when the token is not acceptable
     */
    CompletableFuture<Principal> resolve(String token);
}
