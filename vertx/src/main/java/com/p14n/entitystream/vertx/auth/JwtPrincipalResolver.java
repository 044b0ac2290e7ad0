package com.p14n.entitystream.vertx.auth;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import com.p14n.entitystream.auth.AuthenticationException;
import com.p14n.entitystream.auth.Principal;
import com.p14n.entitystream.auth.PrincipalResolver;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.auth.PubSecKeyOptions;
import io.vertx.ext.auth.authentication.TokenCredentials;
import io.vertx.ext.auth.jwt.JWTAuth;
import io.vertx.ext.auth.jwt.JWTAuthOptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates signed JWT access tokens and maps their claims to a
 * {@link Principal}.
 *
 * <p>
 * Claims read:
 * </p>
 * <ul>
 * <li>{@code sub}: user id, required</li>
 * <li>{@code username}: display name</li>
 * <li>{@code privileges}: array of privilege names</li>
 * <li>{@code is_superuser}: administrator flag</li>
 * <li>{@code type}: when present it must be {@code access}</li>
 * </ul>
 * Signature and expiry are checked by Vert.x auth-jwt.
 */
public class JwtPrincipalResolver implements PrincipalResolver {
    private static final Logger logger = LoggerFactory.getLogger(JwtPrincipalResolver.class);

    static final String ACCESS_TOKEN_TYPE = "access";

    private final JWTAuth auth;

    public JwtPrincipalResolver(Vertx vertx, String secret, String algorithm) {
        this(JWTAuth.create(vertx, new JWTAuthOptions()
                .addPubSecKey(new PubSecKeyOptions()
                        .setAlgorithm(algorithm)
                        .setBuffer(secret))));
    }

    public JwtPrincipalResolver(JWTAuth auth) {
        this.auth = auth;
    }

    @Override
    public CompletableFuture<Principal> resolve(String token) {
        if (token == null || token.isBlank()) {
            return CompletableFuture.failedFuture(new AuthenticationException("Missing bearer token"));
        }
        return auth.authenticate(new TokenCredentials(token))
                .toCompletionStage()
                .toCompletableFuture()
                .handle((user, error) -> {
                    if (error != null) {
                        logger.atDebug().setCause(error).log("Rejected bearer token");
                        throw new AuthenticationException("Invalid or expired token", error);
                    }
                    return toPrincipal(user.principal());
                });
    }

    static Principal toPrincipal(JsonObject claims) {
        String type = claims.getString("type");
        if (type != null && !ACCESS_TOKEN_TYPE.equals(type)) {
            throw new AuthenticationException("Token type " + type + " cannot open a stream");
        }
        String userId = claims.getString("sub");
        if (userId == null || userId.isBlank()) {
            throw new AuthenticationException("Token has no subject");
        }
        Set<String> privileges = new HashSet<>();
        JsonArray granted = claims.getJsonArray("privileges");
        if (granted != null) {
            for (Object privilege : granted) {
                if (privilege instanceof String) {
                    privileges.add((String) privilege);
                }
            }
        }
        return new Principal(userId,
                claims.getString("username"),
                privileges,
                claims.getBoolean("is_superuser", false));
    }
}
