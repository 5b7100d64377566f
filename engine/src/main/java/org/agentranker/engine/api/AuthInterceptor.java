package org.agentranker.engine.api;

import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Interceptor that authenticates metric store calls with a Bearer token.
 */
public final class AuthInterceptor implements Interceptor {

    private static final Logger LOG = Logger.getLogger(AuthInterceptor.class.getName());

    private final TokenManager tokenManager;

    public AuthInterceptor(TokenManager tokenManager) {
        this.tokenManager = Objects.requireNonNull(tokenManager, "tokenManager must not be null");
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        String token;
        try {
            token = tokenManager.getAccessToken();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "[Auth] Could not obtain access token for " + chain.request().url(), e);
            throw e;
        }

        Request authenticated = chain.request().newBuilder()
                .header("Authorization", "Bearer " + token)
                .build();
        return chain.proceed(authenticated);
    }
}
