package org.agentranker.engine.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Obtains and caches Keycloak access tokens with the client credentials grant.
 */
public final class TokenManager {

    private static final Logger LOG = Logger.getLogger(TokenManager.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Refresh this long before the token actually expires
    private static final long EXPIRY_MARGIN_MS = 10_000L;

    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final OkHttpClient httpClient;

    private String accessToken;
    private long expiresAtMillis;

    public TokenManager(String tokenUrl, String clientId, String clientSecret) {
        this(tokenUrl, clientId, clientSecret, new OkHttpClient());
    }

    TokenManager(String tokenUrl, String clientId, String clientSecret, OkHttpClient httpClient) {
        this.tokenUrl = Objects.requireNonNull(tokenUrl, "tokenUrl must not be null");
        this.clientId = Objects.requireNonNull(clientId, "clientId must not be null");
        this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    /**
     * Token endpoint of a Keycloak realm.
     */
    public static String tokenUrl(String keycloakUrl, String realm) {
        String base = keycloakUrl.endsWith("/") ? keycloakUrl.substring(0, keycloakUrl.length() - 1) : keycloakUrl;
        return String.format("%s/realms/%s/protocol/openid-connect/token", base, realm);
    }

    /**
     * Returns a valid access token, fetching a new one when the cached token is about to expire.
     */
    public synchronized String getAccessToken() throws IOException {
        if (accessToken != null && System.currentTimeMillis() < expiresAtMillis) {
            return accessToken;
        }
        return fetchToken();
    }

    private String fetchToken() throws IOException {
        RequestBody body = new FormBody.Builder()
                .add("grant_type", "client_credentials")
                .add("client_id", clientId)
                .add("client_secret", clientSecret)
                .build();

        Request request = new Request.Builder()
                .url(tokenUrl)
                .post(body)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.body() == null) {
                throw new IOException("Empty response body from token endpoint");
            }
            if (!response.isSuccessful()) {
                throw new IOException("Failed to fetch token: " + response.code() + " - " + response.body().string());
            }

            JsonNode root = MAPPER.readTree(response.body().byteStream());
            String token = root.path("access_token").asText("");
            if (token.isEmpty()) {
                throw new IOException("Token endpoint response carries no access_token");
            }
            int expiresIn = root.path("expires_in").asInt(60);

            this.accessToken = token;
            this.expiresAtMillis = System.currentTimeMillis() + expiresIn * 1000L - EXPIRY_MARGIN_MS;
            LOG.info(() -> "[Auth] Fetched metric store access token, expires in " + expiresIn + "s");
            return token;
        }
    }
}
