package org.agentranker.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.agentranker.engine.api.dto.AgentDto;
import org.agentranker.engine.api.dto.AssignmentDto;
import org.agentranker.engine.api.dto.ConfigItemDto;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.GET;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retrofit-based implementation of MetricStoreClient.
 */
public final class MetricStoreClientImpl implements MetricStoreClient {

    private static final Logger LOG = Logger.getLogger(MetricStoreClientImpl.class.getName());

    private final MetricStoreApi api;

    public MetricStoreClientImpl(String baseUrl) {
        this(baseUrl, null);
    }

    /**
     * @param baseUrl metric store root URL
     * @param tokenManager source of bearer tokens, or null when the store is unauthenticated
     */
    public MetricStoreClientImpl(String baseUrl, TokenManager tokenManager) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS);
        if (tokenManager != null) {
            clientBuilder.addInterceptor(new AuthInterceptor(tokenManager));
        }

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(new ObjectMapper()))
                .client(clientBuilder.build())
                .build();

        this.api = retrofit.create(MetricStoreApi.class);
    }

    @Override
    public List<AgentDto> fetchAgents() {
        return execute(api.getAgents(), "GET /v1/agents");
    }

    @Override
    public List<AssignmentDto> fetchAssignments() {
        return execute(api.getAssignments(), "GET /v1/assignments");
    }

    @Override
    public List<ConfigItemDto> fetchScoringConfig() {
        return execute(api.getScoringConfig(), "GET /v1/ranking/config");
    }

    /**
     * Execute a Retrofit call and return the result.
     */
    private <T> T execute(Call<T> call, String description) {
        try {
            Response<T> response = call.execute();
            if (response.isSuccessful()) {
                return response.body();
            }
            LOG.warning(() -> String.format("[API] %s failed: %d %s",
                    description, response.code(), response.message()));
            return null;
        } catch (Exception e) {
            LOG.log(Level.WARNING, "[API] " + description + " error", e);
            return null;
        }
    }

    /**
     * Retrofit service interface for the metric store API.
     */
    interface MetricStoreApi {
        @GET("v1/agents")
        Call<List<AgentDto>> getAgents();

        @GET("v1/assignments")
        Call<List<AssignmentDto>> getAssignments();

        @GET("v1/ranking/config")
        Call<List<ConfigItemDto>> getScoringConfig();
    }
}
