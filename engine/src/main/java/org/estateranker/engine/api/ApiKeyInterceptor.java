package org.estateranker.engine.api;

import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.Objects;

/**
 * Interceptor that adds the API key as a query parameter.
 */
public class ApiKeyInterceptor implements Interceptor {

    static final String KEY_PARAMETER = "key";

    private final String apiKey;

    public ApiKeyInterceptor(String apiKey) {
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request original = chain.request();
        HttpUrl url = original.url().newBuilder()
                .setQueryParameter(KEY_PARAMETER, apiKey)
                .build();

        return chain.proceed(original.newBuilder().url(url).build());
    }
}
