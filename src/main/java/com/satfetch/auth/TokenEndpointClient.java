package com.satfetch.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

@Slf4j
public class TokenEndpointClient {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public TokenEndpointClient() {
        this(new OkHttpClient.Builder()
                .connectTimeout(DEFAULT_TIMEOUT)
                .readTimeout(DEFAULT_TIMEOUT)
                .callTimeout(DEFAULT_TIMEOUT)
                .build(), new ObjectMapper());
    }

    public TokenEndpointClient(OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public JsonNode postForm(String url, Map<String, String> form, String authorization)
            throws IOException, AuthenticationException {
        FormBody.Builder body = new FormBody.Builder();
        form.forEach(body::add);
        return execute(url, body.build(), authorization);
    }

    public JsonNode postEmpty(String url, String authorization) throws IOException, AuthenticationException {
        return execute(url, RequestBody.create(new byte[0]), authorization);
    }

    private JsonNode execute(String url, RequestBody body, String authorization)
            throws IOException, AuthenticationException {
        Request.Builder request = new Request.Builder().url(url).post(body);
        if (authorization != null) {
            request.header("Authorization", authorization);
        }
        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new AuthenticationException("Token endpoint " + url + " answered HTTP " + response.code());
            }
            ResponseBody responseBody = response.body();
            if (responseBody == null) {
                throw new AuthenticationException("Token endpoint " + url + " returned no body");
            }
            return objectMapper.readTree(responseBody.byteStream());
        }
    }

    public static String requireText(JsonNode node, String field) throws AuthenticationException {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new AuthenticationException("No " + field + " received from token endpoint");
        }
        return value.asText();
    }

    public static String optionalText(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
