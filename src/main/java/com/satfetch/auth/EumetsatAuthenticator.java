package com.satfetch.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.satfetch.models.Credential;
import okhttp3.Credentials;

import java.io.IOException;
import java.util.Map;

public class EumetsatAuthenticator extends AbstractAuthenticator {

    public static final String DEFAULT_TOKEN_URL = "https://api.eumetsat.int/token";

    private final String tokenUrl;
    private final String consumerKey;
    private final String consumerSecret;
    private final TokenEndpointClient tokenClient;

    public EumetsatAuthenticator(String consumerKey, String consumerSecret) {
        this(DEFAULT_TOKEN_URL, consumerKey, consumerSecret, new TokenEndpointClient());
    }

    public EumetsatAuthenticator(String tokenUrl, String consumerKey, String consumerSecret,
                                 TokenEndpointClient tokenClient) {
        if (consumerKey == null || consumerKey.isBlank() || consumerSecret == null || consumerSecret.isBlank()) {
            throw new IllegalArgumentException("Consumer key and secret must be set");
        }
        this.tokenUrl = tokenUrl == null || tokenUrl.isBlank() ? DEFAULT_TOKEN_URL : tokenUrl;
        this.consumerKey = consumerKey;
        this.consumerSecret = consumerSecret;
        this.tokenClient = tokenClient;
    }

    @Override
    protected Credential exchange() throws IOException, AuthenticationException {
        JsonNode token = tokenClient.postForm(tokenUrl, Map.of("grant_type", "client_credentials"),
                Credentials.basic(consumerKey, consumerSecret));
        return Credential.bearer(TokenEndpointClient.requireText(token, "access_token"), null);
    }

    @Override
    public Object authSession() {
        Credential current = currentCredential();
        return current == null ? null : current.session();
    }
}
