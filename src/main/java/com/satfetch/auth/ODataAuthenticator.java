package com.satfetch.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.satfetch.models.Credential;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Map;

@Slf4j
public class ODataAuthenticator extends AbstractAuthenticator {

    private final String tokenUrl;
    private final String clientId;
    private final String username;
    private final String password;
    private final TokenEndpointClient tokenClient;

    public ODataAuthenticator(String tokenUrl, String clientId, String username, String password) {
        this(tokenUrl, clientId, username, password, new TokenEndpointClient());
    }

    public ODataAuthenticator(String tokenUrl, String clientId, String username, String password,
                              TokenEndpointClient tokenClient) {
        if (isBlank(tokenUrl) || isBlank(clientId)) {
            throw new IllegalArgumentException("Token URL and client ID must be set");
        }
        if (isBlank(username) || isBlank(password)) {
            throw new IllegalArgumentException("Username and password must be set");
        }
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
        this.username = username;
        this.password = password;
        this.tokenClient = tokenClient;
    }

    @Override
    protected Credential exchange() throws IOException, AuthenticationException {
        JsonNode token = tokenClient.postForm(tokenUrl, Map.of(
                "grant_type", "password",
                "username", username,
                "password", password,
                "client_id", clientId), null);
        log.debug("Obtained access token from {}", tokenUrl);
        return Credential.bearer(TokenEndpointClient.requireText(token, "access_token"),
                TokenEndpointClient.optionalText(token, "refresh_token"));
    }

    @Override
    protected Credential refresh(Credential current) throws IOException, AuthenticationException {
        if (current.refreshToken() == null) {
            log.warn("No refresh token available, re-authenticating");
            return exchange();
        }
        try {
            JsonNode token = tokenClient.postForm(tokenUrl, Map.of(
                    "grant_type", "refresh_token",
                    "refresh_token", current.refreshToken(),
                    "client_id", clientId), null);
            String refreshToken = TokenEndpointClient.optionalText(token, "refresh_token");
            return Credential.bearer(TokenEndpointClient.requireText(token, "access_token"),
                    refreshToken != null ? refreshToken : current.refreshToken());
        } catch (AuthenticationException | IOException e) {
            log.warn("Token refresh failed ({}), re-authenticating", e.getMessage());
            return exchange();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
