package com.satfetch.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.satfetch.models.Credential;
import okhttp3.Credentials;

import java.io.IOException;
import java.util.function.Function;

public class EarthdataAuthenticator extends AbstractAuthenticator {

    public static final String DEFAULT_TOKEN_URL = "https://urs.earthdata.nasa.gov/api/users/find_or_create_token";
    public static final String USERNAME_ENV = "EARTHDATA_USERNAME";
    public static final String PASSWORD_ENV = "EARTHDATA_PASSWORD";

    public enum Strategy {
        ENVIRONMENT,
        EXPLICIT
    }

    private final String tokenUrl;
    private final String username;
    private final String password;
    private final TokenEndpointClient tokenClient;

    public EarthdataAuthenticator(Strategy strategy, String username, String password) {
        this(strategy, username, password, DEFAULT_TOKEN_URL, new TokenEndpointClient(), System::getenv);
    }

    EarthdataAuthenticator(Strategy strategy, String username, String password, String tokenUrl,
                           TokenEndpointClient tokenClient, Function<String, String> environment) {
        if (strategy == Strategy.ENVIRONMENT) {
            username = environment.apply(USERNAME_ENV);
            password = environment.apply(PASSWORD_ENV);
            if (username == null || username.isBlank() || password == null || password.isBlank()) {
                throw new IllegalArgumentException(USERNAME_ENV + " and " + PASSWORD_ENV
                        + " environment variables must be set when using the environment strategy");
            }
        } else if (username == null || username.isBlank() || password == null || password.isBlank()) {
            throw new IllegalArgumentException("Username and password must be set");
        }
        this.tokenUrl = tokenUrl == null || tokenUrl.isBlank() ? DEFAULT_TOKEN_URL : tokenUrl;
        this.username = username;
        this.password = password;
        this.tokenClient = tokenClient;
    }

    @Override
    protected Credential exchange() throws IOException, AuthenticationException {
        JsonNode token = tokenClient.postEmpty(tokenUrl, Credentials.basic(username, password));
        return Credential.bearer(TokenEndpointClient.requireText(token, "access_token"), null);
    }
}
