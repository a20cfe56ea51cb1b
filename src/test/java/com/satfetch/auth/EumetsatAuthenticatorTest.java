package com.satfetch.auth;

import okhttp3.Credentials;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class EumetsatAuthenticatorTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void clientCredentialsGrantWithBasicAuth() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"access_token\":\"eum-token\",\"expires_in\":3600}"));
        EumetsatAuthenticator authenticator = new EumetsatAuthenticator(server.url("/token").toString(),
                "key", "secret", new TokenEndpointClient());

        assertTrue(authenticator.ensureAuthenticated());

        RecordedRequest request = server.takeRequest();
        assertEquals(Credentials.basic("key", "secret"), request.getHeader("Authorization"));
        assertTrue(request.getBody().readUtf8().contains("grant_type=client_credentials"));
        assertEquals("Bearer eum-token", authenticator.authHeaders().get("Authorization"));
        assertEquals("eum-token", authenticator.authSession());
    }

    @Test
    void sessionIsAbsentBeforeAuthentication() {
        EumetsatAuthenticator authenticator = new EumetsatAuthenticator(server.url("/token").toString(),
                "key", "secret", new TokenEndpointClient());

        assertNull(authenticator.authSession());
    }

    @Test
    void requiresConsumerKeyAndSecret() {
        assertThrows(IllegalArgumentException.class, () -> new EumetsatAuthenticator("key", ""));
    }
}
