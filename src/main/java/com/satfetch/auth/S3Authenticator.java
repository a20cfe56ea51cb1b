package com.satfetch.auth;

import com.satfetch.models.Credential;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;

import java.util.Map;

/**
 * Credentials for S3 compatible object stores (AWS, Copernicus eodata, MinIO).
 * <p>
 * Uses the configured access/secret key pair when present, otherwise resolves the AWS default
 * provider chain. This authenticator is session based: {@link #authHeaders()} is always empty and
 * {@link #authSession()} returns an {@link AwsCredentialsProvider} that reads the credential held at
 * call time, so an S3 client built once keeps working across refreshes.
 */
@Slf4j
public class S3Authenticator extends AbstractAuthenticator {

    private final String accessKeyId;
    private final String secretAccessKey;
    private final String sessionToken;
    private final String endpointUrl;
    private final AwsCredentialsProvider fallbackProvider;
    private final AwsCredentialsProvider sessionProvider = this::resolveCurrent;

    public S3Authenticator(String accessKeyId, String secretAccessKey, String sessionToken, String endpointUrl) {
        this(accessKeyId, secretAccessKey, sessionToken, endpointUrl, null);
    }

    S3Authenticator(String accessKeyId, String secretAccessKey, String sessionToken, String endpointUrl,
                    AwsCredentialsProvider fallbackProvider) {
        boolean hasKey = accessKeyId != null && !accessKeyId.isBlank();
        boolean hasSecret = secretAccessKey != null && !secretAccessKey.isBlank();
        if (hasKey != hasSecret) {
            throw new IllegalArgumentException("Access key and secret key must be set together");
        }
        this.accessKeyId = accessKeyId;
        this.secretAccessKey = secretAccessKey;
        this.sessionToken = sessionToken;
        this.endpointUrl = endpointUrl;
        this.fallbackProvider = fallbackProvider;
    }

    @Override
    protected Credential exchange() throws AuthenticationException {
        AwsCredentials credentials;
        if (accessKeyId != null && !accessKeyId.isBlank()) {
            credentials = sessionToken == null || sessionToken.isBlank()
                    ? AwsBasicCredentials.create(accessKeyId, secretAccessKey)
                    : AwsSessionCredentials.create(accessKeyId, secretAccessKey, sessionToken);
        } else {
            try {
                AwsCredentialsProvider provider = fallbackProvider != null
                        ? fallbackProvider : DefaultCredentialsProvider.create();
                credentials = provider.resolveCredentials();
            } catch (SdkException e) {
                throw new AuthenticationException("No AWS credentials available: " + e.getMessage(), e);
            }
        }
        log.debug("Resolved S3 credentials for key {}", credentials.accessKeyId());
        return Credential.session(credentials);
    }

    @Override
    public Map<String, String> authHeaders() {
        return Map.of();
    }

    @Override
    public AwsCredentialsProvider authSession() {
        return sessionProvider;
    }

    public String endpointUrl() {
        return endpointUrl;
    }

    private AwsCredentials resolveCurrent() {
        Credential current = currentCredential();
        if (current == null && ensureAuthenticated()) {
            current = currentCredential();
        }
        if (current == null) {
            throw SdkClientException.create("S3 credentials are not available");
        }
        return (AwsCredentials) current.session();
    }
}
