package com.satfetch.downloaders;

import com.satfetch.auth.Authenticator;
import com.satfetch.auth.S3Authenticator;
import com.satfetch.config.DownloaderProperties;
import com.satfetch.events.EventSink;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

@Slf4j
public class S3Downloader extends AbstractDownloader<S3ObjectAddress> {

    static final String DEFAULT_REGION = "us-east-1";

    private volatile S3Client s3Client;
    private boolean ownsClient;

    public S3Downloader(Authenticator authenticator, DownloaderProperties properties, EventSink events) {
        super(authenticator, properties, events);
    }

    @Override
    public synchronized void init() {
        if (s3Client != null) {
            log.debug("S3 client already initialized");
            return;
        }
        String endpointUrl = properties.endpointUrl();
        if (authenticator instanceof S3Authenticator) {
            String authEndpoint = ((S3Authenticator) authenticator).endpointUrl();
            if (authEndpoint != null && !authEndpoint.isBlank()) {
                endpointUrl = authEndpoint;
            }
        }

        S3ClientBuilder builder = S3Client.builder()
                .credentialsProvider(credentialsProvider())
                .region(Region.of(properties.regionName() != null ? properties.regionName() : DEFAULT_REGION))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallAttemptTimeout(properties.timeout())
                        .retryPolicy(RetryPolicy.none())
                        .build());
        if (endpointUrl != null && !endpointUrl.isBlank()) {
            builder.endpointOverride(URI.create(endpointUrl)).forcePathStyle(true);
        }
        s3Client = builder.build();
        ownsClient = true;
        log.debug("Initialized S3 client with endpoint: {}", endpointUrl != null ? endpointUrl : "default");
    }

    public synchronized void init(S3Client client) {
        if (client == null) {
            throw new IllegalArgumentException("S3 client cannot be null");
        }
        s3Client = client;
        ownsClient = false;
    }

    private AwsCredentialsProvider credentialsProvider() {
        try {
            Object session = authenticator.authSession();
            if (session instanceof AwsCredentialsProvider) {
                return (AwsCredentialsProvider) session;
            }
        } catch (UnsupportedOperationException e) {
            log.debug("{} has no session, using default AWS credentials", authenticator.getClass().getSimpleName());
        }
        return DefaultCredentialsProvider.create();
    }

    @Override
    protected String description() {
        return "s3_download";
    }

    @Override
    protected boolean isInitialized() {
        return s3Client != null;
    }

    @Override
    protected S3ObjectAddress resolveAddress(String uri) {
        return S3ObjectAddress.parse(uri);
    }

    @Override
    protected long transfer(S3ObjectAddress address, Path destination, TaskReport report) throws IOException {
        try {
            HeadObjectResponse head = s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(address.bucket())
                    .key(address.key())
                    .build());
            report.reportSize(head.contentLength());

            GetObjectRequest request = GetObjectRequest.builder()
                    .bucket(address.bucket())
                    .key(address.key())
                    .build();
            try (ResponseInputStream<GetObjectResponse> body = s3Client.getObject(request)) {
                return streamToFile(body, destination, report);
            }
        } catch (NoSuchKeyException | NoSuchBucketException e) {
            throw new ObjectNotFoundException(address + " (" + errorCode(e) + ")", e);
        } catch (S3Exception e) {
            throw translate(address, e);
        } catch (ApiCallTimeoutException | ApiCallAttemptTimeoutException e) {
            throw new TransferException("timed out", e);
        } catch (SdkException e) {
            throw new TransferException("client error: " + e.getMessage(), e);
        }
    }

    private static TransferException translate(S3ObjectAddress address, S3Exception e) {
        int status = e.statusCode();
        String code = errorCode(e);
        if (status == 401 || status == 403 || "AccessDenied".equals(code) || "Forbidden".equals(code)
                || "ExpiredToken".equals(code) || "InvalidAccessKeyId".equals(code)) {
            return new AuthorizationFailedException("client error: " + code, e);
        }
        if (status == 404 || "NoSuchKey".equals(code) || "NoSuchBucket".equals(code)) {
            return new ObjectNotFoundException(address + " (" + code + ")", e);
        }
        return new TransferException("client error: " + code, e);
    }

    private static String errorCode(S3Exception e) {
        AwsErrorDetails details = e.awsErrorDetails();
        if (details != null && details.errorCode() != null) {
            return details.errorCode();
        }
        return String.valueOf(e.statusCode());
    }

    @Override
    public synchronized void close() {
        S3Client client = s3Client;
        s3Client = null;
        if (client != null && ownsClient) {
            client.close();
            log.debug("S3 client closed");
        }
    }
}
