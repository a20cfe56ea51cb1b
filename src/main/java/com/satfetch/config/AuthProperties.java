package com.satfetch.config;

import com.satfetch.auth.EarthdataAuthenticator;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "satfetch.auth")
public record AuthProperties(
        Type type,
        String tokenUrl,
        String clientId,
        String username,
        String password,
        String consumerKey,
        String consumerSecret,
        String accessKey,
        String secretKey,
        String sessionToken,
        String endpointUrl,
        EarthdataAuthenticator.Strategy strategy
) {
    public enum Type {
        ODATA,
        EUMETSAT,
        EARTHDATA,
        S3
    }

    public AuthProperties {
        if (type == null) type = Type.S3;
        if (strategy == null) strategy = EarthdataAuthenticator.Strategy.ENVIRONMENT;
    }
}
