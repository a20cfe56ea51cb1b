package com.satfetch.downloaders;

public record S3ObjectAddress(
        String bucket,
        String key
) {
    public static final String SCHEME = "s3://";

    public static S3ObjectAddress parse(String uri) {
        if (uri == null || !uri.startsWith(SCHEME)) {
            throw new InvalidAddressException("Invalid S3 URI format: " + uri);
        }
        String path = uri.substring(SCHEME.length());
        int slash = path.indexOf('/');
        if (slash <= 0 || slash == path.length() - 1) {
            throw new InvalidAddressException("Invalid S3 URI format: " + uri);
        }
        return new S3ObjectAddress(path.substring(0, slash), path.substring(slash + 1));
    }

    @Override
    public String toString() {
        return SCHEME + bucket + "/" + key;
    }
}
