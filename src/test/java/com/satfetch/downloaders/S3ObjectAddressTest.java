package com.satfetch.downloaders;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class S3ObjectAddressTest {

    @Test
    void splitsBucketAndKey() {
        S3ObjectAddress address = S3ObjectAddress.parse("s3://eodata/Sentinel-1/SAR/IW_GRDH_1S/product.SAFE/manifest.safe");

        assertEquals("eodata", address.bucket());
        assertEquals("Sentinel-1/SAR/IW_GRDH_1S/product.SAFE/manifest.safe", address.key());
        assertEquals("s3://eodata/Sentinel-1/SAR/IW_GRDH_1S/product.SAFE/manifest.safe", address.toString());
    }

    @Test
    void rejectsOtherSchemes() {
        InvalidAddressException e = assertThrows(InvalidAddressException.class,
                () -> S3ObjectAddress.parse("http://bucket-without-key"));
        assertTrue(e.getMessage().startsWith("Invalid S3 URI format"));
    }

    @Test
    void rejectsMissingBucketOrKey() {
        assertThrows(InvalidAddressException.class, () -> S3ObjectAddress.parse("s3://bucket"));
        assertThrows(InvalidAddressException.class, () -> S3ObjectAddress.parse("s3://bucket/"));
        assertThrows(InvalidAddressException.class, () -> S3ObjectAddress.parse("s3:///key"));
        assertThrows(InvalidAddressException.class, () -> S3ObjectAddress.parse(null));
    }
}
