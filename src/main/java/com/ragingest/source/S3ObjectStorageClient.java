package com.ragingest.source;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.S3Object;

public class S3ObjectStorageClient implements ObjectStorageClient {
    private final String region;
    private final String endpointOverride;
    private S3Client s3;

    public S3ObjectStorageClient(String region, String endpointOverride) {
        this.region = region == null || region.isBlank() ? "us-east-1" : region;
        this.endpointOverride = endpointOverride == null ? "" : endpointOverride;
    }

    @Override
    public List<StorageObject> list(String bucket, String prefix) throws IOException {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .build();
        List<StorageObject> objects = new ArrayList<>();
        try {
            for (S3Object object : client().listObjectsV2Paginator(request).contents()) {
                objects.add(new StorageObject(
                        object.key(),
                        object.size() == null ? 0L : object.size(),
                        object.lastModified()));
            }
        } catch (SdkException e) {
            throw new IOException("Listing s3://" + bucket + "/" + prefix + " failed: " + e.getMessage(), e);
        }
        return objects;
    }

    @Override
    public byte[] read(String bucket, String key) throws IOException {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            ResponseBytes<GetObjectResponse> bytes = client().getObjectAsBytes(request);
            return bytes.asByteArray();
        } catch (SdkException e) {
            throw new IOException("Reading s3://" + bucket + "/" + key + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (s3 != null) {
            s3.close();
            s3 = null;
        }
    }

    private synchronized S3Client client() {
        if (s3 == null) {
            S3ClientBuilder builder = S3Client.builder().region(Region.of(region));
            if (!endpointOverride.isBlank()) {
                builder.endpointOverride(URI.create(endpointOverride)).forcePathStyle(true);
            }
            s3 = builder.build();
        }
        return s3;
    }
}
