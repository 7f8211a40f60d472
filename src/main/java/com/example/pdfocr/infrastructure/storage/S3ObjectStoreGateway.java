package com.example.pdfocr.infrastructure.storage;

import com.example.pdfocr.domain.exception.DocumentNotFoundException;
import com.example.pdfocr.domain.model.StoredObject;
import com.example.pdfocr.domain.port.ObjectStoreGateway;
import com.example.pdfocr.infrastructure.config.PipelineProperties;
import com.example.pdfocr.infrastructure.exception.ObjectStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ObjectStoreGateway} backed by Amazon S3.
 */
@Component
public class S3ObjectStoreGateway implements ObjectStoreGateway {

    private static final Logger log = LoggerFactory.getLogger(S3ObjectStoreGateway.class);

    private final S3Client s3Client;
    private final String bucket;

    public S3ObjectStoreGateway(S3Client s3Client, PipelineProperties properties) {
        this.s3Client = s3Client;
        this.bucket = properties.storage().bucket();
    }

    @Override
    public String bucket() {
        return bucket;
    }

    @Override
    public void upload(String key, byte[] content, String contentType) {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(contentType)
                            .build(),
                    RequestBody.fromBytes(content));
            log.info("Uploaded {} bytes to s3://{}/{}", content.length, bucket, key);
        } catch (SdkException ex) {
            throw wrap("upload", key, ex);
        }
    }

    @Override
    public byte[] download(String key) {
        try {
            byte[] content = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build()).asByteArray();
            log.debug("Downloaded {} bytes from s3://{}/{}", content.length, bucket, key);
            return content;
        } catch (NoSuchKeyException ex) {
            throw new DocumentNotFoundException(key);
        } catch (SdkException ex) {
            throw wrap("download", key, ex);
        }
    }

    @Override
    public Optional<StoredObject> describe(String key) {
        try {
            HeadObjectResponse head = s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            long size = head.contentLength() != null ? head.contentLength() : 0L;
            return Optional.of(new StoredObject(key, size, head.contentType(), head.lastModified()));
        } catch (NoSuchKeyException ex) {
            return Optional.empty();
        } catch (AwsServiceException ex) {
            // HEAD responses have no body, so a missing key can surface as a bare 404
            if (ex.statusCode() == 404) {
                return Optional.empty();
            }
            throw wrap("describe", key, ex);
        } catch (SdkException ex) {
            throw wrap("describe", key, ex);
        }
    }

    @Override
    public List<StoredObject> list(String prefix) {
        List<StoredObject> objects = new ArrayList<>();
        String continuationToken = null;
        try {
            do {
                ListObjectsV2Response response = s3Client.listObjectsV2(ListObjectsV2Request.builder()
                        .bucket(bucket)
                        .prefix(prefix)
                        .continuationToken(continuationToken)
                        .build());
                for (S3Object object : response.contents()) {
                    long size = object.size() != null ? object.size() : 0L;
                    objects.add(new StoredObject(object.key(), size, null, object.lastModified()));
                }
                continuationToken = Boolean.TRUE.equals(response.isTruncated())
                        ? response.nextContinuationToken()
                        : null;
            } while (continuationToken != null);
        } catch (SdkException ex) {
            throw wrap("list", prefix, ex);
        }
        return objects;
    }

    @Override
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            log.info("Deleted s3://{}/{}", bucket, key);
        } catch (SdkException ex) {
            throw wrap("delete", key, ex);
        }
    }

    private ObjectStoreException wrap(String operation, String key, SdkException ex) {
        String errorCode = null;
        if (ex instanceof AwsServiceException serviceException && serviceException.awsErrorDetails() != null) {
            errorCode = serviceException.awsErrorDetails().errorCode();
        }
        return new ObjectStoreException("Failed to " + operation + " s3://" + bucket + "/" + key + ": "
                + ex.getMessage(), errorCode, ex);
    }
}
