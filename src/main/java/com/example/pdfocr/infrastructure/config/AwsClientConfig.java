package com.example.pdfocr.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.TextractClientBuilder;

/**
 * AWS SDK clients for the object store and the OCR service.
 * Credentials come from the default provider chain (environment, profile, instance role).
 */
@Configuration
public class AwsClientConfig {

    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        return DefaultCredentialsProvider.create();
    }

    @Bean
    public S3Client s3Client(PipelineProperties properties, AwsCredentialsProvider credentialsProvider) {
        PipelineProperties.Storage storage = properties.storage();
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(storage.region()))
                .credentialsProvider(credentialsProvider);
        if (storage.endpoint() != null) {
            // emulators expose a single host, so the bucket has to travel in the path
            builder.endpointOverride(storage.endpoint())
                    .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
        }
        return builder.build();
    }

    @Bean
    public TextractClient textractClient(PipelineProperties properties, AwsCredentialsProvider credentialsProvider) {
        PipelineProperties.Storage storage = properties.storage();
        TextractClientBuilder builder = TextractClient.builder()
                .region(Region.of(storage.region()))
                .credentialsProvider(credentialsProvider);
        if (storage.endpoint() != null) {
            builder.endpointOverride(storage.endpoint());
        }
        return builder.build();
    }
}
