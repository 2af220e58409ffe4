package com.starscape.contacts.integration;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Points the application's S3 usage at LocalStack. Registered under its own bean name
 * because bean definition overriding is disabled.
 */
@TestConfiguration
public class TestAwsConfig {
    
    @Bean
    @Primary
    public S3Client localstackS3Client() {
        // Return the client created in BaseIntegrationTest
        return BaseIntegrationTest.s3Client;
    }
}
