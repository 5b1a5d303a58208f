package com.jobmatch.matcher.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * AWS clients resolve credentials lazily through the default provider chain, so building them
 * never requires credentials to be present at startup.
 */
@Slf4j
@Configuration
public class AwsClientConfig {

  @Value("${aws.region:eu-west-3}")
  private String awsRegion;

  @Bean(destroyMethod = "close")
  public S3Client s3Client() {
    log.info("Initializing S3 client for region: {}", awsRegion);
    return S3Client.builder()
        .region(Region.of(awsRegion))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }

  @Bean(destroyMethod = "close")
  public BedrockRuntimeClient bedrockRuntimeClient() {
    log.info("Initializing Bedrock runtime client for region: {}", awsRegion);
    return BedrockRuntimeClient.builder()
        .region(Region.of(awsRegion))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }
}
