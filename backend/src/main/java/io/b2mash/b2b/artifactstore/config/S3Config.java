package io.b2mash.b2b.artifactstore.config;

import java.net.URI;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

/**
 * S3 client wiring for the object store gateway. An endpoint override (MinIO, LocalStack) switches
 * to path-style access with static credentials; otherwise the default AWS credential chain applies.
 */
@Configuration
@ConditionalOnProperty(name = "storage.provider", havingValue = "s3", matchIfMissing = true)
@EnableConfigurationProperties({
  S3Config.S3Properties.class,
  S3Config.AwsCredentialsProperties.class
})
public class S3Config {

  @ConfigurationProperties("aws.s3")
  public record S3Properties(String endpoint, String region, String bucketName) {}

  @ConfigurationProperties("aws.credentials")
  public record AwsCredentialsProperties(String accessKeyId, String secretAccessKey) {}

  @Bean(destroyMethod = "close")
  S3Client s3Client(S3Properties s3Props, AwsCredentialsProperties credProps) {
    var builder = S3Client.builder().region(Region.of(s3Props.region()));

    if (hasEndpointOverride(s3Props)) {
      builder
          .endpointOverride(URI.create(s3Props.endpoint()))
          .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
    }
    builder.credentialsProvider(credentialsProvider(s3Props, credProps));

    return builder.build();
  }

  private static AwsCredentialsProvider credentialsProvider(
      S3Properties s3Props, AwsCredentialsProperties credProps) {
    if (hasEndpointOverride(s3Props)
        && credProps.accessKeyId() != null
        && !credProps.accessKeyId().isBlank()) {
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(credProps.accessKeyId(), credProps.secretAccessKey()));
    }
    return DefaultCredentialsProvider.create();
  }

  private static boolean hasEndpointOverride(S3Properties s3Props) {
    return s3Props.endpoint() != null && !s3Props.endpoint().isBlank();
  }
}
