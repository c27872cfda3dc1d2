package io.b2mash.governance.config;

import java.net.URI;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

/** S3 client used by the archive exporter. */
@Configuration
@EnableConfigurationProperties({
  S3Config.S3Properties.class,
  S3Config.AwsCredentialsProperties.class
})
public class S3Config {

  /**
   * @param endpoint override for S3-compatible stores; blank for AWS
   * @param bucketName default archive bucket
   * @param apiCallTimeout upper bound for a single S3 call, including one multipart part upload
   */
  @ConfigurationProperties("aws.s3")
  public record S3Properties(
      String endpoint,
      @DefaultValue("us-east-1") String region,
      String bucketName,
      @DefaultValue("5m") Duration apiCallTimeout) {

    boolean hasEndpointOverride() {
      return endpoint != null && !endpoint.isBlank();
    }
  }

  @ConfigurationProperties("aws.credentials")
  public record AwsCredentialsProperties(String accessKeyId, String secretAccessKey) {}

  @Bean(destroyMethod = "close")
  S3Client s3Client(S3Properties s3Props, AwsCredentialsProperties credProps) {
    var builder =
        S3Client.builder()
            .region(Region.of(s3Props.region()))
            .credentialsProvider(credentialsProvider(s3Props, credProps))
            .overrideConfiguration(
                ClientOverrideConfiguration.builder()
                    .apiCallTimeout(s3Props.apiCallTimeout())
                    .build());

    // MinIO and LocalStack need path-style access
    if (s3Props.hasEndpointOverride()) {
      builder
          .endpointOverride(URI.create(s3Props.endpoint()))
          .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
    }
    return builder.build();
  }

  private static AwsCredentialsProvider credentialsProvider(
      S3Properties s3Props, AwsCredentialsProperties credProps) {
    boolean staticKeys =
        credProps.accessKeyId() != null
            && !credProps.accessKeyId().isBlank()
            && credProps.secretAccessKey() != null;
    if (s3Props.hasEndpointOverride() && staticKeys) {
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(credProps.accessKeyId(), credProps.secretAccessKey()));
    }
    return DefaultCredentialsProvider.create();
  }
}
