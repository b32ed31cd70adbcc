package io.b2mash.b2b.artifactstore;

import io.b2mash.b2b.artifactstore.config.ArtifactStoreProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(ArtifactStoreProperties.class)
public class ArtifactStoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(ArtifactStoreApplication.class, args);
  }
}
