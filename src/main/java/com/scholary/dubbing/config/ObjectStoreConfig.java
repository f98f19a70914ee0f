package com.scholary.dubbing.config;

import com.scholary.dubbing.objectstore.ArtifactPublisher;
import com.scholary.dubbing.objectstore.ObjectStoreClient;
import com.scholary.dubbing.objectstore.ObjectStoreProperties;
import com.scholary.dubbing.objectstore.S3ObjectStoreClient;
import com.scholary.dubbing.utterance.UtteranceMetadataWriter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Only active with {@code objectstore.enabled=true}. Without it, jobs read local files and
 * cannot publish their results.
 */
@Configuration
@ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  public ArtifactPublisher artifactPublisher(
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties properties,
      UtteranceMetadataWriter utteranceMetadataWriter) {
    return new ArtifactPublisher(objectStoreClient, properties, utteranceMetadataWriter);
  }
}
