package com.scholary.dubbing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubbing.diarization.SpeakerDiarizer;
import com.scholary.dubbing.gemini.GeminiClient;
import com.scholary.dubbing.gemini.GeminiProperties;
import com.scholary.dubbing.gemini.GenerativeModel;
import com.scholary.dubbing.remote.RemoteAssetPoller;
import com.scholary.dubbing.translation.GeminiTranslator;
import com.scholary.dubbing.translation.Translator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for everything backed by the Gemini API: speaker diarization and translation.
 *
 * <p>The API key is resolved on the first request, so the application starts without one.
 */
@Configuration
@EnableConfigurationProperties(GeminiProperties.class)
public class GeminiConfig {

  @Bean
  public GenerativeModel generativeModel(GeminiProperties properties, ObjectMapper objectMapper) {
    return new GeminiClient(properties, objectMapper);
  }

  @Bean
  public RemoteAssetPoller remoteAssetPoller(DubbingProperties properties) {
    return new RemoteAssetPoller(
        properties.polling().maxWait(), properties.polling().pollInterval());
  }

  @Bean
  public SpeakerDiarizer speakerDiarizer(GenerativeModel model, RemoteAssetPoller poller) {
    return new SpeakerDiarizer(model, poller);
  }

  @Bean
  public Translator translator(GenerativeModel model) {
    return new GeminiTranslator(model);
  }
}
