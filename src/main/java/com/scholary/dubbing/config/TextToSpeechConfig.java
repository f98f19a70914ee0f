package com.scholary.dubbing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubbing.synthesis.GoogleTextToSpeechClient;
import com.scholary.dubbing.synthesis.SpeechSynthesizer;
import com.scholary.dubbing.synthesis.TextToSpeechProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the text-to-speech client. */
@Configuration
@EnableConfigurationProperties(TextToSpeechProperties.class)
public class TextToSpeechConfig {

  @Bean
  public SpeechSynthesizer speechSynthesizer(
      TextToSpeechProperties properties, ObjectMapper objectMapper) {
    return new GoogleTextToSpeechClient(properties, objectMapper);
  }
}
