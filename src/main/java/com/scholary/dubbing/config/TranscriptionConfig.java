package com.scholary.dubbing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubbing.segmentation.SegmentationClient;
import com.scholary.dubbing.segmentation.SegmentationProperties;
import com.scholary.dubbing.segmentation.SpeechSegmenter;
import com.scholary.dubbing.transcription.Transcriber;
import com.scholary.dubbing.transcription.WhisperClient;
import com.scholary.dubbing.transcription.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the speech segmentation and transcription clients. */
@Configuration
@EnableConfigurationProperties({WhisperProperties.class, SegmentationProperties.class})
public class TranscriptionConfig {

  @Bean
  public Transcriber transcriber(WhisperProperties properties, ObjectMapper objectMapper) {
    return new WhisperClient(properties, objectMapper);
  }

  @Bean
  public SpeechSegmenter speechSegmenter(
      SegmentationProperties properties, ObjectMapper objectMapper) {
    return new SegmentationClient(properties, objectMapper);
  }
}
