package com.scholary.dubbing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubbing.diarization.SpeakerDiarizer;
import com.scholary.dubbing.media.MediaProcessor;
import com.scholary.dubbing.media.SourceSeparator;
import com.scholary.dubbing.pipeline.DubbingCollaborators;
import com.scholary.dubbing.pipeline.WorkingDirectoryCleaner;
import com.scholary.dubbing.segmentation.SpeechSegmenter;
import com.scholary.dubbing.synthesis.SpeechSynthesizer;
import com.scholary.dubbing.transcription.Transcriber;
import com.scholary.dubbing.translation.Translator;
import com.scholary.dubbing.utterance.UtteranceMetadataWriter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the dubbing pipeline.
 *
 * <p>Collects the collaborator beans into the bundle every run is created with.
 */
@Configuration
@EnableConfigurationProperties(DubbingProperties.class)
public class PipelineConfig {

  @Bean
  public UtteranceMetadataWriter utteranceMetadataWriter(ObjectMapper objectMapper) {
    return new UtteranceMetadataWriter(objectMapper);
  }

  @Bean
  public WorkingDirectoryCleaner workingDirectoryCleaner() {
    return new WorkingDirectoryCleaner();
  }

  @Bean
  public DubbingCollaborators dubbingCollaborators(
      MediaProcessor mediaProcessor,
      SourceSeparator sourceSeparator,
      SpeechSegmenter speechSegmenter,
      Transcriber transcriber,
      SpeakerDiarizer speakerDiarizer,
      Translator translator,
      SpeechSynthesizer speechSynthesizer,
      UtteranceMetadataWriter utteranceMetadataWriter,
      WorkingDirectoryCleaner workingDirectoryCleaner) {
    return new DubbingCollaborators(
        mediaProcessor,
        sourceSeparator,
        speechSegmenter,
        transcriber,
        speakerDiarizer,
        translator,
        speechSynthesizer,
        utteranceMetadataWriter,
        workingDirectoryCleaner);
  }
}
