package com.scholary.dubbing.config;

import com.scholary.dubbing.media.CommandRunner;
import com.scholary.dubbing.media.DemucsProperties;
import com.scholary.dubbing.media.DemucsSourceSeparator;
import com.scholary.dubbing.media.FfmpegMediaProcessor;
import com.scholary.dubbing.media.FfmpegProperties;
import com.scholary.dubbing.media.MediaProcessor;
import com.scholary.dubbing.media.ProcessCommandRunner;
import com.scholary.dubbing.media.SourceSeparator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the command-line media tools.
 *
 * <p>ffmpeg and Demucs must be installed on the host; they are only invoked when a job runs.
 */
@Configuration
@EnableConfigurationProperties({FfmpegProperties.class, DemucsProperties.class})
public class MediaConfig {

  @Bean
  public CommandRunner commandRunner() {
    return new ProcessCommandRunner();
  }

  @Bean
  public MediaProcessor mediaProcessor(FfmpegProperties properties, CommandRunner commandRunner) {
    return new FfmpegMediaProcessor(properties, commandRunner);
  }

  @Bean
  public SourceSeparator sourceSeparator(
      DemucsProperties properties, CommandRunner commandRunner) {
    return new DemucsSourceSeparator(properties, commandRunner);
  }
}
