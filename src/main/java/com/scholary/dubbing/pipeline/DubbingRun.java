package com.scholary.dubbing.pipeline;

import com.scholary.dubbing.logging.StructuredLogger;
import com.scholary.dubbing.media.AudioVideoSplit;
import com.scholary.dubbing.media.MediaFormat;
import com.scholary.dubbing.media.MediaProcessor;
import com.scholary.dubbing.media.SeparatedAudio;
import com.scholary.dubbing.segmentation.TimeRange;
import com.scholary.dubbing.synthesis.SpeechSynthesizer;
import com.scholary.dubbing.synthesis.VoiceAssigner;
import com.scholary.dubbing.translation.TranslationRequest;
import com.scholary.dubbing.translation.TranslationScript;
import com.scholary.dubbing.utterance.SpeakerInfo;
import com.scholary.dubbing.utterance.UtteranceMetadata;
import com.scholary.dubbing.utterance.UtteranceMetadataWriter;
import com.scholary.dubbing.utterance.UtteranceRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One dubbing run: the stages of {@link PipelineStage} applied to a single input file.
 *
 * <p>Every stage output is computed lazily, at most once. Asking for a stage realizes its
 * unrealized predecessors first, in order, and later requests return the cached value. A failed
 * stage is never cached: the run is marked failed and every later request rethrows the same
 * {@link StageFailedException}, so nothing is recomputed and no stage is retried.
 *
 * <p>Not thread-safe. Independent runs can execute in parallel as long as each has its own
 * working directory.
 */
public class DubbingRun {

  private static final Logger LOGGER = LoggerFactory.getLogger(DubbingRun.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final String DUBBED_UTTERANCE_FILE = "dubbed_utterance_%d.mp3";

  private final DubbingRunConfig config;
  private final DubbingCollaborators collaborators;
  private final MediaFormat format;
  private final StageResultCache cache = new StageResultCache();
  private final ProgressTracker progress;

  private StageFailedException failure;

  /**
   * Create a run. Nothing is executed until a stage output is requested.
   *
   * @throws com.scholary.dubbing.media.UnsupportedFormatException if the input is not a supported
   *     video or audio file
   */
  public DubbingRun(
      DubbingRunConfig config, DubbingCollaborators collaborators, ProgressListener listener) {
    this.format = MediaFormat.detect(config.inputFile());
    this.config = config;
    this.collaborators = collaborators;
    this.progress = new ProgressTracker(PipelineStage.totalSteps(config.cleanUp()), listener);
  }

  /**
   * Execute every stage in order.
   *
   * @return the final artifact and everything worth reporting about the run
   * @throws StageFailedException naming the first stage that failed
   */
  public DubbingResult run() {
    LOGGER.info(
        "Dubbing process starting: input={}, format={}, targetLanguage={}",
        config.inputFile().getFileName(),
        format,
        config.targetLanguage());
    long startTime = System.currentTimeMillis();

    for (PipelineStage stage : PipelineStage.values()) {
      getStageOutput(stage);
    }

    MetadataCheckpoint checkpoint = metadataCheckpoint();
    CleanupReport cleanup = cleanupReport();
    Path outputFile = postprocessingOutput();
    List<PersistenceWarning> warnings = new ArrayList<>();
    checkpoint.persistenceWarning().ifPresent(warnings::add);
    Path metadataFile =
        checkpoint.isSaved()
                && checkpoint.metadataFile() != null
                && Files.exists(checkpoint.metadataFile())
            ? checkpoint.metadataFile()
            : null;

    LOGGER.info(
        "Dubbing process finished in {} ms. Output file saved under: {}",
        System.currentTimeMillis() - startTime,
        outputFile);
    return new DubbingResult(
        outputFile,
        metadataFile,
        warnings,
        cleanup.failures(),
        checkpoint.source().utterances());
  }

  /**
   * Output of a stage, computing it and any unrealized predecessors if necessary.
   *
   * @throws StageFailedException if this stage or a predecessor failed, now or earlier
   */
  public Object getStageOutput(PipelineStage stage) {
    if (failure != null) {
      throw failure;
    }
    if (cache.contains(stage)) {
      return cache.get(stage);
    }

    PipelineStage predecessor = stage.predecessor();
    Object input = predecessor == null ? null : getStageOutput(predecessor);

    structuredLogger.logStageStarted(
        stage.name(), progress.completedSteps(), progress.totalSteps());
    long startTime = System.currentTimeMillis();

    Object output;
    try {
      output = execute(stage, input);
    } catch (RuntimeException e) {
      structuredLogger.logStageFailed(
          stage.name(),
          e.getClass().getSimpleName(),
          e.getMessage(),
          System.currentTimeMillis() - startTime);
      failure = new StageFailedException(stage, e);
      throw failure;
    }

    cache.put(stage, output);
    if (stage.countsProgress() && (stage != PipelineStage.CLEANUP || config.cleanUp())) {
      progress.advance(stage);
    }
    structuredLogger.logStageFinished(
        stage.name(),
        progress.completedSteps(),
        progress.totalSteps(),
        utteranceCount(output),
        System.currentTimeMillis() - startTime);
    return output;
  }

  public StageArtifacts preprocessingOutput() {
    return (StageArtifacts) getStageOutput(PipelineStage.PREPROCESSING);
  }

  public StageArtifacts speechToTextOutput() {
    return (StageArtifacts) getStageOutput(PipelineStage.SPEECH_TO_TEXT);
  }

  public StageArtifacts translationOutput() {
    return (StageArtifacts) getStageOutput(PipelineStage.TRANSLATION);
  }

  public StageArtifacts textToSpeechOutput() {
    return (StageArtifacts) getStageOutput(PipelineStage.TEXT_TO_SPEECH);
  }

  public MetadataCheckpoint metadataCheckpoint() {
    return (MetadataCheckpoint) getStageOutput(PipelineStage.SAVE_METADATA);
  }

  public Path postprocessingOutput() {
    return (Path) getStageOutput(PipelineStage.POSTPROCESSING);
  }

  public CleanupReport cleanupReport() {
    return (CleanupReport) getStageOutput(PipelineStage.CLEANUP);
  }

  public int completedSteps() {
    return progress.completedSteps();
  }

  public int totalSteps() {
    return progress.totalSteps();
  }

  public boolean isFailed() {
    return failure != null;
  }

  public DubbingRunConfig config() {
    return config;
  }

  private Object execute(PipelineStage stage, Object input) {
    switch (stage) {
      case PREPROCESSING:
        return preprocess();
      case SPEECH_TO_TEXT:
        return speechToText((StageArtifacts) input);
      case TRANSLATION:
        return translate((StageArtifacts) input);
      case TEXT_TO_SPEECH:
        return textToSpeech((StageArtifacts) input);
      case SAVE_METADATA:
        return saveMetadata((StageArtifacts) input);
      case POSTPROCESSING:
        return postprocess((MetadataCheckpoint) input);
      case CLEANUP:
        return cleanUp((Path) input);
      default:
        throw new IllegalStateException("Unknown stage: " + stage);
    }
  }

  /** Split tracks, separate vocals, find utterances and cut one chunk per utterance. */
  private StageArtifacts preprocess() {
    MediaProcessor media = collaborators.mediaProcessor();
    Path outputDirectory = config.outputDirectory();

    Path video = null;
    Path audio = config.inputFile();
    if (format.isVideo()) {
      AudioVideoSplit split = media.splitAudioVideo(config.inputFile(), outputDirectory);
      video = split.video();
      audio = split.audio();
    }

    SeparatedAudio separated = collaborators.sourceSeparator().separate(audio, outputDirectory);

    List<TimeRange> spans =
        collaborators.speechSegmenter().segment(audio, config.numberOfSpeakers());
    List<Path> chunks = media.cutAudio(audio, spans, outputDirectory);
    List<UtteranceRecord> records = new ArrayList<>(spans.size());
    for (int i = 0; i < spans.size(); i++) {
      records.add(UtteranceRecord.of(chunks.get(i), spans.get(i).start(), spans.get(i).end()));
    }

    MediaTracks tracks =
        new MediaTracks(format, video, audio, separated.vocals(), separated.background());
    return new StageArtifacts(tracks, UtteranceMetadata.of(records));
  }

  /** Transcribe every chunk, then attribute each utterance to a speaker. */
  private StageArtifacts speechToText(StageArtifacts input) {
    UtteranceMetadata utterances = input.utterances();
    List<String> texts = new ArrayList<>(utterances.size());
    for (UtteranceRecord record : utterances) {
      texts.add(
          collaborators
              .transcriber()
              .transcribe(
                  Path.of(record.audioPath()),
                  config.originalLanguage(),
                  config.advertiserName()));
    }
    UtteranceMetadata transcribed = utterances.withTexts(texts);
    if (transcribed.isEmpty()) {
      LOGGER.warn("No utterances detected, skipping speaker diarization");
      return input.withUtterances(transcribed);
    }

    // The untouched input keeps both picture and sound for the model to look at.
    List<SpeakerInfo> speakerInfo =
        collaborators
            .speakerDiarizer()
            .diarize(
                config.inputFile(),
                format.mimeType(),
                transcribed,
                config.numberOfSpeakers(),
                config.diarizationSystemInstructions(),
                config.diarizationInstructions());
    return input.withUtterances(transcribed.withSpeakerInfo(speakerInfo));
  }

  /** Translate all utterances in one script, then optionally merge neighbours. */
  private StageArtifacts translate(StageArtifacts input) {
    UtteranceMetadata utterances = input.utterances();
    if (utterances.isEmpty()) {
      return input;
    }

    String translated =
        collaborators
            .translator()
            .translate(
                new TranslationRequest(
                    TranslationScript.generate(utterances),
                    config.targetLanguage(),
                    config.advertiserName(),
                    config.translationInstructions(),
                    config.translationSystemInstructions()));
    UtteranceMetadata updated =
        utterances.withTranslations(TranslationScript.split(translated, utterances.size()));

    if (config.mergeUtterances()) {
      updated = updated.mergeAdjacent(config.minimumMergeThreshold());
      LOGGER.info("Merged {} utterances into {}", utterances.size(), updated.size());
    }
    return input.withUtterances(updated);
  }

  /** Assign a voice per speaker and synthesize every translated utterance. */
  private StageArtifacts textToSpeech(StageArtifacts input) {
    UtteranceMetadata utterances = input.utterances();
    if (utterances.isEmpty()) {
      return input;
    }

    SpeechSynthesizer synthesizer = collaborators.speechSynthesizer();
    Map<String, String> voices =
        new VoiceAssigner(config.preferredVoices())
            .assign(utterances.speakers(), synthesizer.listVoices(config.targetLanguage()));
    UtteranceMetadata voiced = utterances.withAssignedVoices(voices);

    List<Path> dubbedFiles = new ArrayList<>(voiced.size());
    for (int i = 0; i < voiced.size(); i++) {
      UtteranceRecord record = voiced.get(i);
      Path outputFile =
          config.outputDirectory().resolve(String.format(Locale.ROOT, DUBBED_UTTERANCE_FILE, i));
      dubbedFiles.add(
          synthesizer.synthesize(
              record.translatedText(),
              record.assignedVoice(),
              config.targetLanguage(),
              outputFile));
    }
    return input.withUtterances(voiced.withDubbedFiles(dubbedFiles));
  }

  /** Write the metadata checkpoint. A failed write is reported, not thrown. */
  private MetadataCheckpoint saveMetadata(StageArtifacts input) {
    Path file = config.outputDirectory().resolve(UtteranceMetadataWriter.FILE_NAME);
    try {
      Path written =
          collaborators.metadataWriter().write(input.utterances(), config.outputDirectory());
      LOGGER.info("Utterance metadata saved successfully to '{}'", written);
      return new MetadataCheckpoint(input, written, null);
    } catch (IOException | RuntimeException e) {
      LOGGER.warn("Error saving utterance metadata to '{}': {}", file, e.getMessage());
      return new MetadataCheckpoint(input, file, new PersistenceWarning(file, e.getMessage()));
    }
  }

  /** Lay the dubbed clips over the background and, for video, put the picture back. */
  private Path postprocess(MetadataCheckpoint input) {
    MediaProcessor media = collaborators.mediaProcessor();
    MediaTracks tracks = input.source().media();
    Path outputDirectory = config.outputDirectory();

    Path dubbedVocals =
        media.insertAudioAtTimestamps(
            input.source().utterances(), tracks.background(), outputDirectory);
    Path dubbedAudio =
        media.mergeBackgroundAndVocals(tracks.background(), dubbedVocals, outputDirectory);
    if (!tracks.format().isVideo()) {
      return dubbedAudio;
    }
    if (!tracks.hasVideo()) {
      throw new IllegalStateException("A video track is required for video input");
    }
    return media.combineAudioVideo(tracks.video(), dubbedAudio, outputDirectory);
  }

  private CleanupReport cleanUp(Path finalArtifact) {
    if (!config.cleanUp()) {
      LOGGER.info("Cleanup disabled, keeping temporary artifacts");
      return CleanupReport.disabled();
    }
    return collaborators.cleaner().clean(config.outputDirectory(), Set.of(finalArtifact));
  }

  private static int utteranceCount(Object output) {
    if (output instanceof StageArtifacts) {
      return ((StageArtifacts) output).utterances().size();
    }
    if (output instanceof MetadataCheckpoint) {
      return ((MetadataCheckpoint) output).source().utterances().size();
    }
    return 0;
  }
}
