package com.scholary.dubbing.pipeline;

import com.scholary.dubbing.diarization.SpeakerDiarizer;
import com.scholary.dubbing.media.MediaProcessor;
import com.scholary.dubbing.media.SourceSeparator;
import com.scholary.dubbing.segmentation.SpeechSegmenter;
import com.scholary.dubbing.synthesis.SpeechSynthesizer;
import com.scholary.dubbing.transcription.Transcriber;
import com.scholary.dubbing.translation.Translator;
import com.scholary.dubbing.utterance.UtteranceMetadataWriter;

/** External services a run calls. Shared between runs; none of them keeps per-run state. */
public record DubbingCollaborators(
    MediaProcessor mediaProcessor,
    SourceSeparator sourceSeparator,
    SpeechSegmenter speechSegmenter,
    Transcriber transcriber,
    SpeakerDiarizer speakerDiarizer,
    Translator translator,
    SpeechSynthesizer speechSynthesizer,
    UtteranceMetadataWriter metadataWriter,
    WorkingDirectoryCleaner cleaner) {}
