package com.scholary.dubbing.diarization;

import com.scholary.dubbing.gemini.ChatSession;
import com.scholary.dubbing.gemini.GenerativeModel;
import com.scholary.dubbing.remote.RemoteAssetHandle;
import com.scholary.dubbing.remote.RemoteAssetPoller;
import com.scholary.dubbing.utterance.SpeakerInfo;
import com.scholary.dubbing.utterance.UtteranceMetadata;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attributes transcribed utterances to speakers with a multimodal generative model.
 *
 * <p>Flow: upload the media, wait for the service to finish processing it, open a chat with the
 * file as context, send the transcript and parse the {@code (speaker, gender)} reply. The
 * exchange is rewound afterwards so the session history only holds the file.
 */
public class SpeakerDiarizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeakerDiarizer.class);

  private final GenerativeModel model;
  private final RemoteAssetPoller poller;

  public SpeakerDiarizer(GenerativeModel model, RemoteAssetPoller poller) {
    this.model = model;
    this.poller = poller;
  }

  /**
   * Ask the model who speaks each utterance.
   *
   * @param mediaFile the video, or the audio when the input has no picture
   * @param mimeType MIME type of {@code mediaFile}
   * @param utterances transcribed utterances, in order
   * @param numberOfSpeakers expected number of distinct speakers
   * @param systemInstruction diarization system instruction text
   * @param diarizationInstructions optional extra guidance appended to the prompt
   * @return one tuple per line of the reply, in reply order
   * @throws DiarizationParseException if the reply is malformed
   */
  public List<SpeakerInfo> diarize(
      Path mediaFile,
      String mimeType,
      UtteranceMetadata utterances,
      int numberOfSpeakers,
      String systemInstruction,
      String diarizationInstructions) {
    LOGGER.info(
        "Diarizing speakers: file={}, utterances={}, speakers={}",
        mediaFile.getFileName(),
        utterances.size(),
        numberOfSpeakers);

    RemoteAssetHandle uploaded = model.upload(mediaFile, mimeType);
    RemoteAssetHandle active = poller.waitUntilActive(uploaded, model);

    String prompt = DiarizationPrompt.build(utterances, numberOfSpeakers, diarizationInstructions);
    ChatSession session = model.startChat(systemInstruction, active);
    String reply = session.send(prompt);
    List<SpeakerInfo> speakerInfo;
    try {
      speakerInfo = DiarizationResponseParser.parse(reply);
    } catch (RuntimeException e) {
      // A failed rewind is attached to the parse error, never thrown in its place.
      try {
        session.rewind();
      } catch (RuntimeException rewindFailure) {
        e.addSuppressed(rewindFailure);
      }
      throw e;
    }
    session.rewind();
    LOGGER.info("Diarization returned {} speaker tuples", speakerInfo.size());
    return speakerInfo;
  }
}
