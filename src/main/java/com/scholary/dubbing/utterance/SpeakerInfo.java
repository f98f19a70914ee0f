package com.scholary.dubbing.utterance;

/**
 * Speaker attribution for one utterance, as declared by the diarization model.
 *
 * @param speakerId label of the speaker, e.g. {@code speaker_1}
 * @param gender SSML gender of the speaker, e.g. {@code Male}
 */
public record SpeakerInfo(String speakerId, String gender) {

  public SpeakerInfo {
    if (speakerId == null || speakerId.isBlank()) {
      throw new IllegalArgumentException("Speaker id must not be blank");
    }
    if (gender == null || gender.isBlank()) {
      throw new IllegalArgumentException("Gender must not be blank for speaker " + speakerId);
    }
  }
}
