package com.scholary.dubbing.synthesis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.dubbing.utterance.SpeakerInfo;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class VoiceAssignerTest {

  private static final List<Voice> VOICES =
      List.of(
          new Voice("pl-PL-Standard-A", List.of("pl-PL"), "FEMALE"),
          new Voice("pl-PL-Standard-B", List.of("pl-PL"), "MALE"),
          new Voice("pl-PL-Wavenet-A", List.of("pl-PL"), "FEMALE"),
          new Voice("pl-PL-Wavenet-B", List.of("pl-PL"), "MALE"),
          new Voice("pl-PL-Wavenet-C", List.of("pl-PL"), "MALE"));

  private static Map<String, SpeakerInfo> speakers(SpeakerInfo... infos) {
    Map<String, SpeakerInfo> speakers = new LinkedHashMap<>();
    for (SpeakerInfo info : infos) {
      speakers.put(info.speakerId(), info);
    }
    return speakers;
  }

  @Test
  void assign_shouldMatchGenderAndPreferFamilies() {
    VoiceAssigner assigner = new VoiceAssigner(List.of("Wavenet"));

    Map<String, String> assigned =
        assigner.assign(
            speakers(
                new SpeakerInfo("speaker_1", "Male"), new SpeakerInfo("speaker_2", "Female")),
            VOICES);

    assertThat(assigned)
        .containsEntry("speaker_1", "pl-PL-Wavenet-B")
        .containsEntry("speaker_2", "pl-PL-Wavenet-A");
  }

  @Test
  void assign_shouldGiveDistinctVoicesToSameGender() {
    VoiceAssigner assigner = new VoiceAssigner(List.of("Wavenet"));

    Map<String, String> assigned =
        assigner.assign(
            speakers(new SpeakerInfo("speaker_1", "Male"), new SpeakerInfo("speaker_2", "Male")),
            VOICES);

    assertThat(assigned.values()).containsExactly("pl-PL-Wavenet-B", "pl-PL-Wavenet-C");
  }

  @Test
  void assign_shouldReuseVoicesWhenTheyRunOut() {
    List<Voice> oneFemale = List.of(new Voice("pl-PL-Standard-A", List.of("pl-PL"), "FEMALE"));

    Map<String, String> assigned =
        new VoiceAssigner(List.of())
            .assign(
                speakers(
                    new SpeakerInfo("speaker_1", "Female"),
                    new SpeakerInfo("speaker_2", "Female")),
                oneFemale);

    assertThat(assigned.values()).containsOnly("pl-PL-Standard-A");
  }

  @Test
  void assign_shouldFallBackToAnyVoiceWithoutGenderMatch() {
    List<Voice> femaleOnly = List.of(new Voice("pl-PL-Standard-A", List.of("pl-PL"), "FEMALE"));

    Map<String, String> assigned =
        new VoiceAssigner(null)
            .assign(speakers(new SpeakerInfo("speaker_1", "Male")), femaleOnly);

    assertThat(assigned).containsEntry("speaker_1", "pl-PL-Standard-A");
  }

  @Test
  void assign_shouldFailWithoutVoices() {
    assertThatThrownBy(
            () ->
                new VoiceAssigner(List.of())
                    .assign(speakers(new SpeakerInfo("speaker_1", "Male")), List.of()))
        .isInstanceOf(SpeechSynthesisException.class);
  }
}
