package com.scholary.dubbing.synthesis;

import com.scholary.dubbing.utterance.SpeakerInfo;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks one voice per speaker.
 *
 * <p>Candidates must match the speaker's SSML gender. Among them, voices from the preferred
 * families win in the order the families are listed (a family matches when the voice name
 * contains it, so both {@code Wavenet} and {@code pl-PL-Wavenet-A} work). Distinct speakers get
 * distinct voices while enough are available. When no voice has the right gender, any voice of
 * the language is used.
 */
public class VoiceAssigner {

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceAssigner.class);

  private final List<String> preferredFamilies;

  public VoiceAssigner(List<String> preferredFamilies) {
    this.preferredFamilies = preferredFamilies == null ? List.of() : List.copyOf(preferredFamilies);
  }

  /**
   * Assign voices.
   *
   * @param speakers speakers in order of first appearance
   * @param voices voices available in the target language
   * @return speaker id to voice name
   * @throws SpeechSynthesisException if there are no voices at all
   */
  public Map<String, String> assign(Map<String, SpeakerInfo> speakers, List<Voice> voices) {
    if (voices.isEmpty()) {
      throw new SpeechSynthesisException("No voices available for the target language");
    }
    Map<String, String> assigned = new LinkedHashMap<>();
    Set<String> used = new HashSet<>();
    for (SpeakerInfo speaker : speakers.values()) {
      List<Voice> candidates = ranked(matchingGender(voices, speaker.gender()));
      if (candidates.isEmpty()) {
        LOGGER.warn(
            "No {} voice available for speaker {}, using any voice",
            speaker.gender(),
            speaker.speakerId());
        candidates = ranked(voices);
      }
      Voice chosen = firstUnused(candidates, used);
      used.add(chosen.name());
      assigned.put(speaker.speakerId(), chosen.name());
      LOGGER.info("Assigned voice {} to speaker {}", chosen.name(), speaker.speakerId());
    }
    return assigned;
  }

  private static List<Voice> matchingGender(List<Voice> voices, String gender) {
    List<Voice> matching = new ArrayList<>();
    for (Voice voice : voices) {
      if (voice.ssmlGender() != null && voice.ssmlGender().equalsIgnoreCase(gender)) {
        matching.add(voice);
      }
    }
    return matching;
  }

  /** Preferred families first, in preference order, then the rest in service order. */
  private List<Voice> ranked(List<Voice> voices) {
    List<Voice> ranked = new ArrayList<>();
    for (String family : preferredFamilies) {
      for (Voice voice : voices) {
        if (voice.name().contains(family) && !ranked.contains(voice)) {
          ranked.add(voice);
        }
      }
    }
    for (Voice voice : voices) {
      if (!ranked.contains(voice)) {
        ranked.add(voice);
      }
    }
    return ranked;
  }

  private static Voice firstUnused(List<Voice> candidates, Set<String> used) {
    for (Voice voice : candidates) {
      if (!used.contains(voice.name())) {
        return voice;
      }
    }
    return candidates.get(0);
  }
}
