package com.scholary.dubbing.utterance;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.stream.Stream;

/**
 * Ordered, immutable snapshot of the utterances in a source file.
 *
 * <p>Order is chronological and semantically meaningful: it drives speaker attribution, adjacent
 * merging and the final reassembly. Every operation preserves it. Operations never modify this
 * snapshot; each stage derives a new one from its predecessor's.
 */
public final class UtteranceMetadata implements Iterable<UtteranceRecord> {

  private static final UtteranceMetadata EMPTY = new UtteranceMetadata(List.of());

  private final List<UtteranceRecord> records;

  private UtteranceMetadata(List<UtteranceRecord> records) {
    this.records = List.copyOf(records);
  }

  /**
   * Create a snapshot from records in chronological order.
   *
   * @throws IllegalArgumentException if a record starts before its predecessor
   */
  public static UtteranceMetadata of(List<UtteranceRecord> records) {
    for (int i = 1; i < records.size(); i++) {
      if (records.get(i).start() < records.get(i - 1).start()) {
        throw new IllegalArgumentException(
            String.format(
                "Utterances must be in chronological order: #%d starts at %s, before #%d at %s",
                i, records.get(i).start(), i - 1, records.get(i - 1).start()));
      }
    }
    return new UtteranceMetadata(records);
  }

  public static UtteranceMetadata empty() {
    return EMPTY;
  }

  public List<UtteranceRecord> records() {
    return records;
  }

  public UtteranceRecord get(int index) {
    return records.get(index);
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  public Stream<UtteranceRecord> stream() {
    return records.stream();
  }

  @Override
  public Iterator<UtteranceRecord> iterator() {
    return records.iterator();
  }

  /** Attach one transcript per utterance, positionally. */
  public UtteranceMetadata withTexts(List<String> texts) {
    requireSameSize(texts, "transcripts");
    return zip(texts, UtteranceRecord::withText);
  }

  /**
   * Attach speaker attribution, positionally: tuple {@code i} belongs to utterance {@code i}.
   *
   * <p>The diarization prompt asks for exactly one tuple per utterance, listed in utterance order,
   * so the reply index is the utterance index.
   *
   * @throws AttributionMismatchException if the counts differ, whichever side is longer
   */
  public UtteranceMetadata withSpeakerInfo(List<SpeakerInfo> speakerInfo) {
    if (speakerInfo.size() != records.size()) {
      throw new AttributionMismatchException(records.size(), speakerInfo.size());
    }
    return zip(speakerInfo, UtteranceRecord::withSpeaker);
  }

  /** Attach one translation per utterance, positionally. */
  public UtteranceMetadata withTranslations(List<String> translations) {
    requireSameSize(translations, "translations");
    return zip(translations, UtteranceRecord::withTranslatedText);
  }

  /** Attach one synthesized clip per utterance, positionally. */
  public UtteranceMetadata withDubbedFiles(List<Path> dubbedFiles) {
    requireSameSize(dubbedFiles, "dubbed files");
    return zip(dubbedFiles, UtteranceRecord::withDubbedPath);
  }

  /**
   * Assign each utterance the voice chosen for its speaker.
   *
   * @throws IllegalStateException if an utterance's speaker has no voice
   */
  public UtteranceMetadata withAssignedVoices(Map<String, String> voiceBySpeaker) {
    List<UtteranceRecord> updated = new ArrayList<>(records.size());
    for (UtteranceRecord record : records) {
      String voice = voiceBySpeaker.get(record.speakerId());
      if (voice == null) {
        throw new IllegalStateException("No voice assigned to speaker: " + record.speakerId());
      }
      updated.add(record.withAssignedVoice(voice));
    }
    return new UtteranceMetadata(updated);
  }

  /**
   * Merge runs of adjacent utterances spoken by the same speaker.
   *
   * <p>Two neighbours are merged when they share a speaker and the silence between them is shorter
   * than {@code minimumMergeThreshold} seconds.
   */
  public UtteranceMetadata mergeAdjacent(double minimumMergeThreshold) {
    if (records.size() < 2) {
      return this;
    }
    List<UtteranceRecord> merged = new ArrayList<>();
    UtteranceRecord current = records.get(0);
    for (int i = 1; i < records.size(); i++) {
      UtteranceRecord next = records.get(i);
      boolean sameSpeaker =
          current.speakerId() != null && current.speakerId().equals(next.speakerId());
      if (sameSpeaker && next.start() - current.end() < minimumMergeThreshold) {
        current = current.mergeWith(next);
      } else {
        merged.add(current);
        current = next;
      }
    }
    merged.add(current);
    return new UtteranceMetadata(merged);
  }

  /**
   * Distinct speakers in order of first appearance.
   *
   * @return speaker id to attribution, skipping utterances without a speaker
   */
  public Map<String, SpeakerInfo> speakers() {
    Map<String, SpeakerInfo> speakers = new LinkedHashMap<>();
    for (UtteranceRecord record : records) {
      if (record.speakerId() != null) {
        speakers.putIfAbsent(
            record.speakerId(), new SpeakerInfo(record.speakerId(), record.ssmlGender()));
      }
    }
    return speakers;
  }

  private <T> UtteranceMetadata zip(
      List<T> values, BiFunction<UtteranceRecord, T, UtteranceRecord> update) {
    List<UtteranceRecord> updated = new ArrayList<>(records.size());
    for (int i = 0; i < records.size(); i++) {
      updated.add(update.apply(records.get(i), values.get(i)));
    }
    return new UtteranceMetadata(updated);
  }

  private void requireSameSize(List<?> values, String what) {
    if (values.size() != records.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Expected %d %s but got %d", records.size(), what, values.size()));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof UtteranceMetadata)) {
      return false;
    }
    return records.equals(((UtteranceMetadata) o).records);
  }

  @Override
  public int hashCode() {
    return records.hashCode();
  }

  @Override
  public String toString() {
    return "UtteranceMetadata[size=" + records.size() + "]";
  }
}
