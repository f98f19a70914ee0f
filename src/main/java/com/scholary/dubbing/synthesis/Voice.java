package com.scholary.dubbing.synthesis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * A text-to-speech voice.
 *
 * @param name full voice name, e.g. {@code pl-PL-Wavenet-A}
 * @param languageCodes languages the voice can speak
 * @param ssmlGender {@code MALE}, {@code FEMALE} or {@code NEUTRAL}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Voice(String name, List<String> languageCodes, String ssmlGender) {}
