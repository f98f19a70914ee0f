package com.scholary.dubbing.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.scholary.dubbing.gemini.ChatSession;
import com.scholary.dubbing.gemini.GenerativeModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GeminiTranslatorTest {

  @Mock private GenerativeModel model;
  @Mock private ChatSession session;

  @Test
  void translate_shouldSendScriptInFreshChat() {
    when(model.startChat("translate well", null)).thenReturn(session);
    when(session.send(anyString())).thenReturn("  Hola <BREAK> Compra ahora\n");

    String translated =
        new GeminiTranslator(model)
            .translate(
                new TranslationRequest(
                    "Hello <BREAK> Buy now", "es-ES", "Acme", null, "translate well"));

    assertThat(translated).isEqualTo("Hola <BREAK> Compra ahora");
  }

  @Test
  void prompt_shouldMentionTargetLanguageBrandAndScript() {
    String prompt =
        GeminiTranslator.prompt(
            new TranslationRequest(
                "Hello <BREAK> Buy now", "pl-PL", "Acme", "Use informal tone", "system"));

    assertThat(prompt)
        .contains("into pl-PL")
        .contains("<BREAK>")
        .contains("'Acme'")
        .contains("Additional instructions: Use informal tone")
        .endsWith("Hello <BREAK> Buy now");
  }

  @Test
  void prompt_shouldSkipEmptyOptionalParts() {
    String prompt =
        GeminiTranslator.prompt(new TranslationRequest("Hello", "pl-PL", null, " ", "system"));

    assertThat(prompt).doesNotContain("brand").doesNotContain("Additional instructions");
  }
}
