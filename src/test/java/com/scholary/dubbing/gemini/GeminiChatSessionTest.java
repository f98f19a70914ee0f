package com.scholary.dubbing.gemini;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.scholary.dubbing.remote.RemoteAssetHandle;
import com.scholary.dubbing.remote.RemoteAssetState;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GeminiChatSessionTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final RemoteAssetHandle video =
      new RemoteAssetHandle(
          "files/abc", "https://gemini.test/files/abc", "video/mp4", RemoteAssetState.ACTIVE);

  private GeminiClient client;
  private List<ArrayNode> sentHistories;

  @BeforeEach
  void setUp() {
    client = mock(GeminiClient.class);
    sentHistories = new ArrayList<>();
    when(client.generateContent(eq("system"), any()))
        .thenAnswer(
            invocation -> {
              sentHistories.add(((ArrayNode) invocation.getArgument(1)).deepCopy());
              return "reply " + sentHistories.size();
            });
  }

  @Test
  void constructor_shouldOpenWithFileTurn() {
    GeminiChatSession session = new GeminiChatSession(client, objectMapper, "system", video);

    assertThat(session.turns()).isEqualTo(1);
  }

  @Test
  void send_shouldReplayFileWithEveryPrompt() {
    GeminiChatSession session = new GeminiChatSession(client, objectMapper, "system", video);

    assertThat(session.send("who speaks?")).isEqualTo("reply 1");

    ArrayNode sent = sentHistories.get(0);
    assertThat(sent.size()).isEqualTo(2);
    assertThat(sent.get(0).path("parts").get(0).path("fileData").path("fileUri").asText())
        .isEqualTo("https://gemini.test/files/abc");
    assertThat(sent.get(1).path("role").asText()).isEqualTo("user");
    assertThat(sent.get(1).path("parts").get(0).path("text").asText()).isEqualTo("who speaks?");
    assertThat(session.turns()).isEqualTo(3);
  }

  @Test
  void rewind_shouldRemoveLastExchangeButKeepFile() {
    GeminiChatSession session = new GeminiChatSession(client, objectMapper, "system", video);
    session.send("first");

    session.rewind();

    assertThat(session.turns()).isEqualTo(1);
    session.send("second");
    assertThat(sentHistories.get(1).size()).isEqualTo(2);
    assertThat(sentHistories.get(1).get(1).path("parts").get(0).path("text").asText())
        .isEqualTo("second");
  }

  @Test
  void rewind_shouldFailWithoutExchange() {
    GeminiChatSession session = new GeminiChatSession(client, objectMapper, "system", video);

    assertThatThrownBy(session::rewind).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void send_shouldDropPromptWhenModelFails() {
    when(client.generateContent(eq("system"), any()))
        .thenThrow(new GeminiException("Gemini returned no candidates"));
    GeminiChatSession session = new GeminiChatSession(client, objectMapper, "system", null);

    assertThatThrownBy(() -> session.send("hello")).isInstanceOf(GeminiException.class);
    assertThat(session.turns()).isZero();
  }
}
