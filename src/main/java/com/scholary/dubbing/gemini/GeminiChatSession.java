package com.scholary.dubbing.gemini;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.dubbing.remote.RemoteAssetHandle;

/**
 * Chat history held on the client and replayed on every request.
 *
 * <p>An attached file becomes the opening user turn, so it stays in context for every prompt and
 * cannot be rewound.
 */
class GeminiChatSession implements ChatSession {

  private final GeminiClient client;
  private final String systemInstruction;
  private final ArrayNode history;
  private final int openingTurns;

  GeminiChatSession(
      GeminiClient client,
      ObjectMapper objectMapper,
      String systemInstruction,
      RemoteAssetHandle attachment) {
    this.client = client;
    this.systemInstruction = systemInstruction;
    this.history = objectMapper.createArrayNode();
    if (attachment != null) {
      ObjectNode fileData = userTurn().putArray("parts").addObject().putObject("fileData");
      fileData.put("mimeType", attachment.mimeType());
      fileData.put("fileUri", attachment.uri());
    }
    this.openingTurns = history.size();
  }

  @Override
  public String send(String prompt) {
    userTurn().putArray("parts").addObject().put("text", prompt);
    String reply;
    try {
      reply = client.generateContent(systemInstruction, history);
    } catch (RuntimeException e) {
      history.remove(history.size() - 1);
      throw e;
    }
    ObjectNode modelTurn = history.addObject();
    modelTurn.put("role", "model");
    modelTurn.putArray("parts").addObject().put("text", reply);
    return reply;
  }

  @Override
  public void rewind() {
    if (history.size() - openingTurns < 2) {
      throw new IllegalStateException("Nothing to rewind");
    }
    history.remove(history.size() - 1);
    history.remove(history.size() - 1);
  }

  int turns() {
    return history.size();
  }

  private ObjectNode userTurn() {
    ObjectNode turn = history.addObject();
    turn.put("role", "user");
    return turn;
  }
}
