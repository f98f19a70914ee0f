package com.scholary.dubbing.gemini;

/**
 * A stateful conversation with a generative model.
 *
 * <p>Each {@link #send(String)} appends a user turn and the model's reply to the history.
 * Implementations are not thread-safe.
 */
public interface ChatSession {

  /**
   * Send a prompt and return the model's reply.
   *
   * @throws GenerativeModelException if the model returns no usable text
   */
  String send(String prompt);

  /**
   * Undo the last exchange, removing both the prompt and the reply from the history.
   *
   * @throws IllegalStateException if there is no exchange to undo
   */
  void rewind();
}
