package com.scholary.dubbing.gemini;

import com.scholary.dubbing.remote.RemoteAssetHandle;
import com.scholary.dubbing.remote.RemoteAssetStatusQuery;
import java.nio.file.Path;

/**
 * A generative model that can read uploaded media.
 *
 * <p>Uploads are processed asynchronously by the remote service; callers wait for the returned
 * handle to become active (see {@link com.scholary.dubbing.remote.RemoteAssetPoller}) before
 * referencing it in a chat.
 */
public interface GenerativeModel extends RemoteAssetStatusQuery {

  /**
   * Upload a media file.
   *
   * @return a handle in whatever state the service reports right after the upload
   */
  RemoteAssetHandle upload(Path file, String mimeType);

  /**
   * Open a new conversation.
   *
   * @param systemInstruction guides the model's behaviour for the whole session
   * @param attachment an active uploaded file the conversation starts with, or null
   */
  ChatSession startChat(String systemInstruction, RemoteAssetHandle attachment);
}
