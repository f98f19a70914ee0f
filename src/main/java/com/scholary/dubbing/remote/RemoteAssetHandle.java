package com.scholary.dubbing.remote;

/**
 * Reference to a media file uploaded to a remote inference service.
 *
 * <p>The state is a snapshot taken when the handle was produced. The remote service owns the real
 * state; use {@link #withState(RemoteAssetState)} to record a fresher observation.
 *
 * @param name the remote resource name, used to query its status
 * @param uri the URI to reference the asset in model requests
 * @param mimeType the MIME type the asset was uploaded with
 * @param state the last observed state
 */
public record RemoteAssetHandle(String name, String uri, String mimeType, RemoteAssetState state) {

  public RemoteAssetHandle withState(RemoteAssetState newState) {
    return new RemoteAssetHandle(name, uri, mimeType, newState);
  }
}
