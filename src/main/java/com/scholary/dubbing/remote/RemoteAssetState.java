package com.scholary.dubbing.remote;

/** Processing state of an uploaded asset, as reported by the remote service. */
public enum RemoteAssetState {
  /** Uploaded, still being processed. */
  PENDING,
  /** Ready to be referenced in model requests. */
  ACTIVE,
  /** Processing failed on the remote side; the asset is unusable. */
  FAILED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
