package com.scholary.dubbing.remote;

/** Base class for failures while waiting on an uploaded asset. */
public abstract class RemoteAssetException extends RuntimeException {

  private final String assetName;

  protected RemoteAssetException(String assetName, String message) {
    super(message);
    this.assetName = assetName;
  }

  protected RemoteAssetException(String assetName, String message, Throwable cause) {
    super(message, cause);
    this.assetName = assetName;
  }

  public String getAssetName() {
    return assetName;
  }
}
