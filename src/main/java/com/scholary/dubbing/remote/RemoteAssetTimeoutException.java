package com.scholary.dubbing.remote;

import java.time.Duration;

/** Thrown when an uploaded asset is still pending after the maximum wait. */
public class RemoteAssetTimeoutException extends RemoteAssetException {

  private final Duration waited;

  public RemoteAssetTimeoutException(String assetName, Duration waited) {
    super(assetName, String.format("File '%s' was not active after %s", assetName, waited));
    this.waited = waited;
  }

  public RemoteAssetTimeoutException(String assetName, Duration waited, Throwable cause) {
    super(
        assetName,
        String.format("Waiting for file '%s' was interrupted after %s", assetName, waited),
        cause);
    this.waited = waited;
  }

  public Duration getWaited() {
    return waited;
  }
}
