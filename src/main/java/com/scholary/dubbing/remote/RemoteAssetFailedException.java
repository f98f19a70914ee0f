package com.scholary.dubbing.remote;

/** Thrown as soon as the remote service reports that an uploaded asset failed to process. */
public class RemoteAssetFailedException extends RemoteAssetException {

  public RemoteAssetFailedException(String assetName) {
    super(assetName, String.format("File '%s' failed to process", assetName));
  }
}
