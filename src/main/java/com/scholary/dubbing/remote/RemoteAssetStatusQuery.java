package com.scholary.dubbing.remote;

/** Fetches the current state of an uploaded asset from the remote service. */
@FunctionalInterface
public interface RemoteAssetStatusQuery {

  RemoteAssetState queryStatus(RemoteAssetHandle handle);
}
