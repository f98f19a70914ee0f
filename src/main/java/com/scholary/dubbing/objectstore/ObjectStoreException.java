package com.scholary.dubbing.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>The SDK already retries transient failures, so whatever reaches the caller is final.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
