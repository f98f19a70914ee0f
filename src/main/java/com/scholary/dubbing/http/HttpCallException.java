package com.scholary.dubbing.http;

/**
 * Thrown when a call to an external HTTP service fails after all retries, or fails with a status
 * that is not worth retrying.
 */
public class HttpCallException extends RuntimeException {

  private final String service;
  private final int statusCode;

  public HttpCallException(String service, int statusCode, String message) {
    super(message);
    this.service = service;
    this.statusCode = statusCode;
  }

  public HttpCallException(String service, String message, Throwable cause) {
    super(message, cause);
    this.service = service;
    this.statusCode = -1;
  }

  public String getService() {
    return service;
  }

  /** HTTP status of the last response, or -1 if no response was received. */
  public int getStatusCode() {
    return statusCode;
  }
}
