package com.scholary.dubbing.http;

import com.scholary.dubbing.logging.StructuredLogger;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends requests to an external service and retries transient failures.
 *
 * <p>Network errors and 5xx/429 responses are retried with exponential backoff and jitter. Other
 * non-2xx responses fail immediately: a bad request or a rejected token will not get better by
 * asking again.
 *
 * <p>Retries live here, inside the collaborator clients. The pipeline itself never retries a stage.
 */
public class RetryingHttpExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryingHttpExecutor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final String service;
  private final HttpClient httpClient;
  private final int maxRetries;
  private final long baseBackoffMs;

  public RetryingHttpExecutor(String service, Duration connectTimeout, int maxRetries) {
    this(
        service,
        HttpClient.newBuilder().connectTimeout(connectTimeout).build(),
        maxRetries,
        1000);
  }

  public RetryingHttpExecutor(
      String service, HttpClient httpClient, int maxRetries, long baseBackoffMs) {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be at least 1");
    }
    this.service = service;
    this.httpClient = httpClient;
    this.maxRetries = maxRetries;
    this.baseBackoffMs = baseBackoffMs;
  }

  /**
   * Send a request and return the body of the successful response.
   *
   * @param requestFactory builds a fresh request per attempt (body publishers are single-use)
   * @return the response body
   * @throws HttpCallException if the call fails permanently or after all retries
   */
  public String send(Supplier<HttpRequest> requestFactory) {
    return new String(sendForBytes(requestFactory), StandardCharsets.UTF_8);
  }

  /** Like {@link #send(Supplier)} but returns the raw response bytes. */
  public byte[] sendForBytes(Supplier<HttpRequest> requestFactory) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < maxRetries) {
      HttpRequest request = requestFactory.get();
      try {
        LOGGER.debug("Sending {} request to {}", service, request.uri());
        HttpResponse<byte[]> response =
            httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
          return response.body();
        }

        String body = truncate(new String(response.body(), StandardCharsets.UTF_8));
        String message = String.format("%s returned status %d: %s", service, status, body);
        if (!isRetryable(status)) {
          throw new HttpCallException(service, status, message);
        }
        lastException = new IOException(message);

      } catch (IOException e) {
        lastException = e;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new HttpCallException(service, service + " request interrupted", e);
      }

      attempt++;
      if (attempt < maxRetries) {
        // Exponential backoff with jitter
        long backoffMs =
            (long) (Math.pow(2, attempt) * baseBackoffMs + Math.random() * baseBackoffMs);
        structuredLogger.logRequestRetry(
            service,
            attempt,
            maxRetries,
            lastException.getClass().getSimpleName(),
            lastException.getMessage());
        sleep(backoffMs);
      }
    }

    throw new HttpCallException(
        service,
        String.format("%s request failed after %d attempts", service, maxRetries),
        lastException);
  }

  private void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new HttpCallException(service, service + " retry interrupted", ie);
    }
  }

  private static boolean isRetryable(int status) {
    return status == 429 || status >= 500;
  }

  private static String truncate(String body) {
    return body.length() <= 500 ? body : body.substring(0, 500) + "...";
  }
}
