package com.scholary.dubbing.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetryingHttpExecutorTest {

  private final Supplier<HttpRequest> request =
      () -> HttpRequest.newBuilder().uri(URI.create("http://service.test/api")).GET().build();

  private HttpClient httpClient;
  private RetryingHttpExecutor executor;

  @BeforeEach
  void setUp() {
    httpClient = mock(HttpClient.class);
    executor = new RetryingHttpExecutor("test", httpClient, 3, 1);
  }

  @Test
  void send_shouldReturnBodyOfSuccessfulResponse() throws Exception {
    HttpResponse<byte[]> ok = response(200, "{\"ok\":true}");
    doReturn(ok).when(httpClient).send(any(HttpRequest.class), any());

    assertThat(executor.send(request)).isEqualTo("{\"ok\":true}");
  }

  @Test
  void send_shouldRetryServerErrorsAndNetworkFailures() throws Exception {
    HttpResponse<byte[]> unavailable = response(503, "busy");
    HttpResponse<byte[]> ok = response(200, "done");
    doReturn(unavailable)
        .doThrow(new IOException("connection reset"))
        .doReturn(ok)
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    assertThat(executor.send(request)).isEqualTo("done");
    verify(httpClient, times(3)).send(any(HttpRequest.class), any());
  }

  @Test
  void send_shouldNotRetryClientErrors() throws Exception {
    HttpResponse<byte[]> forbidden = response(403, "bad key");
    doReturn(forbidden).when(httpClient).send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> executor.send(request))
        .isInstanceOf(HttpCallException.class)
        .hasMessageContaining("403")
        .hasMessageContaining("bad key");
    verify(httpClient, times(1)).send(any(HttpRequest.class), any());
  }

  @Test
  void send_shouldGiveUpAfterMaxRetries() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any()))
        .thenThrow(new IOException("connection refused"));

    assertThatThrownBy(() -> executor.send(request))
        .isInstanceOf(HttpCallException.class)
        .hasMessageContaining("after 3 attempts")
        .hasCauseInstanceOf(IOException.class);
    verify(httpClient, times(3)).send(any(HttpRequest.class), any());
  }

  @Test
  void constructor_shouldRequireAtLeastOneAttempt() {
    assertThatThrownBy(() -> new RetryingHttpExecutor("test", httpClient, 0, 1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @SuppressWarnings("unchecked")
  private static HttpResponse<byte[]> response(int status, String body) {
    HttpResponse<byte[]> response = mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body.getBytes(StandardCharsets.UTF_8));
    return response;
  }
}
