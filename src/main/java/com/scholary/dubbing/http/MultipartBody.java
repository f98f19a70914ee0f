package com.scholary.dubbing.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Builds a multipart/form-data body for {@link java.net.http.HttpClient}, which has no built-in
 * multipart support.
 *
 * <p>The wire format is:
 *
 * <pre>
 * --boundary
 * Content-Disposition: form-data; name="file"; filename="chunk.mp3"
 * Content-Type: audio/mpeg
 *
 * [binary data]
 * --boundary
 * Content-Disposition: form-data; name="language"
 *
 * en
 * --boundary--
 * </pre>
 *
 * <p>Parts are assembled as raw bytes, never as a String, so binary file content survives intact.
 */
public final class MultipartBody {

  private final String boundary;
  private final ByteArrayOutputStream body = new ByteArrayOutputStream();

  public MultipartBody() {
    this(UUID.randomUUID().toString());
  }

  MultipartBody(String boundary) {
    this.boundary = boundary;
  }

  public MultipartBody addFile(String name, Path file, String contentType) throws IOException {
    write("--" + boundary + "\r\n");
    write(
        "Content-Disposition: form-data; name=\""
            + name
            + "\"; filename=\""
            + file.getFileName()
            + "\"\r\n");
    write("Content-Type: " + contentType + "\r\n\r\n");
    body.write(Files.readAllBytes(file));
    write("\r\n");
    return this;
  }

  public MultipartBody addField(String name, Object value) {
    if (value == null) {
      return this;
    }
    write("--" + boundary + "\r\n");
    write("Content-Disposition: form-data; name=\"" + name + "\"\r\n\r\n");
    write(value + "\r\n");
    return this;
  }

  public String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  public byte[] toByteArray() {
    ByteArrayOutputStream complete = new ByteArrayOutputStream(body.size() + boundary.length() + 8);
    complete.writeBytes(body.toByteArray());
    complete.writeBytes(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
    return complete.toByteArray();
  }

  public BodyPublisher toPublisher() {
    return BodyPublishers.ofByteArray(toByteArray());
  }

  private void write(String text) {
    body.writeBytes(text.getBytes(StandardCharsets.UTF_8));
  }
}
