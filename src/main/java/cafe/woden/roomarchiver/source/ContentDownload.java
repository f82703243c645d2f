package cafe.woden.roomarchiver.source;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Streamed content response. Nothing is read from {@code body} until the caller does so, which
 * lets the caller reject oversized content from {@code contentLength} alone.
 */
public record ContentDownload(
    int statusCode,
    String statusText,
    OptionalLong contentLength,
    String contentType,
    InputStream body)
    implements Closeable {
  public ContentDownload {
    statusText = Objects.toString(statusText, "").trim();
    if (contentLength == null) contentLength = OptionalLong.empty();
    if (body == null) body = InputStream.nullInputStream();
  }

  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }

  /** Status descriptor as persisted with the attachment, e.g. {@code "200 OK"}. */
  public String statusLine() {
    return statusText.isEmpty() ? Integer.toString(statusCode) : statusCode + " " + statusText;
  }

  @Override
  public void close() throws IOException {
    body.close();
  }
}
