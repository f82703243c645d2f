package cafe.woden.roomarchiver.source.matrix;

import cafe.woden.roomarchiver.net.HttpLite;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/** {@link MatrixHttp} over {@link HttpLite} with fixed per-call timeouts. */
final class HttpLiteMatrixHttp implements MatrixHttp {

  private static final String USER_AGENT = "room-archiver/0.1";

  private final int connectTimeoutMs;
  private final int readTimeoutMs;

  HttpLiteMatrixHttp(int connectTimeoutMs, int readTimeoutMs) {
    this.connectTimeoutMs = connectTimeoutMs;
    this.readTimeoutMs = readTimeoutMs;
  }

  @Override
  public HttpLite.Response<String> get(URI uri, String accessToken) throws IOException {
    return HttpLite.getString(uri, headers(accessToken, "application/json"), connectTimeoutMs, readTimeoutMs);
  }

  @Override
  public HttpLite.Response<String> post(URI uri, String accessToken, String jsonBody)
      throws IOException {
    return HttpLite.postJson(
        uri, headers(accessToken, "application/json"), jsonBody, connectTimeoutMs, readTimeoutMs);
  }

  @Override
  public HttpLite.Response<InputStream> getStream(URI uri, String accessToken) throws IOException {
    return HttpLite.getStream(uri, headers(accessToken, "*/*"), connectTimeoutMs, readTimeoutMs);
  }

  private static Map<String, String> headers(String accessToken, String accept) {
    Map<String, String> h = new LinkedHashMap<>();
    h.put("User-Agent", USER_AGENT);
    h.put("Accept", accept);
    if (accessToken != null && !accessToken.isBlank()) {
      h.put("Authorization", "Bearer " + accessToken);
    }
    return h;
  }
}
