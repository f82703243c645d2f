package cafe.woden.roomarchiver.net;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URL;
import java.net.URLConnection;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.zip.GZIPInputStream;

/**
 * Small {@link HttpURLConnection} helper for the archiver's API calls and content downloads.
 *
 * <p>GET responses are streamed so callers can inspect {@code Content-Length} before reading the
 * body. Redirects are followed manually (up to {@link #DEFAULT_MAX_REDIRECTS}).
 */
public final class HttpLite {

  public static final int DEFAULT_MAX_REDIRECTS = 5;

  private HttpLite() {}

  public static final class Headers {
    private final Map<String, List<String>> raw;

    public Headers(Map<String, List<String>> raw) {
      this.raw = raw == null ? Map.of() : raw;
    }

    public Map<String, List<String>> raw() {
      return raw;
    }

    public Optional<String> firstValue(String name) {
      if (name == null || name.isBlank()) return Optional.empty();
      String target = name.toLowerCase(Locale.ROOT);
      for (Map.Entry<String, List<String>> e : raw.entrySet()) {
        String k = e.getKey();
        if (k == null) continue;
        if (k.toLowerCase(Locale.ROOT).equals(target)) {
          List<String> vals = e.getValue();
          if (vals == null || vals.isEmpty()) return Optional.empty();
          return Optional.ofNullable(vals.get(0));
        }
      }
      return Optional.empty();
    }

    public OptionalLong firstValueAsLong(String name) {
      Optional<String> v = firstValue(name);
      if (v.isEmpty()) return OptionalLong.empty();
      try {
        return OptionalLong.of(Long.parseLong(v.get().trim()));
      } catch (NumberFormatException ignored) {
        return OptionalLong.empty();
      }
    }
  }

  /** {@code statusText} is the reason phrase, e.g. {@code "OK"}; empty when the server sent none. */
  public record Response<T>(int statusCode, String statusText, Headers headers, T body) {
    public Response {
      statusText = Objects.toString(statusText, "").trim();
    }

    public boolean isSuccess() {
      return statusCode >= 200 && statusCode < 300;
    }
  }

  public static Response<InputStream> getStream(
      URI uri, Map<String, String> requestHeaders, int connectTimeoutMs, int readTimeoutMs)
      throws IOException {
    return getStream(uri, requestHeaders, connectTimeoutMs, readTimeoutMs, DEFAULT_MAX_REDIRECTS);
  }

  public static Response<InputStream> getStream(
      URI uri,
      Map<String, String> requestHeaders,
      int connectTimeoutMs,
      int readTimeoutMs,
      int maxRedirects)
      throws IOException {
    URI current = uri;
    for (int i = 0; i <= maxRedirects; i++) {
      HttpURLConnection conn = open(current, connectTimeoutMs, readTimeoutMs);
      conn.setInstanceFollowRedirects(false);
      conn.setRequestMethod("GET");
      applyHeaders(conn, requestHeaders);

      int code = conn.getResponseCode();

      if (isRedirect(code)) {
        String loc = conn.getHeaderField("Location");
        // Ensure we don't leak the connection.
        closeQuietly(conn);
        if (loc == null || loc.isBlank()) {
          return new Response<>(
              code,
              conn.getResponseMessage(),
              new Headers(conn.getHeaderFields()),
              InputStream.nullInputStream());
        }
        current = current.resolve(loc);
        continue;
      }

      return new Response<>(
          code, conn.getResponseMessage(), new Headers(conn.getHeaderFields()), body(conn, code));
    }

    throw new IOException("Too many redirects for " + uri);
  }

  public static Response<String> getString(
      URI uri, Map<String, String> requestHeaders, int connectTimeoutMs, int readTimeoutMs)
      throws IOException {
    Response<InputStream> r = getStream(uri, requestHeaders, connectTimeoutMs, readTimeoutMs);
    return readString(r);
  }

  /** POST a JSON document and read the (textual) response. Redirects are not followed. */
  public static Response<String> postJson(
      URI uri,
      Map<String, String> requestHeaders,
      String json,
      int connectTimeoutMs,
      int readTimeoutMs)
      throws IOException {
    HttpURLConnection conn = open(uri, connectTimeoutMs, readTimeoutMs);
    conn.setInstanceFollowRedirects(false);
    conn.setRequestMethod("POST");
    conn.setDoOutput(true);
    conn.setRequestProperty("Content-Type", "application/json");
    applyHeaders(conn, requestHeaders);

    byte[] payload = Objects.toString(json, "{}").getBytes(StandardCharsets.UTF_8);
    conn.setFixedLengthStreamingMode(payload.length);
    try (OutputStream out = conn.getOutputStream()) {
      out.write(payload);
    }

    int code = conn.getResponseCode();
    return readString(
        new Response<>(
            code,
            conn.getResponseMessage(),
            new Headers(conn.getHeaderFields()),
            body(conn, code)));
  }

  private static Response<String> readString(Response<InputStream> r) throws IOException {
    byte[] bytes;
    try (InputStream in = r.body()) {
      bytes = in.readAllBytes();
    }
    Charset charset = charsetFromContentType(r.headers().firstValue("Content-Type").orElse(null));
    return new Response<>(r.statusCode(), r.statusText(), r.headers(), new String(bytes, charset));
  }

  private static InputStream body(HttpURLConnection conn, int code) throws IOException {
    InputStream body = (code >= 400) ? conn.getErrorStream() : conn.getInputStream();
    if (body == null) body = InputStream.nullInputStream();

    String encoding = conn.getHeaderField("Content-Encoding");
    if (encoding != null && encoding.toLowerCase(Locale.ROOT).contains("gzip")) {
      body = new GZIPInputStream(body);
    }
    return body;
  }

  private static void applyHeaders(HttpURLConnection conn, Map<String, String> requestHeaders) {
    if (requestHeaders == null) return;
    for (Map.Entry<String, String> e : requestHeaders.entrySet()) {
      if (e.getKey() != null && e.getValue() != null) {
        conn.setRequestProperty(e.getKey(), e.getValue());
      }
    }
  }

  static Charset charsetFromContentType(String contentType) {
    if (contentType == null) return StandardCharsets.UTF_8;
    String[] parts = contentType.split(";");
    for (String p : parts) {
      String s = p.trim().toLowerCase(Locale.ROOT);
      if (s.startsWith("charset=")) {
        String cs = s.substring("charset=".length()).trim();
        try {
          return Charset.forName(cs);
        } catch (Exception ignored) {
          return StandardCharsets.UTF_8;
        }
      }
    }
    return StandardCharsets.UTF_8;
  }

  private static boolean isRedirect(int code) {
    return code == 301 || code == 302 || code == 303 || code == 307 || code == 308;
  }

  private static HttpURLConnection open(URI uri, int connectTimeoutMs, int readTimeoutMs)
      throws IOException {
    URL url = uri.toURL();
    URLConnection uc = url.openConnection();
    if (!(uc instanceof HttpURLConnection conn)) {
      throw new IOException("Not an HTTP URL: " + uri);
    }
    conn.setConnectTimeout(connectTimeoutMs);
    conn.setReadTimeout(readTimeoutMs);
    return conn;
  }

  private static void closeQuietly(HttpURLConnection conn) {
    try {
      InputStream in = conn.getInputStream();
      if (in != null) in.close();
    } catch (IOException ignored) {
      try {
        InputStream in = conn.getErrorStream();
        if (in != null) in.close();
      } catch (IOException ignored2) {
        // ignore
      }
    }
    conn.disconnect();
  }
}
