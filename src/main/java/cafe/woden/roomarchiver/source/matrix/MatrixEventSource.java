package cafe.woden.roomarchiver.source.matrix;

import cafe.woden.roomarchiver.config.ArchiverProperties;
import cafe.woden.roomarchiver.net.HttpLite;
import cafe.woden.roomarchiver.source.ContentDownload;
import cafe.woden.roomarchiver.source.EventSource;
import cafe.woden.roomarchiver.source.EventSourceException;
import cafe.woden.roomarchiver.source.MessagePage;
import cafe.woden.roomarchiver.source.RawEvent;
import cafe.woden.roomarchiver.source.RoomView;
import cafe.woden.roomarchiver.source.SourceDevice;
import cafe.woden.roomarchiver.source.SourceMember;
import cafe.woden.roomarchiver.source.TopicLookup;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventSource} backed by the Matrix client-server API.
 *
 * <p>Call {@link #login()} before use and {@link #logout()} afterwards. When an access token is
 * configured, login only resolves the account's user id and logout is a no-op.
 */
public class MatrixEventSource implements EventSource {

  private static final Logger log = LoggerFactory.getLogger(MatrixEventSource.class);

  private static final ObjectMapper JSON = new ObjectMapper();

  static final String CLIENT_API = "/_matrix/client/v3";

  // Resident timeline size requested from the initial sync.
  private static final int SYNC_TIMELINE_LIMIT = 50;

  private final ArchiverProperties.Source cfg;
  private final MatrixHttp http;

  private volatile String accessToken;
  private volatile String userId;
  private volatile boolean loggedInWithPassword;

  public MatrixEventSource(ArchiverProperties.Source cfg) {
    this(cfg, new HttpLiteMatrixHttp(cfg.connectTimeoutMs(), cfg.readTimeoutMs()));
  }

  public MatrixEventSource(ArchiverProperties.Source cfg, MatrixHttp http) {
    this.cfg = Objects.requireNonNull(cfg, "cfg");
    this.http = Objects.requireNonNull(http, "http");
    this.accessToken = cfg.accessToken();
  }

  /** Authenticate with the configured token or password. */
  public void login() {
    if (cfg.hasAccessToken()) {
      accessToken = cfg.accessToken();
      JsonNode whoami = getJson(api("/account/whoami"), "whoami");
      userId = whoami.path("user_id").asText(cfg.user());
      log.info("[archiver] Using access token for {} on {}", userId, cfg.homeserver());
      return;
    }
    if (cfg.user().isEmpty()) {
      throw new EventSourceException("No access token and no user configured for " + cfg.homeserver());
    }

    log.info("[archiver] Signing into {}...", cfg.homeserver());
    ObjectNode body = JSON.createObjectNode();
    body.put("type", "m.login.password");
    ObjectNode identifier = body.putObject("identifier");
    identifier.put("type", "m.id.user");
    identifier.put("user", cfg.user());
    body.put("password", cfg.password());
    body.put("initial_device_display_name", cfg.deviceName());

    JsonNode res = postJson(api("/login"), null, body.toString(), "login");
    String token = res.path("access_token").asText("");
    if (token.isBlank()) {
      throw new EventSourceException("Login response for " + cfg.user() + " had no access token");
    }
    accessToken = token;
    userId = res.path("user_id").asText(cfg.user());
    loggedInWithPassword = true;
  }

  /** Invalidate a token obtained by {@link #login()}. Tokens supplied by configuration are kept. */
  public void logout() {
    if (!loggedInWithPassword) return;
    try {
      postJson(api("/logout"), accessToken, "{}", "logout");
    } catch (EventSourceException e) {
      log.warn("[archiver] Logout failed: {}", e.getMessage());
    } finally {
      loggedInWithPassword = false;
      accessToken = "";
    }
  }

  public String userId() {
    return userId;
  }

  @Override
  public Map<String, RoomView> listRooms() {
    String filter =
        "{\"room\":{\"timeline\":{\"limit\":"
            + SYNC_TIMELINE_LIMIT
            + "},\"state\":{\"lazy_load_members\":true}}}";
    URI uri = api("/sync?timeout=0&filter=" + encode(filter));
    JsonNode root = getJson(uri, "sync");

    Map<String, RoomView> rooms = new LinkedHashMap<>();
    JsonNode join = root.path("rooms").path("join");
    Iterator<Map.Entry<String, JsonNode>> it = join.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      rooms.put(e.getKey(), roomViewFromSync(e.getKey(), e.getValue()));
    }
    return rooms;
  }

  @Override
  public List<SourceDevice> getDevices() {
    JsonNode root = getJson(api("/devices"), "devices");
    List<SourceDevice> out = new ArrayList<>();
    for (JsonNode d : root.path("devices")) {
      JsonNode seen = d.get("last_seen_ts");
      out.add(
          new SourceDevice(
              text(d.get("user_id"), userId),
              text(d.get("device_id"), null),
              text(d.get("display_name"), null),
              seen == null || seen.isNull() ? null : seen.asLong(),
              text(d.get("last_seen_ip"), null)));
    }
    return out;
  }

  @Override
  public MessagePage paginateMessages(
      String roomId, String cursor, Direction direction, int limit) {
    StringBuilder path =
        new StringBuilder("/rooms/")
            .append(encode(roomId))
            .append("/messages?dir=")
            .append(direction == Direction.FORWARD ? "f" : "b")
            .append("&limit=")
            .append(Math.max(1, limit));
    if (cursor != null && !cursor.isBlank()) {
      path.append("&from=").append(encode(cursor));
    }
    JsonNode root = getJson(api(path.toString()), "messages for " + roomId);
    return new MessagePage(events(root.path("chunk"), false), text(root.get("end"), null));
  }

  @Override
  public URI resolveContentUrl(String contentRef) {
    String ref = Objects.toString(contentRef, "").trim();
    if (!ref.toLowerCase(Locale.ROOT).startsWith("mxc://")) {
      throw new EventSourceException("Not a content reference: " + ref);
    }
    String rest = ref.substring("mxc://".length());
    int slash = rest.indexOf('/');
    if (slash <= 0 || slash == rest.length() - 1) {
      throw new EventSourceException("Malformed content reference: " + ref);
    }
    String server = rest.substring(0, slash);
    String mediaId = rest.substring(slash + 1);
    return URI.create(
        cfg.homeserver() + cfg.mediaDownloadPath() + encode(server) + "/" + encode(mediaId));
  }

  @Override
  public ContentDownload download(URI url) throws IOException {
    HttpLite.Response<InputStream> r = http.getStream(url, accessToken);
    return new ContentDownload(
        r.statusCode(),
        r.statusText(),
        r.headers().firstValueAsLong("Content-Length"),
        r.headers().firstValue("Content-Type").orElse(null),
        r.body());
  }

  List<SourceMember> joinedMembers(String roomId) {
    JsonNode root =
        getJson(api("/rooms/" + encode(roomId) + "/joined_members"), "members of " + roomId);
    List<SourceMember> out = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> it = root.path("joined").fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      JsonNode m = e.getValue();
      out.add(
          new SourceMember(
              e.getKey(), text(m.get("display_name"), null), text(m.get("avatar_url"), null)));
    }
    return out;
  }

  TopicLookup topic(String roomId) {
    URI uri = api("/rooms/" + encode(roomId) + "/state/m.room.topic");
    HttpLite.Response<String> r;
    try {
      r = http.get(uri, accessToken);
    } catch (IOException e) {
      return new TopicLookup.Failed(e.toString());
    }
    if (r.statusCode() == 404) return new TopicLookup.Absent();
    if (!r.isSuccess()) return new TopicLookup.Failed(r.statusCode() + " " + r.statusText());
    try {
      String topic = text(JSON.readTree(r.body()).get("topic"), null);
      return topic == null ? new TopicLookup.Absent() : new TopicLookup.Present(topic);
    } catch (IOException e) {
      return new TopicLookup.Failed("Unparseable topic: " + e.getMessage());
    }
  }

  private MatrixRoomView roomViewFromSync(String roomId, JsonNode room) {
    JsonNode timeline = room.path("timeline");
    List<RawEvent> resident = events(timeline.path("events"), true);
    String prevBatch = text(timeline.get("prev_batch"), null);
    String name = displayName(roomId, room);
    return new MatrixRoomView(this, roomId, name, resident, prevBatch);
  }

  static String displayName(String roomId, JsonNode room) {
    String name = null;
    String alias = null;
    List<JsonNode> stateEvents = new ArrayList<>();
    room.path("state").path("events").forEach(stateEvents::add);
    room.path("timeline").path("events").forEach(stateEvents::add);
    for (JsonNode ev : stateEvents) {
      String type = ev.path("type").asText("");
      if ("m.room.name".equals(type)) {
        String n = text(ev.path("content").get("name"), null);
        if (n != null) name = n;
      } else if ("m.room.canonical_alias".equals(type)) {
        String a = text(ev.path("content").get("alias"), null);
        if (a != null) alias = a;
      }
    }
    if (name != null) return name;
    if (alias != null) return alias;
    return roomId;
  }

  /** Parse an event array; {@code chronological} arrays are flipped to newest-first. */
  static List<RawEvent> events(JsonNode array, boolean chronological) {
    List<RawEvent> out = new ArrayList<>();
    if (array == null || !array.isArray()) return out;
    for (JsonNode node : array) {
      RawEvent e = RawEvent.fromJson(node);
      if (e != null) out.add(e);
    }
    if (chronological) Collections.reverse(out);
    return out;
  }

  private JsonNode getJson(URI uri, String what) {
    HttpLite.Response<String> r;
    try {
      r = http.get(uri, accessToken);
    } catch (IOException e) {
      throw new EventSourceException("Request for " + what + " failed: " + e.getMessage(), e);
    }
    return parse(r, what);
  }

  private JsonNode postJson(URI uri, String token, String body, String what) {
    HttpLite.Response<String> r;
    try {
      r = http.post(uri, token, body);
    } catch (IOException e) {
      throw new EventSourceException("Request for " + what + " failed: " + e.getMessage(), e);
    }
    return parse(r, what);
  }

  private static JsonNode parse(HttpLite.Response<String> r, String what) {
    JsonNode root;
    try {
      String body = r.body();
      root = body == null || body.isBlank() ? JSON.createObjectNode() : JSON.readTree(body);
    } catch (IOException e) {
      throw new EventSourceException(
          "Unparseable response for " + what + " (HTTP " + r.statusCode() + ")",
          r.statusCode(),
          e);
    }
    if (!r.isSuccess()) {
      String err = root.path("errcode").asText("");
      String msg = root.path("error").asText("");
      throw new EventSourceException(
          "Request for "
              + what
              + " failed: HTTP "
              + r.statusCode()
              + (err.isEmpty() ? "" : " " + err)
              + (msg.isEmpty() ? "" : " (" + msg + ")"),
          r.statusCode(),
          null);
    }
    return root;
  }

  private URI api(String pathAndQuery) {
    return URI.create(cfg.homeserver() + CLIENT_API + pathAndQuery);
  }

  private static String encode(String s) {
    return URLEncoder.encode(Objects.toString(s, ""), StandardCharsets.UTF_8).replace("+", "%20");
  }

  private static String text(JsonNode node, String fallback) {
    if (node == null || node.isNull() || node.isMissingNode()) return fallback;
    String s = node.asText("");
    return s.isBlank() ? fallback : s;
  }
}
