package cafe.woden.roomarchiver.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Event exactly as delivered by the source.
 *
 * <p>{@code raw} is the full record; the remaining fields are extracted from it for convenience.
 */
public record RawEvent(
    String eventId,
    String sender,
    String type,
    JsonNode content,
    long originServerTsMillis,
    JsonNode raw) {
  public RawEvent {
    eventId = Objects.requireNonNull(eventId, "eventId");
    sender = Objects.toString(sender, "");
    type = Objects.toString(type, "");
    if (content == null || content.isNull() || content.isMissingNode()) {
      content = JsonNodeFactory.instance.objectNode();
    }
    if (raw == null || raw.isNull() || raw.isMissingNode()) {
      raw = JsonNodeFactory.instance.objectNode();
    }
  }

  /** Build from a source record; returns {@code null} when the record has no event id. */
  public static RawEvent fromJson(JsonNode node) {
    if (node == null || !node.isObject()) return null;
    String id = node.path("event_id").asText("");
    if (id.isBlank()) return null;
    return new RawEvent(
        id,
        node.path("sender").asText(""),
        node.path("type").asText(""),
        node.get("content"),
        node.path("origin_server_ts").asLong(0L),
        node);
  }

  /** Build an event and synthesize the matching raw record. */
  public static RawEvent of(
      String eventId, String sender, String type, JsonNode content, long originServerTsMillis) {
    ObjectNode raw = JsonNodeFactory.instance.objectNode();
    raw.put("event_id", eventId);
    raw.put("sender", sender);
    raw.put("type", type);
    if (content != null) raw.set("content", content);
    raw.put("origin_server_ts", originServerTsMillis);
    return new RawEvent(eventId, sender, type, content, originServerTsMillis, raw);
  }
}
