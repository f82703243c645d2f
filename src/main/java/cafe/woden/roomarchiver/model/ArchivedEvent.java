package cafe.woden.roomarchiver.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable archived event.
 *
 * <p>{@code contentJson} is the structured payload; {@code rawJson} is the complete record as
 * delivered by the source.
 */
public record ArchivedEvent(
    String eventId,
    String roomId,
    String sender,
    String type,
    String contentJson,
    Instant originServerTs,
    String rawJson,
    Instant retrievalTs) {
  public ArchivedEvent {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(roomId, "roomId");
    sender = Objects.toString(sender, "");
    type = Objects.toString(type, "");
    contentJson = Objects.toString(contentJson, "{}");
    Objects.requireNonNull(originServerTs, "originServerTs");
    rawJson = Objects.toString(rawJson, "{}");
    Objects.requireNonNull(retrievalTs, "retrievalTs");
  }
}
