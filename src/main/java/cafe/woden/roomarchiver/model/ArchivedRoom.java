package cafe.woden.roomarchiver.model;

import java.time.Instant;
import java.util.Objects;

/** Write-once room metadata row. {@code topic} is null when absent or not retrievable. */
public record ArchivedRoom(String roomId, String displayName, String topic, Instant retrievalTs) {
  public ArchivedRoom {
    roomId = Objects.requireNonNull(roomId, "roomId").trim();
    if (roomId.isEmpty()) throw new IllegalArgumentException("roomId is blank");
    displayName = Objects.toString(displayName, roomId);
    Objects.requireNonNull(retrievalTs, "retrievalTs");
  }
}
