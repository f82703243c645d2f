package cafe.woden.roomarchiver.model;

import java.time.Instant;
import java.util.Objects;

/** Joined member of a room, unique per (room, user). */
public record ArchivedMember(
    String roomId, String userId, String displayName, String avatarUrl, Instant retrievalTs) {
  public ArchivedMember {
    Objects.requireNonNull(roomId, "roomId");
    Objects.requireNonNull(userId, "userId");
    displayName = Objects.toString(displayName, userId);
    if (avatarUrl != null && avatarUrl.isBlank()) avatarUrl = null;
    Objects.requireNonNull(retrievalTs, "retrievalTs");
  }
}
