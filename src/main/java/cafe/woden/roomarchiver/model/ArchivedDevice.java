package cafe.woden.roomarchiver.model;

import java.time.Instant;
import java.util.Objects;

/** Device of the archiving account, unique per (user, device). */
public record ArchivedDevice(
    String userId,
    String deviceId,
    String displayName,
    Instant lastSeenTs,
    String lastSeenIp,
    Instant retrievalTs) {
  public ArchivedDevice {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(deviceId, "deviceId");
    Objects.requireNonNull(retrievalTs, "retrievalTs");
  }
}
