package cafe.woden.roomarchiver.sync;

import java.util.Objects;

/** Per-room counters reported at the end of a run. */
public record RoomSyncResult(
    String roomId,
    String displayName,
    Status status,
    int newEvents,
    int newMembers,
    int batches,
    boolean reachedFrontier,
    int attachmentsCached,
    int attachmentsFailed,
    String message) {

  public enum Status {
    ARCHIVED,
    EXCLUDED,
    FAILED
  }

  public RoomSyncResult {
    Objects.requireNonNull(roomId, "roomId");
    displayName = Objects.toString(displayName, roomId);
    Objects.requireNonNull(status, "status");
    if (newEvents < 0) newEvents = 0;
    if (newMembers < 0) newMembers = 0;
    if (batches < 0) batches = 0;
    if (attachmentsCached < 0) attachmentsCached = 0;
    if (attachmentsFailed < 0) attachmentsFailed = 0;
    if (message != null && message.isBlank()) message = null;
  }

  static RoomSyncResult excluded(String roomId, String displayName) {
    return new RoomSyncResult(
        roomId, displayName, Status.EXCLUDED, 0, 0, 0, false, 0, 0, "On the excluded list");
  }

  static RoomSyncResult failed(String roomId, String displayName, int newEvents, String message) {
    return new RoomSyncResult(
        roomId, displayName, Status.FAILED, newEvents, 0, 0, false, 0, 0, message);
  }
}
