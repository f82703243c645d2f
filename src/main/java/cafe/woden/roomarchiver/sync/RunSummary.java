package cafe.woden.roomarchiver.sync;

import java.util.List;

/**
 * Outcome of one archiving run.
 *
 * @param devicesArchived devices newly written this run
 * @param devicesError why the device list could not be archived, or {@code null}
 * @param listingError why the room listing failed, or {@code null}
 * @param rooms per-room results in processing order
 */
public record RunSummary(
    int devicesArchived, String devicesError, String listingError, List<RoomSyncResult> rooms) {
  public RunSummary {
    rooms = rooms == null ? List.of() : List.copyOf(rooms);
  }

  public boolean hasFailures() {
    return listingError != null
        || rooms.stream().anyMatch(r -> r.status() == RoomSyncResult.Status.FAILED);
  }

  public int totalNewEvents() {
    return rooms.stream().mapToInt(RoomSyncResult::newEvents).sum();
  }
}
