package cafe.woden.roomarchiver.sync;

import cafe.woden.roomarchiver.config.ArchiverProperties;
import cafe.woden.roomarchiver.config.ExecutorConfig;
import cafe.woden.roomarchiver.model.ArchivedAttachment;
import cafe.woden.roomarchiver.model.ArchivedDevice;
import cafe.woden.roomarchiver.model.ArchivedEvent;
import cafe.woden.roomarchiver.model.ArchivedMember;
import cafe.woden.roomarchiver.model.ArchivedRoom;
import cafe.woden.roomarchiver.model.Timestamps;
import cafe.woden.roomarchiver.model.UpsertResult;
import cafe.woden.roomarchiver.source.EventSource;
import cafe.woden.roomarchiver.source.RawEvent;
import cafe.woden.roomarchiver.source.RoomView;
import cafe.woden.roomarchiver.source.SourceDevice;
import cafe.woden.roomarchiver.source.SourceMember;
import cafe.woden.roomarchiver.source.TopicLookup;
import cafe.woden.roomarchiver.store.ArchiveRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Drives one archiving run: the device list once, then each target room through metadata,
 * members and the event stream.
 *
 * <p>Failures are isolated per room. Whatever a room committed before failing stays committed.
 */
@Component
public class SyncOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

  private static final int PENDING_RETRY_LIMIT = 1000;

  private final EventSource source;
  private final ArchiveRepository repo;
  private final TransactionTemplate tx;
  private final ArchiverProperties props;
  private final CursorPaginator paginator;
  private final FrontierDetector detector;
  private final AttachmentFetcher attachments;
  private final Clock clock;
  private final ExecutorService roomExecutor;

  public SyncOrchestrator(
      EventSource source,
      ArchiveRepository repo,
      @Qualifier("archiveTx") TransactionTemplate tx,
      ArchiverProperties props,
      CursorPaginator paginator,
      FrontierDetector detector,
      AttachmentFetcher attachments,
      Clock clock,
      @Qualifier(ExecutorConfig.ROOM_SYNC_EXECUTOR) ExecutorService roomExecutor) {
    this.source = Objects.requireNonNull(source, "source");
    this.repo = Objects.requireNonNull(repo, "repo");
    this.tx = Objects.requireNonNull(tx, "tx");
    this.props = Objects.requireNonNull(props, "props");
    this.paginator = Objects.requireNonNull(paginator, "paginator");
    this.detector = Objects.requireNonNull(detector, "detector");
    this.attachments = Objects.requireNonNull(attachments, "attachments");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.roomExecutor = roomExecutor;
  }

  public RunSummary runOnce() {
    int devices = 0;
    String devicesError = null;
    try {
      devices = archiveDevices();
    } catch (RuntimeException e) {
      devicesError = describe(e);
      log.warn("[archiver] Device list archival failed; continuing with rooms", e);
    }

    Map<String, RoomView> joined;
    try {
      joined = source.listRooms();
    } catch (RuntimeException e) {
      log.error("[archiver] Room listing failed", e);
      String why = "Room listing failed: " + describe(e);
      List<RoomSyncResult> failed = new ArrayList<>();
      for (String roomId : props.rooms()) {
        failed.add(
            props.excludedRoomSet().contains(roomId)
                ? RoomSyncResult.excluded(roomId, roomId)
                : RoomSyncResult.failed(roomId, roomId, 0, why));
      }
      return new RunSummary(devices, devicesError, why, failed);
    }
    if (joined == null) joined = Map.of();

    List<String> targets =
        props.rooms().isEmpty() ? new ArrayList<>(joined.keySet()) : props.rooms();
    List<RoomSyncResult> results = syncRooms(targets, joined);

    log.info("[archiver] Done with archiving run.");
    for (RoomSyncResult r : results) {
      log.info(
          "[archiver]  {} '{}' ({}): {} new events",
          r.status(),
          r.displayName(),
          r.roomId(),
          r.newEvents());
    }
    return new RunSummary(devices, devicesError, null, results);
  }

  /** Archive the account's devices. Returns the number of newly written rows. */
  public int archiveDevices() {
    log.info("[archiver] Archiving device list for user.");
    List<SourceDevice> devices = source.getDevices();
    if (devices == null || devices.isEmpty()) return 0;
    Instant now = clock.instant();
    Integer inserted =
        tx.execute(
            status -> {
              int n = 0;
              for (SourceDevice d : devices) {
                if (d == null || isBlank(d.userId()) || isBlank(d.deviceId())) {
                  log.warn("[archiver] Ignoring device without user/device id: {}", d);
                  continue;
                }
                ArchivedDevice row =
                    new ArchivedDevice(
                        d.userId(),
                        d.deviceId(),
                        d.displayName(),
                        Timestamps.fromEpochMillis(d.lastSeenTsMillis()),
                        d.lastSeenIp(),
                        now);
                if (repo.upsertDevice(row) == UpsertResult.INSERTED) n++;
              }
              return n;
            });
    return inserted == null ? 0 : inserted;
  }

  /** Archive one room. Never throws; failures are reported in the result. */
  public RoomSyncResult syncRoom(RoomView room) {
    Objects.requireNonNull(room, "room");
    String roomId = room.roomId();
    String name = safeDisplayName(room);
    Tally tally = new Tally();
    try {
      return syncRoomNow(room, roomId, name, tally);
    } catch (RuntimeException e) {
      log.error(
          "[archiver] Archiving room '{}' ({}) failed after {} new events; moving on",
          name,
          roomId,
          tally.newEvents,
          e);
      return RoomSyncResult.failed(roomId, name, tally.newEvents, describe(e));
    }
  }

  private List<RoomSyncResult> syncRooms(List<String> targets, Map<String, RoomView> joined) {
    Set<String> excluded = props.excludedRoomSet();
    boolean parallel = props.roomParallelism() > 1 && roomExecutor != null;

    // Insertion order keeps results in target order when rooms run concurrently.
    Map<String, Object> slots = new LinkedHashMap<>();
    for (String roomId : targets) {
      RoomView view = joined.get(roomId);
      String name = view == null ? roomId : safeDisplayName(view);
      if (excluded.contains(roomId)) {
        log.info(
            "[archiver] Skipping Room: '{}' (Room ID: {}) because it is on the EXCLUDED list.",
            name,
            roomId);
        slots.put(roomId, RoomSyncResult.excluded(roomId, name));
      } else if (view == null) {
        log.error("[archiver] Room {} is not among the joined rooms; skipping", roomId);
        slots.put(roomId, RoomSyncResult.failed(roomId, roomId, 0, "Room is not joined"));
      } else if (parallel) {
        slots.put(roomId, roomExecutor.submit(() -> syncRoom(view)));
      } else {
        slots.put(roomId, syncRoom(view));
      }
    }

    List<RoomSyncResult> results = new ArrayList<>(slots.size());
    for (Map.Entry<String, Object> e : slots.entrySet()) {
      results.add(await(e.getKey(), e.getValue()));
    }
    return results;
  }

  private RoomSyncResult syncRoomNow(RoomView room, String roomId, String name, Tally tally) {
    log.info("[archiver] Archiving Room: '{}' (Room ID: '{}')", name, roomId);

    log.info("[archiver]  | Backing up room metadata...");
    TopicLookup topic = lookupTopic(room);
    if (topic instanceof TopicLookup.Failed f) {
      log.debug("[archiver] topic lookup failed for {}: {}", roomId, f.reason());
    }
    ArchivedRoom meta = new ArchivedRoom(roomId, name, topic.valueOrNull(), clock.instant());
    tx.execute(status -> repo.upsertRoom(meta));

    log.info("[archiver]  | Backing up list of room members...");
    tally.newMembers = archiveMembers(roomId, room.joinedMembers());

    log.info("[archiver]  | Backing up list of room events...");
    Set<String> known =
        new HashSet<>(repo.recentEventIds(roomId, props.knownRecentWindow()));
    Set<String> attempted = new HashSet<>();
    EventStream stream = paginator.open(room);
    FrontierScan scan =
        detector.scan(
            stream,
            known,
            (fresh, batchIndex) -> persistBatch(roomId, fresh, tally, attempted));

    if (props.fetchAttachments() && props.retryPendingAttachments()) {
      retryPending(roomId, tally, attempted);
    }

    log.info(
        "[archiver] Archived {} new events for room '{}' ({} batches{})",
        tally.newEvents,
        name,
        scan.batches(),
        scan.reachedFrontier() ? ", caught up with archive" : "");
    return new RoomSyncResult(
        roomId,
        name,
        RoomSyncResult.Status.ARCHIVED,
        tally.newEvents,
        tally.newMembers,
        scan.batches(),
        scan.reachedFrontier(),
        tally.attachmentsCached,
        tally.attachmentsFailed,
        null);
  }

  private int archiveMembers(String roomId, List<SourceMember> members) {
    if (members == null || members.isEmpty()) return 0;
    Instant now = clock.instant();
    Integer inserted =
        tx.execute(
            status -> {
              int n = 0;
              for (SourceMember m : members) {
                if (m == null || isBlank(m.userId())) continue;
                ArchivedMember row =
                    new ArchivedMember(roomId, m.userId(), m.displayName(), m.avatarUrl(), now);
                if (repo.upsertMember(row) == UpsertResult.INSERTED) n++;
              }
              return n;
            });
    return inserted == null ? 0 : inserted;
  }

  private void persistBatch(
      String roomId, List<RawEvent> fresh, Tally tally, Set<String> attempted) {
    Instant now = clock.instant();
    Integer inserted =
        tx.execute(
            status -> {
              int n = 0;
              for (RawEvent e : fresh) {
                if (repo.upsertEvent(toArchived(roomId, e, now)) == UpsertResult.INSERTED) n++;
              }
              return n;
            });
    tally.newEvents += inserted == null ? 0 : inserted;

    if (!props.fetchAttachments()) return;
    for (RawEvent e : fresh) {
      AttachmentOutcome outcome = attachments.maybeFetch(roomId, e);
      tally.record(outcome);
      AttachmentRef.from(e).ifPresent(ref -> attempted.add(ref.contentRef()));
    }
  }

  private void retryPending(String roomId, Tally tally, Set<String> attempted) {
    List<ArchivedAttachment> pending = repo.pendingAttachments(roomId, PENDING_RETRY_LIMIT);
    int retried = 0;
    for (ArchivedAttachment a : pending) {
      if (attempted.contains(a.fetchUrlMatrix())) continue;
      tally.record(attachments.retry(a));
      retried++;
    }
    if (retried > 0) {
      log.info("[archiver] Retried {} pending attachments for {}", retried, roomId);
    }
  }

  static ArchivedEvent toArchived(String roomId, RawEvent e, Instant retrievedAt) {
    return new ArchivedEvent(
        e.eventId(),
        roomId,
        e.sender(),
        e.type(),
        e.content().toString(),
        Timestamps.fromEpochMillis(e.originServerTsMillis()),
        e.raw().toString(),
        retrievedAt);
  }

  private static TopicLookup lookupTopic(RoomView room) {
    try {
      TopicLookup topic = room.topic();
      return topic == null ? new TopicLookup.Absent() : topic;
    } catch (RuntimeException e) {
      return new TopicLookup.Failed(describe(e));
    }
  }

  private static RoomSyncResult await(String roomId, Object slot) {
    if (slot instanceof RoomSyncResult r) return r;
    Future<?> future = (Future<?>) slot;
    try {
      return (RoomSyncResult) future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return RoomSyncResult.failed(roomId, roomId, 0, "Interrupted");
    } catch (ExecutionException e) {
      return RoomSyncResult.failed(roomId, roomId, 0, describe(e.getCause()));
    }
  }

  private static String safeDisplayName(RoomView room) {
    try {
      String n = room.displayName();
      return isBlank(n) ? room.roomId() : n;
    } catch (RuntimeException e) {
      return room.roomId();
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  private static String describe(Throwable e) {
    if (e == null) return "unknown error";
    String msg = e.getMessage();
    return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : msg;
  }

  private static final class Tally {
    int newEvents;
    int newMembers;
    int attachmentsCached;
    int attachmentsFailed;

    void record(AttachmentOutcome outcome) {
      if (outcome instanceof AttachmentOutcome.Cached) {
        attachmentsCached++;
      } else if (outcome instanceof AttachmentOutcome.Failed
          || outcome instanceof AttachmentOutcome.Rejected) {
        attachmentsFailed++;
      }
    }
  }
}
