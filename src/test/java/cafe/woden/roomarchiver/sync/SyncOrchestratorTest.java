package cafe.woden.roomarchiver.sync;

import static cafe.woden.roomarchiver.sync.FakeEventSource.file;
import static cafe.woden.roomarchiver.sync.FakeEventSource.history;
import static cafe.woden.roomarchiver.sync.FakeEventSource.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.roomarchiver.config.ArchiverProperties;
import cafe.woden.roomarchiver.source.EventSourceException;
import cafe.woden.roomarchiver.source.SourceDevice;
import cafe.woden.roomarchiver.source.TopicLookup;
import cafe.woden.roomarchiver.store.ArchiveDbFixture;
import cafe.woden.roomarchiver.store.ArchiveRepository.ArchiveCounts;
import cafe.woden.roomarchiver.util.NamedThreads;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SyncOrchestratorTest {

  private static final String LOBBY = "!lobby:example.org";
  private static final String DEV = "!dev:example.org";

  private static final Clock CLOCK =
      Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

  @TempDir Path tempDir;

  @Test
  void secondRunWithoutNewTrafficWritesNothing() {
    FakeEventSource source = new FakeEventSource();
    source.devices.add(new SourceDevice("@me:x", "LAPTOP", "Laptop", 1_699_000_000_000L, "10.0.0.2"));
    FakeEventSource.Room lobby =
        source
            .room(LOBBY, "Lobby")
            .withMember("@alice:example.org", "Alice")
            .withMember("@bob:example.org", null)
            .withHistory(history("$e", 1, 12));
    lobby.topic = new TopicLookup.Present("Welcome");
    lobby.prepend(file("$f1", 1_577_836_900_000L, "m.file", "mxc://x/doc", "doc.pdf", 3));
    source.serve("mxc://x/doc", new byte[] {1, 2, 3});

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("idempotent"))) {
      SyncOrchestrator orchestrator = orchestrator(source, db, props(List.of(LOBBY), List.of(), 5));

      RunSummary first = orchestrator.runOnce();
      ArchiveCounts afterFirst = db.repo().counts();

      assertFalse(first.hasFailures());
      assertEquals(1, first.devicesArchived());
      RoomSyncResult lobbyFirst = first.rooms().get(0);
      assertEquals(RoomSyncResult.Status.ARCHIVED, lobbyFirst.status());
      assertEquals(13, lobbyFirst.newEvents());
      assertEquals(2, lobbyFirst.newMembers());
      assertEquals(1, lobbyFirst.attachmentsCached());
      assertFalse(lobbyFirst.reachedFrontier());
      assertEquals(new ArchiveCounts(1, 2, 1, 13, 1), afterFirst);
      assertEquals("Welcome", db.repo().findRoom(LOBBY).orElseThrow().topic());

      RunSummary second = orchestrator.runOnce();

      assertEquals(afterFirst, db.repo().counts());
      assertEquals(0, second.devicesArchived());
      RoomSyncResult lobbySecond = second.rooms().get(0);
      assertEquals(0, lobbySecond.newEvents());
      assertEquals(0, lobbySecond.newMembers());
      assertTrue(lobbySecond.reachedFrontier());
      assertEquals(1, source.downloadCalls.get());
    }
  }

  @Test
  void laterRunArchivesOnlyNewEvents() {
    FakeEventSource source = new FakeEventSource();
    FakeEventSource.Room lobby = source.room(LOBBY, "Lobby").withHistory(history("$e", 1, 20));

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("incremental"))) {
      SyncOrchestrator orchestrator = orchestrator(source, db, props(List.of(LOBBY), List.of(), 4));
      orchestrator.runOnce();
      int pagesAfterFirst = source.pageRequests(LOBBY);

      lobby.prepend(text("$e21", 1_577_836_800_000L + 21_000L));
      lobby.prepend(text("$e22", 1_577_836_800_000L + 22_000L));
      RunSummary second = orchestrator.runOnce();

      RoomSyncResult r = second.rooms().get(0);
      assertEquals(2, r.newEvents());
      assertEquals(1, r.batches());
      assertTrue(r.reachedFrontier());
      assertEquals(1, source.pageRequests(LOBBY) - pagesAfterFirst);
      assertEquals(22L, db.repo().countEvents(LOBBY));
      assertEquals(List.of("$e22", "$e21"), db.repo().recentEventIds(LOBBY, 2));
    }
  }

  @Test
  void excludedRoomIsNeverArchived() {
    FakeEventSource source = new FakeEventSource();
    source.room(LOBBY, "Lobby").withHistory(history("$l", 1, 3));
    source.room(DEV, "Dev").withHistory(history("$d", 1, 3));

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("excluded"))) {
      RunSummary summary =
          orchestrator(source, db, props(List.of(LOBBY, DEV), List.of(DEV), 10)).runOnce();

      assertEquals(RoomSyncResult.Status.ARCHIVED, summary.rooms().get(0).status());
      assertEquals(RoomSyncResult.Status.EXCLUDED, summary.rooms().get(1).status());
      assertTrue(db.repo().findRoom(DEV).isEmpty());
      assertEquals(0L, db.repo().countEvents(DEV));
      assertEquals(0, source.pageRequests(DEV));
      assertFalse(summary.hasFailures());
    }
  }

  @Test
  void allJoinedRoomsAreArchivedWhenNoneConfigured() {
    FakeEventSource source = new FakeEventSource();
    source.room(LOBBY, "Lobby").withHistory(history("$l", 1, 2));
    source.room(DEV, "Dev").withHistory(history("$d", 1, 3));

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("all"))) {
      RunSummary summary = orchestrator(source, db, props(List.of(), List.of(), 10)).runOnce();

      assertEquals(2, summary.rooms().size());
      assertEquals(5, summary.totalNewEvents());
      assertEquals(2L, db.repo().counts().rooms());
    }
  }

  @Test
  void topicLookupFailureStillArchivesRoom() {
    FakeEventSource source = new FakeEventSource();
    FakeEventSource.Room lobby = source.room(LOBBY, "Lobby").withHistory(history("$e", 1, 2));
    lobby.topicFailure = new EventSourceException("forbidden", 403, null);

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("topic"))) {
      RunSummary summary = orchestrator(source, db, props(List.of(LOBBY), List.of(), 10)).runOnce();

      assertEquals(RoomSyncResult.Status.ARCHIVED, summary.rooms().get(0).status());
      assertNull(db.repo().findRoom(LOBBY).orElseThrow().topic());
      assertEquals(2L, db.repo().countEvents(LOBBY));
    }
  }

  @Test
  void paginationFailureKeepsCommittedBatchesAndOtherRooms() {
    FakeEventSource source = new FakeEventSource();
    FakeEventSource.Room lobby = source.room(LOBBY, "Lobby").withHistory(history("$l", 1, 10));
    lobby.failAtOffset = 4;
    source.room(DEV, "Dev").withHistory(history("$d", 1, 3));

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("isolation"))) {
      RunSummary summary =
          orchestrator(source, db, props(List.of(LOBBY, DEV), List.of(), 2)).runOnce();

      RoomSyncResult failed = summary.rooms().get(0);
      assertEquals(RoomSyncResult.Status.FAILED, failed.status());
      assertEquals(4, failed.newEvents());
      assertNotNull(failed.message());
      assertEquals(4L, db.repo().countEvents(LOBBY));

      assertEquals(RoomSyncResult.Status.ARCHIVED, summary.rooms().get(1).status());
      assertEquals(3L, db.repo().countEvents(DEV));
      assertTrue(summary.hasFailures());
    }
  }

  @Test
  void configuredRoomThatIsNotJoinedFails() {
    FakeEventSource source = new FakeEventSource();
    source.room(LOBBY, "Lobby");

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("notjoined"))) {
      RunSummary summary =
          orchestrator(source, db, props(List.of("!gone:example.org", LOBBY), List.of(), 10))
              .runOnce();

      RoomSyncResult gone = summary.rooms().get(0);
      assertEquals(RoomSyncResult.Status.FAILED, gone.status());
      assertEquals("Room is not joined", gone.message());
      assertEquals(RoomSyncResult.Status.ARCHIVED, summary.rooms().get(1).status());
    }
  }

  @Test
  void listingFailureFailsConfiguredRoomsButKeepsDevices() {
    FakeEventSource source = new FakeEventSource();
    source.devices.add(new SourceDevice("@me:x", "PHONE", null, null, null));
    source.listingFailure = new EventSourceException("sync failed", 500, null);

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("listing"))) {
      RunSummary summary =
          orchestrator(source, db, props(List.of(LOBBY, DEV), List.of(DEV), 10)).runOnce();

      assertNotNull(summary.listingError());
      assertEquals(RoomSyncResult.Status.FAILED, summary.rooms().get(0).status());
      assertEquals(RoomSyncResult.Status.EXCLUDED, summary.rooms().get(1).status());
      assertEquals(1L, db.repo().counts().devices());
      assertTrue(summary.hasFailures());
    }
  }

  @Test
  void pendingAttachmentIsRetriedOnNextRun() {
    FakeEventSource source = new FakeEventSource();
    source
        .room(LOBBY, "Lobby")
        .withHistory(List.of(file("$img", 1_000L, "m.image", "mxc://x/pic", "pic.png", 2)));
    source.failDownload("mxc://x/pic", new IOException("timeout"));

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("pending"))) {
      SyncOrchestrator orchestrator = orchestrator(source, db, props(List.of(LOBBY), List.of(), 10));

      RoomSyncResult first = orchestrator.runOnce().rooms().get(0);
      assertEquals(1, first.attachmentsFailed());
      // Failed once during the event pass; the retry pass skips refs already tried this run.
      assertEquals(1, source.downloadCalls.get());

      source.serve("mxc://x/pic", new byte[] {7, 7});
      RoomSyncResult second = orchestrator.runOnce().rooms().get(0);

      assertEquals(0, second.newEvents());
      assertEquals(1, second.attachmentsCached());
      assertTrue(db.repo().findAttachment("mxc://x/pic").orElseThrow().cached());
    }
  }

  @Test
  void roomsRunConcurrentlyWhenParallelismAllows() {
    FakeEventSource source = new FakeEventSource();
    source.room(LOBBY, "Lobby").withHistory(history("$l", 1, 6));
    source.room(DEV, "Dev").withHistory(history("$d", 1, 4));
    ArchiverProperties props =
        new ArchiverProperties(
            List.of(LOBBY, DEV), List.of(), null, 3, null, 2, null, null, null, null);
    ExecutorService pool = NamedThreads.newFixedThreadPool(2, "test-room-sync");

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("parallel"))) {
      RunSummary summary = orchestrator(source, db, props, pool).runOnce();

      assertEquals(LOBBY, summary.rooms().get(0).roomId());
      assertEquals(DEV, summary.rooms().get(1).roomId());
      assertEquals(10, summary.totalNewEvents());
      assertEquals(10L, db.repo().counts().events());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void overlongAttachmentNameDoesNotCutHistoryShort() {
    FakeEventSource source = new FakeEventSource();
    String longName = "a".repeat(5000);
    FakeEventSource.Room lobby = source.room(LOBBY, "Lobby").withHistory(history("$e", 1, 10));
    lobby.history.add(4, file("$doc", 1_577_836_806_500L, "m.file", "mxc://x/doc", longName, 2));
    source.serve("mxc://x/doc", new byte[] {4, 2});

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("long-name"))) {
      SyncOrchestrator orchestrator = orchestrator(source, db, props(List.of(LOBBY), List.of(), 3));

      RoomSyncResult r = orchestrator.runOnce().rooms().get(0);

      assertEquals(RoomSyncResult.Status.ARCHIVED, r.status());
      assertEquals(11, r.newEvents());
      assertEquals(11L, db.repo().countEvents(LOBBY));
      assertEquals(longName, db.repo().findAttachment("mxc://x/doc").orElseThrow().filename());
    }
  }

  @Test
  void attachmentStoreFailureLeavesRoomArchived() {
    FakeEventSource source = new FakeEventSource();
    String hugeRef = "mxc://x/" + "m".repeat(3000);
    FakeEventSource.Room lobby = source.room(LOBBY, "Lobby").withHistory(history("$e", 1, 10));
    lobby.history.add(2, file("$big", 1_577_836_808_500L, "m.file", hugeRef, "big.bin", 1));
    source.serve(hugeRef, new byte[] {1});

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("store-failure"))) {
      SyncOrchestrator orchestrator = orchestrator(source, db, props(List.of(LOBBY), List.of(), 3));

      RoomSyncResult r = orchestrator.runOnce().rooms().get(0);

      assertEquals(RoomSyncResult.Status.ARCHIVED, r.status());
      assertEquals(11L, db.repo().countEvents(LOBBY));
      assertEquals(1, r.attachmentsFailed());
      assertEquals(0L, db.repo().counts().attachments());
    }
  }

  @Test
  void overlongRoomAndMemberNamesAreStored() {
    FakeEventSource source = new FakeEventSource();
    String roomName = "n".repeat(5000);
    String memberName = "m".repeat(5000);
    source
        .room(LOBBY, roomName)
        .withMember("@alice:example.org", memberName)
        .withHistory(history("$e", 1, 3));

    try (ArchiveDbFixture db = ArchiveDbFixture.open(tempDir.resolve("long-room-name"))) {
      RunSummary summary = orchestrator(source, db, props(List.of(LOBBY), List.of(), 10)).runOnce();

      assertEquals(RoomSyncResult.Status.ARCHIVED, summary.rooms().get(0).status());
      assertEquals(roomName, db.repo().findRoom(LOBBY).orElseThrow().displayName());
      assertEquals(3L, db.repo().countEvents(LOBBY));
      assertEquals(
          memberName,
          db.jdbc()
              .queryForObject(
                  "SELECT display_name FROM archive_member WHERE user_id = ?",
                  String.class,
                  "@alice:example.org"));
    }
  }

  private static ArchiverProperties props(List<String> rooms, List<String> excluded, int batch) {
    return new ArchiverProperties(rooms, excluded, null, batch, null, null, null, null, null, null);
  }

  private static SyncOrchestrator orchestrator(
      FakeEventSource source, ArchiveDbFixture db, ArchiverProperties props) {
    return orchestrator(source, db, props, null);
  }

  private static SyncOrchestrator orchestrator(
      FakeEventSource source,
      ArchiveDbFixture db,
      ArchiverProperties props,
      ExecutorService pool) {
    return new SyncOrchestrator(
        source,
        db.repo(),
        db.tx(),
        props,
        new CursorPaginator(source, props.batchSize()),
        new FrontierDetector(),
        new AttachmentFetcher(source, db.repo(), db.tx(), props.maxAttachmentBytes(), CLOCK),
        CLOCK,
        pool);
  }
}
