package cafe.woden.roomarchiver.sync;

import static cafe.woden.roomarchiver.sync.CursorPaginatorTest.ids;
import static cafe.woden.roomarchiver.sync.FakeEventSource.history;
import static cafe.woden.roomarchiver.sync.FakeEventSource.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.roomarchiver.source.RawEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FrontierDetectorTest {

  private final FrontierDetector detector = new FrontierDetector();

  @Test
  void persistsOnlyEventsNewerThanTheArchive() {
    FakeEventSource source = new FakeEventSource();
    source.room("!r:x", "Room").withHistory(history("$e", 1, 10));
    Set<String> known = Set.of("$e5", "$e4", "$e3", "$e2", "$e1");

    List<RawEvent> persisted = new ArrayList<>();
    FrontierScan scan =
        detector.scan(open(source, 5), known, (fresh, i) -> persisted.addAll(fresh));

    assertEquals(List.of("$e10", "$e9", "$e8", "$e7", "$e6"), ids(persisted));
    assertTrue(scan.reachedFrontier());
    assertEquals(2, scan.batches());
    assertEquals(5, scan.fresh());
    assertEquals(5, scan.known());
  }

  @Test
  void boundaryBatchKeepsEveryUnknownEvent() {
    FakeEventSource source = new FakeEventSource();
    // A late-arriving event older than a known one still lands in the boundary batch.
    source
        .room("!r:x", "Room")
        .withHistory(List.of(text("$new1", 30), text("$known", 20), text("$new2", 10)));

    List<List<String>> sunk = new ArrayList<>();
    FrontierScan scan =
        detector.scan(open(source, 3), Set.of("$known"), (fresh, i) -> sunk.add(ids(fresh)));

    assertEquals(List.of(List.of("$new1", "$new2")), sunk);
    assertTrue(scan.reachedFrontier());
    assertEquals(1, scan.batches());
  }

  @Test
  void emptyArchiveWalksEntireHistory() {
    FakeEventSource source = new FakeEventSource();
    source.room("!r:x", "Room").withHistory(history("$e", 1, 7));

    List<Integer> batchIndexes = new ArrayList<>();
    List<RawEvent> persisted = new ArrayList<>();
    FrontierScan scan =
        detector.scan(
            open(source, 3),
            Set.of(),
            (fresh, i) -> {
              batchIndexes.add(i);
              persisted.addAll(fresh);
            });

    assertEquals(7, persisted.size());
    assertEquals(List.of(0, 1, 2), batchIndexes);
    assertFalse(scan.reachedFrontier());
  }

  @Test
  void stopsPagingAfterTerminalBatch() {
    FakeEventSource source = new FakeEventSource();
    source.room("!r:x", "Room").withHistory(history("$e", 1, 20));

    detector.scan(open(source, 2), Set.of("$e19"), (fresh, i) -> {});

    assertEquals(1, source.pageRequests("!r:x"));
  }

  @Test
  void fullyKnownBatchInvokesNoSink() {
    FakeEventSource source = new FakeEventSource();
    source.room("!r:x", "Room").withHistory(history("$e", 1, 4));

    List<RawEvent> persisted = new ArrayList<>();
    FrontierScan scan =
        detector.scan(
            open(source, 4),
            Set.of("$e1", "$e2", "$e3", "$e4"),
            (fresh, i) -> persisted.addAll(fresh));

    assertTrue(persisted.isEmpty());
    assertTrue(scan.reachedFrontier());
    assertEquals(0, scan.fresh());
  }

  private static EventStream open(FakeEventSource source, int batchSize) {
    return new CursorPaginator(source, batchSize).open(source.rooms.get("!r:x"));
  }
}
