package cafe.woden.roomarchiver.sync;

import cafe.woden.roomarchiver.model.ArchivedAttachment;
import cafe.woden.roomarchiver.model.UpsertResult;
import cafe.woden.roomarchiver.source.ContentDownload;
import cafe.woden.roomarchiver.source.EventSource;
import cafe.woden.roomarchiver.source.RawEvent;
import cafe.woden.roomarchiver.store.ArchiveRepository;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Best-effort download and caching of file and image attachments.
 *
 * <p>Fetch failures never propagate: they are persisted as the row's {@code last_fetch_status}
 * and the row stays uncached, so the next run that meets the same content reference tries again.
 * Store failures do propagate.
 *
 * <p>Work on one content reference is serialized through striped locks, so concurrent room syncs
 * cannot lose an update to the same row.
 */
public class AttachmentFetcher {

  private static final Logger log = LoggerFactory.getLogger(AttachmentFetcher.class);

  // Largest array the JVM will reliably allocate; also below the 2G blob_data column.
  static final long MAX_BUFFERED_BYTES = Integer.MAX_VALUE - 8L;

  // Share of the max heap a single buffered download may take.
  private static final int HEAP_FRACTION = 4;

  private static final int LOCK_STRIPES = 64;

  private final EventSource source;
  private final ArchiveRepository repo;
  private final TransactionTemplate tx;
  private final long maxBytes;
  private final long bufferLimit;
  private final Clock clock;
  private final Object[] locks = new Object[LOCK_STRIPES];

  public AttachmentFetcher(
      EventSource source,
      ArchiveRepository repo,
      TransactionTemplate tx,
      long maxBytes,
      Clock clock) {
    this(source, repo, tx, maxBytes, defaultBufferLimit(), clock);
  }

  AttachmentFetcher(
      EventSource source,
      ArchiveRepository repo,
      TransactionTemplate tx,
      long maxBytes,
      long bufferLimit,
      Clock clock) {
    this.source = Objects.requireNonNull(source, "source");
    this.repo = Objects.requireNonNull(repo, "repo");
    this.tx = Objects.requireNonNull(tx, "tx");
    if (maxBytes <= 0) throw new IllegalArgumentException("maxBytes must be > 0");
    this.maxBytes = maxBytes;
    if (bufferLimit <= 0) throw new IllegalArgumentException("bufferLimit must be > 0");
    this.bufferLimit = Math.min(bufferLimit, MAX_BUFFERED_BYTES);
    this.clock = Objects.requireNonNull(clock, "clock");
    for (int i = 0; i < locks.length; i++) locks[i] = new Object();
  }

  /** Handle the attachment referenced by {@code event}, if it declares one. */
  public AttachmentOutcome maybeFetch(String roomId, RawEvent event) {
    Optional<AttachmentRef> declared = AttachmentRef.from(event);
    if (declared.isEmpty()) return new AttachmentOutcome.NotAttachment();
    return fetch(declared.get(), roomId, event.eventId());
  }

  /** Re-attempt an attachment row left uncached by an earlier run. */
  public AttachmentOutcome retry(ArchivedAttachment pending) {
    Objects.requireNonNull(pending, "pending");
    AttachmentRef ref =
        new AttachmentRef(
            pending.fetchUrlMatrix(),
            pending.filename(),
            pending.size(),
            pending.mimeType(),
            pending.image());
    return fetch(ref, pending.roomId(), pending.eventId());
  }

  /** In-memory cap for one download: the array limit or a quarter of the max heap. */
  static long defaultBufferLimit() {
    return Math.min(MAX_BUFFERED_BYTES, Runtime.getRuntime().maxMemory() / HEAP_FRACTION);
  }

  private AttachmentOutcome fetch(AttachmentRef ref, String roomId, String eventId) {
    synchronized (lockFor(ref.contentRef())) {
      URI httpUrl;
      try {
        httpUrl = source.resolveContentUrl(ref.contentRef());
      } catch (RuntimeException e) {
        // No resolvable URL means no row can be keyed; the next sighting tries again.
        log.warn("[archiver] cannot resolve content reference {}: {}", ref.contentRef(), e.toString());
        return new AttachmentOutcome.Failed(ref.contentRef(), "unresolvable: " + describe(e));
      }

      Optional<ArchivedAttachment> existing = repo.findAttachment(ref.contentRef());
      if (existing.isPresent() && existing.get().cached()) {
        log.debug("[archiver] attachment {} already cached", ref.contentRef());
        return new AttachmentOutcome.AlreadyCached(ref.contentRef());
      }

      log.info(
          "[archiver] Fetching attachment '{}' ({} bytes declared) from {}",
          ref.filename(),
          ref.declaredSize(),
          httpUrl);
      Attempt attempt = download(ref.contentRef(), httpUrl);
      Instant now = clock.instant();

      ArchivedAttachment row =
          new ArchivedAttachment(
              ref.contentRef(),
              httpUrl.toString(),
              ref.filename(),
              ref.declaredSize(),
              ref.mimeType(),
              ref.image(),
              attempt.data() != null,
              attempt.data(),
              status(attempt),
              now,
              existing.map(ArchivedAttachment::retrievalTs).orElse(now),
              existing.map(ArchivedAttachment::roomId).orElse(roomId),
              existing.map(ArchivedAttachment::eventId).orElse(eventId));

      UpsertResult result;
      try {
        result = tx.execute(status -> repo.upsertAttachment(row));
      } catch (DataAccessException e) {
        log.warn(
            "[archiver] could not store attachment {} for event {}: {}",
            ref.contentRef(),
            eventId,
            e.getMessage());
        return new AttachmentOutcome.Failed(ref.contentRef(), "store error: " + describe(e));
      }
      if (result == UpsertResult.ALREADY_PRESENT) {
        return new AttachmentOutcome.AlreadyCached(ref.contentRef());
      }
      if (attempt.data() == null) {
        log.warn(
            "[archiver] attachment {} not cached ({}); will retry on a later run",
            ref.contentRef(),
            status(attempt));
      }
      return attempt.outcome();
    }
  }

  private Attempt download(String contentRef, URI httpUrl) {
    try (ContentDownload dl = source.download(httpUrl)) {
      if (!dl.isSuccess()) {
        return Attempt.failed(new AttachmentOutcome.Failed(contentRef, dl.statusLine()));
      }

      OptionalLong declared = dl.contentLength();
      if (declared.isPresent() && declared.getAsLong() >= maxBytes) {
        return Attempt.failed(
            new AttachmentOutcome.Rejected(
                contentRef,
                declared.getAsLong(),
                "rejected: content length " + declared.getAsLong() + " >= limit " + maxBytes));
      }

      if (declared.isPresent() && declared.getAsLong() >= bufferLimit) {
        return Attempt.failed(
            new AttachmentOutcome.Rejected(
                contentRef,
                declared.getAsLong(),
                "rejected: content length "
                    + declared.getAsLong()
                    + " exceeds buffer limit "
                    + bufferLimit));
      }

      long limit = Math.min(maxBytes, bufferLimit);
      byte[] data = readCapped(dl.body(), limit);
      if (data == null) {
        String why =
            limit < maxBytes
                ? "rejected: body exceeds buffer limit " + limit
                : "rejected: body reached limit " + maxBytes;
        return Attempt.failed(new AttachmentOutcome.Rejected(contentRef, limit, why));
      }
      if (data.length == 0) {
        return Attempt.failed(
            new AttachmentOutcome.Failed(contentRef, dl.statusLine() + " (empty body)"));
      }
      return new Attempt(
          data, new AttachmentOutcome.Cached(contentRef, data.length, dl.statusLine()));
    } catch (Exception e) {
      return Attempt.failed(new AttachmentOutcome.Failed(contentRef, "error: " + describe(e)));
    }
  }

  /** Read the whole body, or return {@code null} as soon as it reaches {@code limit} bytes. */
  static byte[] readCapped(InputStream in, long limit) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buf = new byte[64 * 1024];
    long total = 0;
    int n;
    while ((n = in.read(buf)) != -1) {
      total += n;
      if (total >= limit) return null;
      out.write(buf, 0, n);
    }
    return out.toByteArray();
  }

  private Object lockFor(String key) {
    return locks[Math.floorMod(key.hashCode(), locks.length)];
  }

  private static String status(Attempt attempt) {
    AttachmentOutcome o = attempt.outcome();
    if (o instanceof AttachmentOutcome.Cached c) return c.status();
    if (o instanceof AttachmentOutcome.Rejected r) return r.status();
    if (o instanceof AttachmentOutcome.Failed f) return f.status();
    return "";
  }

  private static String describe(Throwable e) {
    String msg = e.getMessage();
    return msg == null || msg.isBlank()
        ? e.getClass().getSimpleName()
        : e.getClass().getSimpleName() + ": " + msg;
  }

  private record Attempt(byte[] data, AttachmentOutcome outcome) {
    static Attempt failed(AttachmentOutcome outcome) {
      return new Attempt(null, outcome);
    }
  }
}
