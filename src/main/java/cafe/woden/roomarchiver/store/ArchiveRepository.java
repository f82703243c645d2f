package cafe.woden.roomarchiver.store;

import cafe.woden.roomarchiver.model.ArchivedAttachment;
import cafe.woden.roomarchiver.model.ArchivedDevice;
import cafe.woden.roomarchiver.model.ArchivedEvent;
import cafe.woden.roomarchiver.model.ArchivedMember;
import cafe.woden.roomarchiver.model.ArchivedRoom;
import cafe.woden.roomarchiver.model.UpsertResult;
import java.sql.Blob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;

/**
 * Keyed upserts for every archived entity kind.
 *
 * <p>Rooms, members, devices and events are write-once: an existing row is left untouched and the
 * attempt is reported as {@link UpsertResult#ALREADY_PRESENT}. Attachments are updated in place
 * until they have been cached.
 *
 * <p>Callers own transaction boundaries.
 */
public class ArchiveRepository {

  private static final Logger log = LoggerFactory.getLogger(ArchiveRepository.class);

  private static final String SELECT_ROOM_SQL =
      """
      SELECT room_id, display_name, topic, retrieval_ts_ms
        FROM archive_room
       WHERE room_id = ?
      """;

  private static final String INSERT_ROOM_SQL =
      """
      INSERT INTO archive_room(room_id, display_name, topic, retrieval_ts_ms)
      VALUES (?,?,?,?)
      """;

  private static final String EXISTS_MEMBER_SQL =
      """
      SELECT 1
        FROM archive_member
       WHERE room_id = ?
         AND user_id = ?
       LIMIT 1
      """;

  private static final String INSERT_MEMBER_SQL =
      """
      INSERT INTO archive_member(room_id, user_id, display_name, avatar_url, retrieval_ts_ms)
      VALUES (?,?,?,?,?)
      """;

  private static final String EXISTS_DEVICE_SQL =
      """
      SELECT 1
        FROM archive_device
       WHERE user_id = ?
         AND device_id = ?
       LIMIT 1
      """;

  private static final String INSERT_DEVICE_SQL =
      """
      INSERT INTO archive_device(
        user_id,
        device_id,
        display_name,
        last_seen_ts_ms,
        last_seen_ip,
        retrieval_ts_ms
      ) VALUES (?,?,?,?,?,?)
      """;

  private static final String EXISTS_EVENT_SQL =
      """
      SELECT 1
        FROM archive_event
       WHERE event_id = ?
       LIMIT 1
      """;

  private static final String INSERT_EVENT_SQL =
      """
      INSERT INTO archive_event(
        event_id,
        room_id,
        sender,
        event_type,
        content,
        origin_server_ts_ms,
        raw_json,
        retrieval_ts_ms
      ) VALUES (?,?,?,?,?,?,?,?)
      """;

  // Known-recent window for frontier detection: newest-first by origin timestamp.
  private static final String SELECT_RECENT_EVENT_IDS_SQL =
      """
      SELECT event_id
        FROM archive_event
       WHERE room_id = ?
    ORDER BY origin_server_ts_ms DESC, id DESC
       LIMIT ?
      """;

  private static final String SELECT_RECENT_EVENTS_SQL =
      """
      SELECT event_id, room_id, sender, event_type, content, origin_server_ts_ms, raw_json,
             retrieval_ts_ms
        FROM archive_event
       WHERE room_id = ?
    ORDER BY origin_server_ts_ms DESC, id DESC
       LIMIT ?
      """;

  private static final String ATTACHMENT_COLUMNS =
      """
      fetch_url_matrix, fetch_url_http, filename, declared_size, mime_type, is_image, is_cached,
      blob_data, last_fetch_status, last_fetch_ts_ms, retrieval_ts_ms, room_id, event_id
      """;

  private static final String SELECT_ATTACHMENT_SQL =
      "SELECT " + ATTACHMENT_COLUMNS + " FROM archive_attachment WHERE fetch_url_matrix = ?";

  private static final String SELECT_PENDING_ATTACHMENTS_SQL =
      "SELECT "
          + ATTACHMENT_COLUMNS
          + " FROM archive_attachment WHERE room_id = ? AND is_cached = FALSE"
          + " ORDER BY id ASC LIMIT ?";

  private static final String INSERT_ATTACHMENT_SQL =
      "INSERT INTO archive_attachment(" + ATTACHMENT_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)";

  // Conditional updates: a row that has been cached in the meantime is never touched again.
  private static final String UPDATE_ATTACHMENT_CACHED_SQL =
      """
      UPDATE archive_attachment
         SET fetch_url_http = ?,
             is_cached = TRUE,
             blob_data = ?,
             last_fetch_status = ?,
             last_fetch_ts_ms = ?
       WHERE fetch_url_matrix = ?
         AND is_cached = FALSE
      """;

  private static final String UPDATE_ATTACHMENT_FAILED_SQL =
      """
      UPDATE archive_attachment
         SET fetch_url_http = ?,
             last_fetch_status = ?,
             last_fetch_ts_ms = ?
       WHERE fetch_url_matrix = ?
         AND is_cached = FALSE
      """;

  private static final RowMapper<ArchivedRoom> ROOM_MAPPER =
      (rs, rowNum) ->
          new ArchivedRoom(
              rs.getString("room_id"),
              rs.getString("display_name"),
              rs.getString("topic"),
              Instant.ofEpochMilli(rs.getLong("retrieval_ts_ms")));

  private static final RowMapper<ArchivedEvent> EVENT_MAPPER =
      (rs, rowNum) ->
          new ArchivedEvent(
              rs.getString("event_id"),
              rs.getString("room_id"),
              rs.getString("sender"),
              rs.getString("event_type"),
              rs.getString("content"),
              Instant.ofEpochMilli(rs.getLong("origin_server_ts_ms")),
              rs.getString("raw_json"),
              Instant.ofEpochMilli(rs.getLong("retrieval_ts_ms")));

  private static final RowMapper<ArchivedAttachment> ATTACHMENT_MAPPER =
      (rs, rowNum) ->
          new ArchivedAttachment(
              rs.getString("fetch_url_matrix"),
              rs.getString("fetch_url_http"),
              rs.getString("filename"),
              rs.getLong("declared_size"),
              rs.getString("mime_type"),
              rs.getBoolean("is_image"),
              rs.getBoolean("is_cached"),
              blobBytes(rs, "blob_data"),
              rs.getString("last_fetch_status"),
              nullableInstant(rs, "last_fetch_ts_ms"),
              Instant.ofEpochMilli(rs.getLong("retrieval_ts_ms")),
              rs.getString("room_id"),
              rs.getString("event_id"));

  private final JdbcTemplate jdbc;

  public ArchiveRepository(JdbcTemplate jdbc) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  public UpsertResult upsertRoom(ArchivedRoom room) {
    Objects.requireNonNull(room, "room");
    if (findRoom(room.roomId()).isPresent()) {
      log.debug("[archiver] room {} already archived; skipping", room.roomId());
      return UpsertResult.ALREADY_PRESENT;
    }
    return insertOrSkip(
        "room " + room.roomId(),
        INSERT_ROOM_SQL,
        room.roomId(),
        room.displayName(),
        room.topic(),
        room.retrievalTs().toEpochMilli());
  }

  public Optional<ArchivedRoom> findRoom(String roomId) {
    List<ArchivedRoom> rows = jdbc.query(SELECT_ROOM_SQL, ROOM_MAPPER, roomId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public UpsertResult upsertMember(ArchivedMember member) {
    Objects.requireNonNull(member, "member");
    if (exists(EXISTS_MEMBER_SQL, member.roomId(), member.userId())) {
      log.debug(
          "[archiver] member {} of {} already archived; skipping", member.userId(), member.roomId());
      return UpsertResult.ALREADY_PRESENT;
    }
    return insertOrSkip(
        "member " + member.userId() + " of " + member.roomId(),
        INSERT_MEMBER_SQL,
        member.roomId(),
        member.userId(),
        member.displayName(),
        member.avatarUrl(),
        member.retrievalTs().toEpochMilli());
  }

  public UpsertResult upsertDevice(ArchivedDevice device) {
    Objects.requireNonNull(device, "device");
    if (exists(EXISTS_DEVICE_SQL, device.userId(), device.deviceId())) {
      log.debug(
          "[archiver] device {} of {} already archived; skipping",
          device.deviceId(),
          device.userId());
      return UpsertResult.ALREADY_PRESENT;
    }
    return insertOrSkip(
        "device " + device.deviceId() + " of " + device.userId(),
        INSERT_DEVICE_SQL,
        device.userId(),
        device.deviceId(),
        device.displayName(),
        new SqlParameterValue(
            Types.BIGINT, device.lastSeenTs() == null ? null : device.lastSeenTs().toEpochMilli()),
        device.lastSeenIp(),
        device.retrievalTs().toEpochMilli());
  }

  public UpsertResult upsertEvent(ArchivedEvent event) {
    Objects.requireNonNull(event, "event");
    if (exists(EXISTS_EVENT_SQL, event.eventId())) {
      log.debug("[archiver] event {} already archived; skipping", event.eventId());
      return UpsertResult.ALREADY_PRESENT;
    }
    return insertOrSkip(
        "event " + event.eventId(),
        INSERT_EVENT_SQL,
        event.eventId(),
        event.roomId(),
        event.sender(),
        event.type(),
        event.contentJson(),
        event.originServerTs().toEpochMilli(),
        event.rawJson(),
        event.retrievalTs().toEpochMilli());
  }

  /** Ids of the {@code limit} newest events of a room by origin timestamp (newest-first). */
  public List<String> recentEventIds(String roomId, int limit) {
    if (limit <= 0) return List.of();
    return jdbc.query(SELECT_RECENT_EVENT_IDS_SQL, (rs, rowNum) -> rs.getString(1), roomId, limit);
  }

  /** The {@code limit} newest events of a room by origin timestamp (newest-first). */
  public List<ArchivedEvent> recentEvents(String roomId, int limit) {
    if (limit <= 0) return List.of();
    return jdbc.query(SELECT_RECENT_EVENTS_SQL, EVENT_MAPPER, roomId, limit);
  }

  public Optional<ArchivedAttachment> findAttachment(String fetchUrlMatrix) {
    List<ArchivedAttachment> rows =
        jdbc.query(SELECT_ATTACHMENT_SQL, ATTACHMENT_MAPPER, fetchUrlMatrix);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Uncached attachments first referenced from a room, oldest row first. */
  public List<ArchivedAttachment> pendingAttachments(String roomId, int limit) {
    if (roomId == null || limit <= 0) return List.of();
    return jdbc.query(SELECT_PENDING_ATTACHMENTS_SQL, ATTACHMENT_MAPPER, roomId, limit);
  }

  /**
   * Insert a new attachment, or record a fetch attempt against an existing uncached one.
   *
   * <p>For an existing row, {@code data} is replaced only when {@code attempt} is cached; the fetch
   * status and timestamp are always replaced. A row that is already cached is left untouched.
   */
  public UpsertResult upsertAttachment(ArchivedAttachment attempt) {
    Objects.requireNonNull(attempt, "attempt");
    Optional<ArchivedAttachment> existing = findAttachment(attempt.fetchUrlMatrix());
    if (existing.isEmpty()) {
      UpsertResult inserted = insertAttachment(attempt);
      if (inserted == UpsertResult.INSERTED) return inserted;
      // Lost an insert race; fall through and treat the winner as the existing row.
    }

    Long fetchTs = attempt.lastFetchTs() == null ? null : attempt.lastFetchTs().toEpochMilli();
    int updated;
    if (attempt.cached()) {
      updated =
          jdbc.update(
              UPDATE_ATTACHMENT_CACHED_SQL,
              attempt.fetchUrlHttp(),
              new SqlParameterValue(Types.BLOB, attempt.data()),
              attempt.lastFetchStatus(),
              new SqlParameterValue(Types.BIGINT, fetchTs),
              attempt.fetchUrlMatrix());
    } else {
      updated =
          jdbc.update(
              UPDATE_ATTACHMENT_FAILED_SQL,
              attempt.fetchUrlHttp(),
              attempt.lastFetchStatus(),
              new SqlParameterValue(Types.BIGINT, fetchTs),
              attempt.fetchUrlMatrix());
    }
    if (updated == 0) {
      log.debug(
          "[archiver] attachment {} already cached; skipping", attempt.fetchUrlMatrix());
      return UpsertResult.ALREADY_PRESENT;
    }
    return UpsertResult.UPDATED;
  }

  public ArchiveCounts counts() {
    return new ArchiveCounts(
        count("SELECT COUNT(*) FROM archive_room"),
        count("SELECT COUNT(*) FROM archive_member"),
        count("SELECT COUNT(*) FROM archive_device"),
        count("SELECT COUNT(*) FROM archive_event"),
        count("SELECT COUNT(*) FROM archive_attachment"));
  }

  public long countEvents(String roomId) {
    Long v =
        jdbc.queryForObject(
            "SELECT COUNT(*) FROM archive_event WHERE room_id = ?", Long.class, roomId);
    return v == null ? 0L : v;
  }

  private UpsertResult insertAttachment(ArchivedAttachment a) {
    return insertOrSkip(
        "attachment " + a.fetchUrlMatrix(),
        INSERT_ATTACHMENT_SQL,
        a.fetchUrlMatrix(),
        a.fetchUrlHttp(),
        a.filename(),
        a.size(),
        a.mimeType(),
        a.image(),
        a.cached(),
        new SqlParameterValue(Types.BLOB, a.data()),
        a.lastFetchStatus(),
        new SqlParameterValue(
            Types.BIGINT, a.lastFetchTs() == null ? null : a.lastFetchTs().toEpochMilli()),
        a.retrievalTs() == null ? System.currentTimeMillis() : a.retrievalTs().toEpochMilli(),
        a.roomId(),
        a.eventId());
  }

  private UpsertResult insertOrSkip(String what, String sql, Object... args) {
    try {
      jdbc.update(sql, args);
      return UpsertResult.INSERTED;
    } catch (DataAccessException ex) {
      if (!isDuplicateKey(ex)) throw ex;
      log.debug("[archiver] {} inserted concurrently; skipping", what);
      return UpsertResult.ALREADY_PRESENT;
    }
  }

  private boolean exists(String sql, Object... args) {
    // NOTE: Avoid JdbcTemplate#query overload ambiguity when using lambdas.
    List<Integer> rows = jdbc.query(sql, (rs, rowNum) -> rs.getInt(1), args);
    return !rows.isEmpty();
  }

  private long count(String sql) {
    Long v = jdbc.queryForObject(sql, Long.class);
    return v == null ? 0L : v;
  }

  private static byte[] blobBytes(ResultSet rs, String column) throws SQLException {
    Blob blob = rs.getBlob(column);
    if (blob == null) return null;
    return blob.getBytes(1, (int) blob.length());
  }

  private static Instant nullableInstant(ResultSet rs, String column) throws SQLException {
    long v = rs.getLong(column);
    return rs.wasNull() ? null : Instant.ofEpochMilli(v);
  }

  static boolean isDuplicateKey(Throwable ex) {
    Throwable cur = ex;
    while (cur != null) {
      if (cur instanceof DuplicateKeyException) return true;
      if (cur instanceof SQLException sqlEx) {
        String state = Objects.toString(sqlEx.getSQLState(), "").trim();
        if ("23505".equals(state)) return true;
      }
      cur = cur.getCause();
    }
    return false;
  }

  /** Row counts per entity kind. */
  public record ArchiveCounts(
      long rooms, long members, long devices, long events, long attachments) {}
}
