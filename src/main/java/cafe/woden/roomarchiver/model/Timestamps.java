package cafe.woden.roomarchiver.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** Conversions between source-side millisecond epochs and archive instants. */
public final class Timestamps {

  private static final DateTimeFormatter ISO_MILLIS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

  private Timestamps() {}

  public static Instant fromEpochMillis(long epochMs) {
    return Instant.ofEpochMilli(epochMs);
  }

  /** Nullable variant used for optional source fields such as a device's last-seen time. */
  public static Instant fromEpochMillis(Long epochMs) {
    return epochMs == null ? null : Instant.ofEpochMilli(epochMs);
  }

  /** ISO-8601 UTC rendering with millisecond precision, e.g. {@code 2020-01-01T00:00:00.000}. */
  public static String format(Instant instant) {
    if (instant == null) return "";
    return ISO_MILLIS.format(instant);
  }
}
