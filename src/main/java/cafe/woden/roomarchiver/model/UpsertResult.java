package cafe.woden.roomarchiver.model;

/** Outcome of a keyed upsert into the archive. */
public enum UpsertResult {
  INSERTED,
  ALREADY_PRESENT,
  UPDATED
}
