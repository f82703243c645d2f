package cafe.woden.roomarchiver.sync;

/**
 * Summary of one frontier-detection pass.
 *
 * @param batches batches pulled from the stream
 * @param scanned events examined
 * @param fresh events handed to the sink as new
 * @param known events recognized as already archived
 * @param reachedFrontier true when a known event stopped the walk before history ran out
 */
public record FrontierScan(int batches, int scanned, int fresh, int known, boolean reachedFrontier) {}
