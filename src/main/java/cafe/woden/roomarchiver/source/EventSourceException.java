package cafe.woden.roomarchiver.source;

/** Transport or protocol failure while talking to the remote event source. */
public class EventSourceException extends RuntimeException {

  private final int statusCode;

  public EventSourceException(String message) {
    this(message, 0, null);
  }

  public EventSourceException(String message, Throwable cause) {
    this(message, 0, cause);
  }

  public EventSourceException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status of the failed request, or {@code 0} when no response was received. */
  public int statusCode() {
    return statusCode;
  }
}
