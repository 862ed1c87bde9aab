package io.intellixity.unipage.error;

/**
 * Raised by an interceptor (or contextual provider) that refuses to let a request through.
 * <p>
 * {@link #status()} and {@link #reason()} are carried to the transport unchanged.
 */
public final class RejectedException extends QueryException {
  private final int status;
  private final String reason;

  public RejectedException(int status, String reason) {
    super(ErrorKind.INTERCEPTOR_REJECTED, reason);
    this.status = status;
    this.reason = reason;
  }

  public int status() {
    return status;
  }

  public String reason() {
    return reason;
  }
}
