package hypertag.common.exceptions;

/**
 * Thrown to terminate compilation with the given exit code once the
 * error has been reported.
 */
public class HypertagFatal extends RuntimeException {
  public final int exitCode;

  public HypertagFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

  private static final long serialVersionUID = 1L;
}
