package forklift;

/**
 * Thrown when Forklift or one of its drivers is misconfigured.
 */
public class ForkliftException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ForkliftException(String message) {
        super(message);
    }

    public ForkliftException(String message, Throwable cause) {
        super(message, cause);
    }
}
