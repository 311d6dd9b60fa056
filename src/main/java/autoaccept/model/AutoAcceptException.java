package autoaccept.model;

/**
 * Unchecked exception for unrecoverable setup problems: missing configuration,
 * a malformed target catalog, or a reference to an unknown role or shape.
 *
 * <p>Runtime UI faults are never reported this way; a processing cycle treats
 * them as a failed cycle and waits for the next notification.
 */
public class AutoAcceptException extends RuntimeException {

    public AutoAcceptException(String msg) {
        super(msg);
    }

    public AutoAcceptException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
