package villagecompute.weatheralerts.exceptions;

/**
 * Exception thrown when the tracked-alert state file cannot be read or written.
 *
 * <p>
 * {@link villagecompute.weatheralerts.services.AlertStateStore} never lets this escape: an unreadable file is treated as empty state and a failed write is logged.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
