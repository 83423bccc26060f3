package villagecompute.weatheralerts.exceptions;

/**
 * Exception thrown when the active-alert feed cannot be fetched or parsed for a zone.
 *
 * <p>
 * The poll loop logs the failure and skips the zone; other zones in the same cycle are unaffected.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class AlertFetchException extends RuntimeException {

    public AlertFetchException(String message) {
        super(message);
    }

    public AlertFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
