package villagecompute.weatheralerts.exceptions;

/**
 * Exception thrown when an alert event record cannot be forwarded to the logging sink.
 *
 * <p>
 * Forwarding is best effort: the dispatcher logs the failure at debug level and swallows it.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class LogForwardException extends RuntimeException {

    public LogForwardException(String message) {
        super(message);
    }

    public LogForwardException(String message, Throwable cause) {
        super(message, cause);
    }
}
