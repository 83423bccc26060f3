package villagecompute.weatheralerts.exceptions;

/**
 * Exception thrown when a message cannot be delivered to a notification destination.
 *
 * <p>
 * Delivery is fire-and-forget: the dispatcher logs the failure and continues with the remaining sends.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
