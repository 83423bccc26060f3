package villagecompute.weatheralerts;

import java.time.Instant;

import villagecompute.weatheralerts.api.types.AlertType;
import villagecompute.weatheralerts.api.types.TrackedAlertType;

/**
 * Builders for alert test data.
 */
public final class TestFixtures {

    public static final Instant NOW = Instant.parse("2025-01-09T20:00:00Z");

    private TestFixtures() {
    }

    public static AlertType alert(String id, String zone, String description, String destination) {
        return new AlertType(id, zone, "Winter Storm Warning", description, NOW.minusSeconds(3600),
                NOW.plusSeconds(3600), destination);
    }

    public static TrackedAlertType tracked(String id, String zone, String description, String destination) {
        return new TrackedAlertType(id, destination, description, zone);
    }
}
