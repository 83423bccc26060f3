/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.config;

/**
 * Selects which pair of NWS timestamp fields defines an alert's activity window.
 *
 * <p>
 * {@link #ONSET} tracks when the hazard itself begins and ends; {@link #EFFECTIVE} tracks when the product was issued
 * and when it expires. When the end field is missing, {@code expires} is used for either mode.
 */
public enum AlertTimeType {

    ONSET("onset", "ends"),

    EFFECTIVE("effective", "expires");

    /** Generic end field used when the selected end field is absent. */
    public static final String FALLBACK_END_FIELD = "expires";

    private final String startField;
    private final String endField;

    AlertTimeType(String startField, String endField) {
        this.startField = startField;
        this.endField = endField;
    }

    public String getStartField() {
        return startField;
    }

    public String getEndField() {
        return endField;
    }
}
