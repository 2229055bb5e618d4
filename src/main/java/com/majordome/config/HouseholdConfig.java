package com.majordome.config;

import java.time.ZoneId;

/**
 * Household location and calendar.
 *
 * @param city      City label shown in reports
 * @param latitude  Latitude, may be null
 * @param longitude Longitude, may be null
 * @param zone      Local time zone used for calendar fields and elapsed days
 */
public record HouseholdConfig(
        String city,
        Double latitude,
        Double longitude,
        ZoneId zone
) {
    public static final ZoneId DEFAULT_ZONE = ZoneId.of("Europe/Paris");

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    public static HouseholdConfig defaults() {
        return new HouseholdConfig("Unknown", null, null, DEFAULT_ZONE);
    }
}
