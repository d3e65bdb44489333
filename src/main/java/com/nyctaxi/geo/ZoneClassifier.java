package com.nyctaxi.geo;

import java.util.List;

/**
 * Maps pickup coordinates to a named NYC zone.
 *
 * <p>Zones are coarse bounding boxes checked in a fixed order. The boxes
 * overlap (the airports sit inside the Queens box, parts of Queens inside
 * Brooklyn), so the first matching box wins and airports are checked first.
 *
 * <p>Example:
 * <pre>{@code
 * ZoneClassifier.classify(40.75, -73.98);  // "Manhattan"
 * ZoneClassifier.classify(40.645, -73.78); // "JFK_Airport"
 * ZoneClassifier.classify(0.0, 0.0);       // "Unknown"
 * }</pre>
 */
public final class ZoneClassifier {

    public static final String UNKNOWN = "Unknown";
    public static final String NYC_OTHER = "NYC_Other";

    private static final BoundingBox NYC_AREA = new BoundingBox("NYC", 40.0, 41.5, -75.0, -73.0);

    private static final List<BoundingBox> ZONES = List.of(
            new BoundingBox("JFK_Airport", 40.635, 40.655, -73.795, -73.755),
            new BoundingBox("LaGuardia_Airport", 40.755, 40.785, -73.895, -73.855),
            new BoundingBox("Manhattan", 40.695, 40.805, -74.025, -73.895),
            new BoundingBox("Bronx", 40.785, 40.925, -73.935, -73.755),
            new BoundingBox("Brooklyn", 40.565, 40.745, -74.045, -73.825),
            new BoundingBox("Queens", 40.535, 40.805, -73.850, -73.695),
            new BoundingBox("Staten_Island", 40.475, 40.655, -74.265, -74.045),
            new BoundingBox(NYC_OTHER, 40.4, 41.0, -74.3, -73.7)
    );

    private ZoneClassifier() {
    }

    /**
     * Returns the name of the zone containing the given coordinates.
     *
     * @param lat pickup latitude
     * @param lng pickup longitude
     * @return the zone name, or {@value #UNKNOWN} for missing or out-of-area coordinates
     */
    public static String classify(double lat, double lng) {
        if (lat == 0.0 || lng == 0.0 || !NYC_AREA.contains(lat, lng)) {
            return UNKNOWN;
        }
        for (BoundingBox zone : ZONES) {
            if (zone.contains(lat, lng)) {
                return zone.name();
            }
        }
        return UNKNOWN;
    }

    /**
     * Returns the zone names in the order they are tested.
     *
     * @return ordered zone names
     */
    public static List<String> zoneNames() {
        return ZONES.stream().map(BoundingBox::name).toList();
    }

    /**
     * Inclusive latitude/longitude rectangle.
     */
    private record BoundingBox(String name, double minLat, double maxLat, double minLng, double maxLng) {

        boolean contains(double lat, double lng) {
            return lat >= minLat && lat <= maxLat && lng >= minLng && lng <= maxLng;
        }
    }
}
