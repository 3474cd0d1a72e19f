package com.trailvision.core.geo;

public record GeoPoint(double latitude, double longitude) {

    /** Средний радиус Земли, метры. */
    public static final double EARTH_RADIUS_M = 6_371_000.0;

    public GeoPoint {
        if (!isValid(latitude, longitude)) {
            throw new InvalidCoordinateException(latitude, longitude);
        }
    }

    public static boolean isValidLatitude(double lat) {
        return lat >= -90 && lat <= 90;
    }

    public static boolean isValidLongitude(double lon) {
        return lon >= -180 && lon <= 180;
    }

    // NaN не проходит ни одно сравнение
    public static boolean isValid(double lat, double lon) {
        return isValidLatitude(lat) && isValidLongitude(lon);
    }

    public double distanceMeters(GeoPoint other) {
        return haversineMeters(latitude, longitude, other.latitude, other.longitude);
    }

    /** Дуга большого круга на сфере радиуса EARTH_RADIUS_M. */
    public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_M * c;
    }
}
