package com.trailvision.core.geo;

/** Координата вне [-90,90] / [-180,180] или NaN. Не клампим, отдаём наверх. */
public class InvalidCoordinateException extends IllegalArgumentException {

    public InvalidCoordinateException(double lat, double lon) {
        super("invalid coordinate: (" + lat + ", " + lon + ")");
    }
}
