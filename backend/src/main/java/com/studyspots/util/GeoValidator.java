package com.studyspots.util;

import com.studyspots.model.Location;

import java.util.List;

public final class GeoValidator {

    private GeoValidator() {
    }

    public static boolean isValidLatitude(double lat) {
        return lat >= -90 && lat <= 90;
    }

    public static boolean isValidLongitude(double lng) {
        return lng >= -180 && lng <= 180;
    }

    public static boolean isValidCoordinate(double lng, double lat) {
        return isValidLongitude(lng) && isValidLatitude(lat);
    }

    /** GeoJSON order: {@code [longitude, latitude]}. */
    public static boolean isValidLocation(Location location) {
        if (location == null || location.getCoordinates() == null) {
            return false;
        }
        List<Double> coordinates = location.getCoordinates();
        if (coordinates.size() != 2 || coordinates.get(0) == null || coordinates.get(1) == null) {
            return false;
        }
        return isValidCoordinate(coordinates.get(0), coordinates.get(1));
    }
}
