/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.docvalue.values;

/**
 * A {@link FieldValue} instance representing a geographic point as a
 * latitude/longitude pair in degrees. Latitude must be in the range
 * [-90, 90] and longitude in the range [-180, 180].
 */
public class GeoPointValue extends FieldValue {

    private final double latitude;
    private final double longitude;

    /**
     * Creates a new instance.
     *
     * @param latitude the latitude in degrees
     * @param longitude the longitude in degrees
     *
     * @throws IllegalArgumentException if either coordinate is out of range
     */
    public GeoPointValue(double latitude, double longitude) {
        super();
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException(
                "GeoPointValue: latitude must be in [-90, 90]: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException(
                "GeoPointValue: longitude must be in [-180, 180]: " +
                longitude);
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    @Override
    public Type getType() {
        return Type.GEO_POINT;
    }

    /**
     * Returns the latitude
     *
     * @return the latitude in degrees
     */
    public double getLatitude() {
        return latitude;
    }

    /**
     * Returns the longitude
     *
     * @return the longitude in degrees
     */
    public double getLongitude() {
        return longitude;
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof GeoPointValue) {
            GeoPointValue gp = (GeoPointValue) other;
            return Double.compare(latitude, gp.latitude) == 0 &&
                Double.compare(longitude, gp.longitude) == 0;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(latitude) + Double.hashCode(longitude);
    }
}
