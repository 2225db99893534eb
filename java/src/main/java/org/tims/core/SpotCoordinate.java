package org.tims.core;

import java.util.Objects;

/**
 * Position of a spatially resolved spectrum: either a named target spot
 * ("A1", "P24") or an x/y(/z) pixel index of an imaging run.
 */
public final class SpotCoordinate {
    private final String spotName;
    private final int x;
    private final int y;
    private final Integer z;

    private SpotCoordinate(String spotName, int x, int y, Integer z) {
        this.spotName = spotName;
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public static SpotCoordinate spot(String spotName) {
        return new SpotCoordinate(Objects.requireNonNull(spotName), 0, 0, null);
    }

    public static SpotCoordinate pixel(int x, int y) {
        return new SpotCoordinate(null, x, y, null);
    }

    public static SpotCoordinate pixel(int x, int y, int z) {
        return new SpotCoordinate(null, x, y, z);
    }

    public boolean isPixel() {
        return spotName == null;
    }

    public String getSpotName() { return spotName; }
    public int getX() { return x; }
    public int getY() { return y; }
    public boolean hasZ() { return z != null; }
    public int getZ() { return z == null ? 0 : z; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpotCoordinate)) return false;
        SpotCoordinate other = (SpotCoordinate) o;
        return x == other.x && y == other.y
            && Objects.equals(spotName, other.spotName)
            && Objects.equals(z, other.z);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spotName, x, y, z);
    }

    @Override
    public String toString() {
        if (spotName != null) return spotName;
        return z == null ? x + "," + y : x + "," + y + "," + z;
    }
}
