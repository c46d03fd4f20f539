package org.hexwar.runtime.model;

import java.util.ArrayList;
import java.util.List;

/**
 * An axial hex-grid position. The implicit third cube component is {@code s = -q - r}.
 * <p>
 * Coordinates order by row ({@code r}) and then column ({@code q}), which is the iteration
 * order of every merged view the {@link World} exposes.
 *
 * @param q the column axis.
 * @param r the row axis.
 */
public record AxialCoord(int q, int r) implements Comparable<AxialCoord> {

    /**
     * Creates a coordinate.
     *
     * @param q the column axis.
     * @param r the row axis.
     * @return the coordinate.
     */
    public static AxialCoord of(int q, int r) {
        return new AxialCoord(q, r);
    }

    /**
     * Parses a map key produced by {@link #key()}.
     *
     * @param key a key in the form {@code "q,r"}.
     * @return the parsed coordinate.
     * @throws IllegalArgumentException if the key is malformed.
     */
    public static AxialCoord parseKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Coordinate key must not be null");
        }
        int comma = key.indexOf(',');
        if (comma <= 0 || comma == key.length() - 1 || key.indexOf(',', comma + 1) >= 0) {
            throw new IllegalArgumentException("Malformed coordinate key: '" + key + "'");
        }
        try {
            return new AxialCoord(Integer.parseInt(key.substring(0, comma).trim()),
                    Integer.parseInt(key.substring(comma + 1).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed coordinate key: '" + key + "'", e);
        }
    }

    /**
     * @return the derived cube component.
     */
    public int s() {
        return -q - r;
    }

    /**
     * @return the string form used to index persisted tile and unit maps.
     */
    public String key() {
        return q + "," + r;
    }

    /**
     * Hex distance using the cube conversion.
     *
     * @param other the other coordinate.
     * @return the number of steps between the two coordinates.
     */
    public int distanceTo(AxialCoord other) {
        return (Math.abs(q - other.q) + Math.abs(r - other.r) + Math.abs(s() - other.s())) / 2;
    }

    /**
     * @param direction the direction to step in.
     * @return the adjacent coordinate.
     */
    public AxialCoord neighbor(HexDirection direction) {
        return new AxialCoord(q + direction.dq(), r + direction.dr());
    }

    /**
     * @return the six adjacent coordinates in {@link HexDirection} order.
     */
    public List<AxialCoord> neighbors() {
        List<AxialCoord> result = new ArrayList<>(6);
        for (HexDirection direction : HexDirection.values()) {
            result.add(neighbor(direction));
        }
        return result;
    }

    /**
     * Enumerates every coordinate within {@code radius} steps, including this one.
     *
     * @param radius the maximum distance, must be non-negative.
     * @return the coordinates, ordered by column offset and then row offset.
     */
    public List<AxialCoord> range(int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non-negative: " + radius);
        }
        List<AxialCoord> result = new ArrayList<>();
        for (int dq = -radius; dq <= radius; dq++) {
            int minR = Math.max(-radius, -dq - radius);
            int maxR = Math.min(radius, -dq + radius);
            for (int dr = minR; dr <= maxR; dr++) {
                result.add(new AxialCoord(q + dq, r + dr));
            }
        }
        return result;
    }

    @Override
    public int compareTo(AxialCoord other) {
        int byRow = Integer.compare(r, other.r);
        return byRow != 0 ? byRow : Integer.compare(q, other.q);
    }

    @Override
    public String toString() {
        return "(" + q + "," + r + ")";
    }
}
