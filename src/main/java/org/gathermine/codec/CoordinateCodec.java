package org.gathermine.codec;

import org.gathermine.model.InvalidObservationException;

import java.util.Set;

/**
 * Packs a map position into the integer key the addon uses for its node tables.
 * <p>
 * Both percentages are rounded to four decimal digits. x fills the digits from 10^6 upwards,
 * y the digits from 10^2 upwards, and the two lowest digits stay free for collision breaking.
 * Sorting the keys numerically therefore walks the map roughly column by column.
 */
public final class CoordinateCodec {

    /** Fixed-point resolution of one axis. */
    public static final long AXIS_RESOLUTION = 10_000L;
    /** Multiplier that places the x component. */
    public static final long X_FACTOR = 1_000_000L;
    /** Multiplier that places the y component. */
    public static final long Y_FACTOR = 100L;

    private CoordinateCodec() {
    }

    /**
     * Encodes a position.
     *
     * @param x horizontal position in percent, in [0,100]
     * @param y vertical position in percent, in [0,100]
     * @return the packed coordinate
     * @throws InvalidObservationException if a component is not finite or outside [0,100]
     */
    public static long encode(double x, double y) {
        requireInRange("x", x);
        requireInRange("y", y);
        return scale(x) * X_FACTOR + scale(y) * Y_FACTOR;
    }

    /**
     * Finds the first free slot at or above a hint.
     *
     * @param hint the packed coordinate the position encodes to
     * @param occupied the packed coordinates already placed in the same zone
     * @return {@code hint} if it is free, otherwise the next higher free value
     */
    public static long allocate(long hint, Set<Long> occupied) {
        long candidate = hint;
        while (occupied.contains(candidate)) {
            candidate++;
        }
        return candidate;
    }

    private static long scale(double percent) {
        return (long) Math.floor(percent / 100.0 * AXIS_RESOLUTION + 0.5);
    }

    private static void requireInRange(String axis, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new InvalidObservationException(
                    String.format("Coordinate %s=%s is outside of [0,100]", axis, value));
        }
    }
}
