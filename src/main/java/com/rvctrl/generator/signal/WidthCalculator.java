package com.rvctrl.generator.signal;

import com.rvctrl.generator.model.EncodingType;

import java.util.Objects;

/**
 * Signal width as a function of the encoding scheme and the number of values.
 */
public final class WidthCalculator {

    private WidthCalculator() {
        // Utility class
    }

    /**
     * OneHot uses one bit per value. Binary and Gray need the bit length of {@code valueCount - 1},
     * so zero or one value yields width 0.
     */
    public static int width(EncodingType encodingType, int valueCount) {
        Objects.requireNonNull(encodingType, "encodingType");
        if (valueCount < 0) {
            throw new IllegalArgumentException("valueCount must be >= 0, got " + valueCount);
        }
        return switch (encodingType) {
            case ONE_HOT -> valueCount;
            case BINARY, GRAY -> valueCount <= 1 ? 0 : Integer.SIZE - Integer.numberOfLeadingZeros(valueCount - 1);
        };
    }
}
