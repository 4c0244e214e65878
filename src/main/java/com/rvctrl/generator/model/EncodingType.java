package com.rvctrl.generator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Encoding scheme of a control signal.
 *
 * The label is what appears in generated code ({@code CtrlEnum.OneHot}) and in the record store.
 */
public enum EncodingType {
    /**
     * One bit per value.
     */
    ONE_HOT("OneHot"),

    /**
     * Plain binary counter.
     */
    BINARY("Binary"),

    /**
     * Reflected binary (Gray) code.
     */
    GRAY("Gray");

    private final String label;

    EncodingType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Accepts the label in any case, with or without '_' / '-' separators
     * ("OneHot", "onehot", "ONE_HOT", "one-hot").
     */
    @JsonCreator
    public static EncodingType fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Encoding type is required");
        }
        String normalized = value.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.label.toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown encoding type: " + value + " (expected OneHot, Binary or Gray)"));
    }

    @Override
    public String toString() {
        return label;
    }
}
