package com.rvctrl.generator.catalog;

import java.util.Objects;

/**
 * Canonicalizes bit-level instruction encodings.
 *
 * '0' and '1' are kept; any other character (space, '-', field letters) is a don't-care
 * position and becomes '?'. Length is preserved exactly because bit positions are significant.
 */
public final class EncodingNormalizer {

    public static final char DONT_CARE = '?';

    private EncodingNormalizer() {
        // Utility class
    }

    public static String normalize(String encoding) {
        Objects.requireNonNull(encoding, "encoding");
        StringBuilder sb = new StringBuilder(encoding.length());
        for (int i = 0; i < encoding.length(); i++) {
            char c = encoding.charAt(i);
            sb.append(c == '0' || c == '1' ? c : DONT_CARE);
        }
        return sb.toString();
    }
}
