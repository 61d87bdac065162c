package org.dissync.data;

/**
 * Formats and parses the hex keys used in serialized artifact tables.
 * Negative values keep their sign ({@code -0x18} is written as {@code -18}).
 */
public final class HexKeys {

    private HexKeys() {
        // Utility class
    }

    public static String format(long value) {
        if (value < 0) {
            return "-" + Long.toHexString(-value);
        }
        return Long.toHexString(value);
    }

    /**
     * Parses a key written by {@link #format(long)}. A leading {@code 0x} is accepted.
     *
     * @param key The key text.
     * @return The numeric value.
     * @throws ArtifactFormatException if the key is not a hex number.
     */
    public static long parse(String key) {
        if (key == null || key.isBlank()) {
            throw new ArtifactFormatException("Empty hex key");
        }
        String text = key.trim();
        boolean negative = text.startsWith("-");
        if (negative) {
            text = text.substring(1);
        }
        if (text.startsWith("0x") || text.startsWith("0X")) {
            text = text.substring(2);
        }
        try {
            long value = Long.parseUnsignedLong(text, 16);
            return negative ? -value : value;
        } catch (NumberFormatException e) {
            throw new ArtifactFormatException("Not a hex key: '" + key + "'", e);
        }
    }
}
