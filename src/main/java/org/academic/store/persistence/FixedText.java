package org.academic.store.persistence;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Zero-terminated UTF-8 text in a fixed-width byte slot.
 * A slot of {@code n} bytes holds at most {@code n - 1} bytes of text.
 */
public final class FixedText {

    public static final int NAME_SLOT = 100;
    public static final int COMMENT_SLOT = 500;
    public static final int DATE_SLOT = 11;

    private FixedText() {
    }

    /**
     * Cuts {@code value} so that it fits a slot of {@code slotSize} bytes, never splitting a character.
     * Null becomes the empty string; text after an embedded NUL is dropped, as it could not be read back.
     */
    public static String fit(String value, int slotSize) {
        if (value == null) {
            return "";
        }
        int nul = value.indexOf('\0');
        if (nul >= 0) {
            value = value.substring(0, nul);
        }
        int limit = slotSize - 1;
        if (value.getBytes(StandardCharsets.UTF_8).length <= limit) {
            return value;
        }

        int bytes = 0;
        int end = 0;
        while (end < value.length()) {
            int codePoint = value.codePointAt(end);
            int width = utf8Width(codePoint);
            if (bytes + width > limit) {
                break;
            }
            bytes += width;
            end += Character.charCount(codePoint);
        }
        return value.substring(0, end);
    }

    public static void write(DataOutput out, String value, int slotSize) throws IOException {
        byte[] slot = new byte[slotSize];
        byte[] encoded = fit(value, slotSize).getBytes(StandardCharsets.UTF_8);
        System.arraycopy(encoded, 0, slot, 0, encoded.length);
        out.write(slot);
    }

    public static String read(DataInput in, int slotSize) throws IOException {
        byte[] slot = new byte[slotSize];
        in.readFully(slot);
        int length = 0;
        while (length < slotSize && slot[length] != 0) {
            length++;
        }
        return new String(slot, 0, length, StandardCharsets.UTF_8);
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) return 1;
        if (codePoint < 0x800) return 2;
        if (codePoint < 0x10000) return 3;
        return 4;
    }
}
