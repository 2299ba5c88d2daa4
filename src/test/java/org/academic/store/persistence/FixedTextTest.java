package org.academic.store.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FixedTextTest {

    @Test
    @DisplayName("Short text is kept as is")
    void testShortTextUnchanged() {
        assertEquals("Algorithms", FixedText.fit("Algorithms", FixedText.NAME_SLOT));
    }

    @Test
    @DisplayName("Null becomes empty text")
    void testNullBecomesEmpty() {
        assertEquals("", FixedText.fit(null, FixedText.NAME_SLOT));
    }

    @Test
    @DisplayName("Long text is cut to slot size minus the terminator")
    void testLongTextCut() {
        String longName = "x".repeat(150);
        assertEquals(99, FixedText.fit(longName, FixedText.NAME_SLOT).length());
        assertEquals("01/03/2024", FixedText.fit("01/03/2024 extra", FixedText.DATE_SLOT));
    }

    @Test
    @DisplayName("Cutting never splits a multi-byte character")
    void testMultiByteBoundary() {
        // 'é' is two bytes in UTF-8: 49 of them use 98 bytes, the 50th would need 100
        String accented = "é".repeat(60);
        String fitted = FixedText.fit(accented, FixedText.NAME_SLOT);

        assertEquals(49, fitted.length());
        assertTrue(fitted.getBytes(StandardCharsets.UTF_8).length <= 99);
    }

    @Test
    @DisplayName("Text after an embedded NUL is dropped")
    void testEmbeddedNul() {
        assertEquals("Ana", FixedText.fit("Ana\0Maria", FixedText.NAME_SLOT));
    }

    @Test
    @DisplayName("Written slot has fixed width and reads back")
    void testWriteRead() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        FixedText.write(new DataOutputStream(bytes), "Dr. Müller", FixedText.NAME_SLOT);

        assertEquals(FixedText.NAME_SLOT, bytes.size());

        String read = FixedText.read(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())), FixedText.NAME_SLOT);
        assertEquals("Dr. Müller", read);
    }
}
