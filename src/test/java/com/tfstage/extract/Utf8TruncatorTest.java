package com.tfstage.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class Utf8TruncatorTest {

    @Test
    void shortValueIsUnchanged() {
        assertEquals("whale", Utf8Truncator.truncate("whale", 50));
        assertEquals(5, Utf8Truncator.utf8Length("whale"));
    }

    @Test
    void asciiIsCutAtByteLimit() {
        String longToken = "a".repeat(60);
        assertEquals("a".repeat(50), Utf8Truncator.truncate(longToken, 50));
    }

    @ParameterizedTest
    @DisplayName("多字节字符只在码点边界截断")
    @CsvSource({
        "éééééé, 5, éé",
        "汉字汉字, 7, 汉字",
        "ab😀cd, 5, ab",
        "ab😀cd, 6, ab😀"
    })
    void cutsOnlyAtCodePointBoundaries(String value, int maxBytes, String expected) {
        String truncated = Utf8Truncator.truncate(value, maxBytes);

        assertEquals(expected, truncated);
        assertTrue(truncated.getBytes(StandardCharsets.UTF_8).length <= maxBytes);
        assertEquals(Utf8Truncator.utf8Length(truncated), truncated.getBytes(StandardCharsets.UTF_8).length);
    }

    @Test
    void neverProducesReplacementCharacters() {
        String mixed = "x".repeat(48) + "é漢";
        String truncated = Utf8Truncator.truncate(mixed, 50);

        assertEquals("x".repeat(48) + "é", truncated);
        assertEquals(truncated, new String(truncated.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8));
    }

    @Test
    void rejectsNegativeLimit() {
        assertThrows(IllegalArgumentException.class, () -> Utf8Truncator.truncate("a", -1));
    }
}
