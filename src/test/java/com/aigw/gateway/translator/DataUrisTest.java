package com.aigw.gateway.translator;

import com.aigw.gateway.exception.TranslationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataUrisTest {

    @Test
    void shouldParseBase64JpegDataUri() {
        byte[] payload = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00, 0x10};
        String uri = "data:image/jpeg;base64," + Base64.getEncoder().encodeToString(payload);

        DataUris.DataUri parsed = DataUris.parse(uri);

        assertEquals("image/jpeg", parsed.mimeType());
        assertArrayEquals(payload, parsed.data());
    }

    @Test
    void shouldAllowMissingMimeType() {
        String uri = "data:," + Base64.getEncoder().encodeToString("hi".getBytes(StandardCharsets.UTF_8));

        DataUris.DataUri parsed = DataUris.parse(uri);

        assertEquals("", parsed.mimeType());
        assertEquals("hi", new String(parsed.data(), StandardCharsets.UTF_8));
    }

    @Test
    void shouldRejectUriWithoutComma() {
        TranslationException e = assertThrows(TranslationException.class,
                () -> DataUris.parse("data:invalid-format"));
        assertEquals("data uri does not have a valid format", e.getMessage());
    }

    @Test
    void shouldRejectInvalidBase64Payload() {
        assertThrows(TranslationException.class, () -> DataUris.parse("data:image/png;base64,@@@not-base64@@@"));
    }

    @Test
    void shouldDetectDataScheme() {
        assertTrue(DataUris.isDataUri("data:image/png;base64,AA=="));
        assertTrue(DataUris.isDataUri("DATA:image/png;base64,AA=="));
        assertFalse(DataUris.isDataUri("https://example.com/data:x"));
        assertFalse(DataUris.isDataUri(null));
    }

    @Test
    void shouldGuessMimeTypeFromExtension() {
        assertEquals("image/png", DataUris.mimeTypeByExtension("https://example.com/cat.png"));
        assertEquals("image/png", DataUris.mimeTypeByExtension("https://example.com/cat.PNG?size=large#top"));
        assertEquals("image/webp", DataUris.mimeTypeByExtension("gs://bucket/images/dog.webp"));
        assertEquals("image/gif", DataUris.mimeTypeByExtension("https://example.com/a.b/anim.gif"));
    }

    @Test
    void shouldDefaultToJpegWhenExtensionUnknown() {
        assertEquals("image/jpeg", DataUris.mimeTypeByExtension("https://example.com/image"));
        assertEquals("image/jpeg", DataUris.mimeTypeByExtension("https://example.com/v1.2/image"));
        assertEquals("image/jpeg", DataUris.mimeTypeByExtension("https://example.com/file.unknownext"));
        assertEquals("image/jpeg", DataUris.mimeTypeByExtension("https://example.com/file."));
    }
}
