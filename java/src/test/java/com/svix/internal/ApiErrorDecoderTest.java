package com.svix.internal;

import com.svix.ApiException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ApiErrorDecoderTest {

    @Test
    void decodesCodeAndDetail() throws Exception {
        ApiException ex = ApiErrorDecoder.decode(404, stream("{\"code\":\"not_found\",\"detail\":\"Entity not found\"}"));

        assertEquals(404, ex.getStatusCode());
        assertEquals("not_found", ex.getCode());
        assertEquals("Entity not found", ex.getMessage());
    }

    @Test
    void rendersValidationDetailListAsJson() throws Exception {
        ApiException ex = ApiErrorDecoder.decode(422,
            stream("{\"detail\":[{\"loc\":[\"path\",\"app_id\"],\"msg\":\"invalid\",\"type\":\"value_error\"}]}"));

        assertEquals(422, ex.getStatusCode());
        assertNull(ex.getCode());
        assertTrue(ex.getMessage().startsWith("[{"));
        assertTrue(ex.getMessage().contains("value_error"));
    }

    @Test
    void usesDefaultMessageForEmptyBody() throws Exception {
        ApiException empty = ApiErrorDecoder.decode(500, stream(""));
        assertEquals("Svix request failed with status 500", empty.getMessage());

        ApiException missing = ApiErrorDecoder.decode(503, null);
        assertEquals(503, missing.getStatusCode());

        ApiException codeOnly = ApiErrorDecoder.decode(409, stream("{\"code\":\"conflict\"}"));
        assertEquals("Svix request failed with status 409 (conflict)", codeOnly.getMessage());
    }

    @Test
    void fallsBackToRawBodyWhenNotJson() throws Exception {
        ApiException ex = ApiErrorDecoder.decode(502, stream("<html>bad gateway</html>"));

        assertEquals("<html>bad gateway</html>", ex.getMessage());
        assertNull(ex.getCode());
    }

    private static ByteArrayInputStream stream(String body) {
        return new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8));
    }
}
