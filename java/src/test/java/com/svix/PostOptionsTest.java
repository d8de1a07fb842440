package com.svix;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PostOptionsTest {

    @Test
    void emptyOptionsHaveNoOverrides() {
        PostOptions options = PostOptions.empty();

        assertTrue(options.isEmpty());
        assertNull(options.getIdempotencyKey());
        assertNull(options.getTimeout());
        assertTrue(options.getHeaders().isEmpty());
        assertEquals(options, PostOptions.builder().build());
    }

    @Test
    void builderCopiesHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-a", "1");
        PostOptions options = PostOptions.builder()
            .headers(headers)
            .header("x-a", "2")
            .timeout(Duration.ofSeconds(1))
            .build();
        headers.put("x-b", "3");

        assertFalse(options.isEmpty());
        assertEquals(Map.of("x-a", "2"), options.getHeaders());
        assertThrows(UnsupportedOperationException.class, () -> options.getHeaders().put("x-c", "4"));
    }

    @Test
    void toStringOmitsHeaderValues() {
        PostOptions options = PostOptions.builder().header("authorization", "secret").build();

        assertFalse(options.toString().contains("secret"));
    }

    @Test
    void rejectsHeadersManagedByHttpClient() {
        PostOptions.Builder builder = PostOptions.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.header("Host", "example.com"));
        assertThrows(IllegalArgumentException.class, () -> builder.header("content-length", "10"));
        assertThrows(IllegalArgumentException.class, () -> builder.headers(Map.of("Connection", "close")));
        assertTrue(builder.build().getHeaders().isEmpty());
    }
}
