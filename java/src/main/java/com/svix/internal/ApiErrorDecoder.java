package com.svix.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.svix.ApiException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Decodes Svix error payloads ({@code {"code": ..., "detail": ...}}) into {@link ApiException}.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static ApiException decode(int statusCode, InputStream bodyStream) throws IOException {
        if (bodyStream == null) {
            return new ApiException(statusCode, null, null);
        }

        byte[] bytes = bodyStream.readAllBytes();
        if (bytes.length == 0) {
            return new ApiException(statusCode, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            if (node == null || !node.isObject()) {
                return new ApiException(statusCode, null, new String(bytes, StandardCharsets.UTF_8));
            }
            String code = node.hasNonNull("code") ? node.get("code").asText() : null;
            String detail = null;
            JsonNode detailNode = node.path("detail");
            if (detailNode.isTextual()) {
                detail = detailNode.asText();
            } else if (detailNode.isContainerNode()) {
                // 422 responses carry a list of field errors
                detail = MAPPER.writeValueAsString(detailNode);
            }
            return new ApiException(statusCode, code, detail);
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8);
            return new ApiException(statusCode, null, fallback);
        }
    }
}
