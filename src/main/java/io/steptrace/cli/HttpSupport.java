package io.steptrace.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import io.steptrace.util.Jsons;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

final class HttpSupport {
    private HttpSupport() {
    }

    static String readBody(HttpExchange exchange) throws IOException {
        byte[] raw = exchange.getRequestBody().readAllBytes();
        return new String(raw, StandardCharsets.UTF_8).trim();
    }

    /**
     * Query parameters merged with a JSON or form body for write methods.
     */
    static Map<String, String> parseParams(HttpExchange exchange) throws IOException {
        Map<String, String> out = new LinkedHashMap<>(parseQuery(exchange.getRequestURI()));
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            return out;
        }
        String body = readBody(exchange);
        if (body.isEmpty()) {
            return out;
        }
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        String normalized = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (normalized.contains("application/json")) {
            JsonNode node = Jsons.mapper().readTree(body);
            if (node != null && node.isObject()) {
                node.fieldNames().forEachRemaining(key -> {
                    JsonNode value = node.path(key);
                    if (value.isNull()) {
                        out.put(key, "");
                    } else if (value.isValueNode()) {
                        out.put(key, value.asText());
                    } else {
                        out.put(key, value.toString());
                    }
                });
            }
            return out;
        }
        out.putAll(parseQueryString(body));
        return out;
    }

    static Map<String, String> parseQuery(URI uri) {
        return parseQueryString(uri.getRawQuery());
    }

    static Map<String, String> parseQueryString(String query) {
        Map<String, String> out = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                out.put(key, value);
            }
        }
        return out;
    }

    static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static void writeError(HttpExchange exchange, int status, String message) throws IOException {
        writeJson(exchange, Map.of("error", message == null ? "error" : message), status);
    }

    static int parseIntOrDefault(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    static int clamp(int value, int min, int max) {
        if (value < min) {
            return min;
        }
        return Math.min(value, max);
    }

    static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
