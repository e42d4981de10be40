package com.ritbot.hft.rit.http;

import lombok.NonNull;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds requests against the venue base URI with the API key attached.
 */
public final class HttpRequestFactory {

  public static final String API_KEY_HEADER = "X-API-Key";

  private final URI baseUri;
  private final String apiKey;

  public HttpRequestFactory(@NonNull URI baseUri, String apiKey) {
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
    this.apiKey = apiKey == null ? "" : apiKey;
  }

  public HttpRequest.Builder request(String path, Map<String, String> query) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri(path, query))
        .header("Accept", "application/json");
    if (!apiKey.isBlank()) {
      builder.header(API_KEY_HEADER, apiKey);
    }
    return builder;
  }

  URI uri(String path, Map<String, String> query) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String normalizedPath = path == null || path.isBlank() ? "" : (path.startsWith("/") ? path : "/" + path);
    if (query == null || query.isEmpty()) {
      return URI.create(base + normalizedPath);
    }
    StringJoiner qs = new StringJoiner("&");
    query.forEach((k, v) -> {
      if (k != null && v != null) {
        qs.add(encode(k) + "=" + encode(v));
      }
    });
    return URI.create(base + normalizedPath + "?" + qs);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
