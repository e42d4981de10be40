package com.ritbot.hft.rit.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ritbot.hft.rit.client.ExchangeException;
import lombok.NonNull;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Sends venue requests and maps transport failures onto {@link ExchangeException}.
 */
public class ExchangeHttpTransport {

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RequestRateLimiter rateLimiter;

  public ExchangeHttpTransport(
      @NonNull HttpClient httpClient,
      @NonNull ObjectMapper objectMapper,
      @NonNull RequestRateLimiter rateLimiter
  ) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.rateLimiter = rateLimiter;
  }

  public <T> T sendJson(HttpRequest request, Class<T> type) {
    HttpResponse<String> response = send(request);
    if (!isSuccess(response.statusCode())) {
      throw ExchangeException.rejected(describe(request), response.statusCode(), response.body());
    }
    String body = response.body();
    if (body == null || body.isBlank()) {
      throw ExchangeException.malformed(describe(request), "empty body");
    }
    try {
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw ExchangeException.malformed(describe(request), e.getMessage());
    }
  }

  /**
   * Sends a request whose only result is its status code.
   */
  public int sendForStatus(HttpRequest request) {
    return send(request).statusCode();
  }

  public static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }

  private HttpResponse<String> send(HttpRequest request) {
    rateLimiter.acquire();
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw ExchangeException.transientFailure(describe(request), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw ExchangeException.transientFailure(describe(request), e);
    }
  }

  private static String describe(HttpRequest request) {
    return request.method() + " " + request.uri().getPath();
  }
}
