package io.intellixity.sealquery.identity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.sealquery.util.Json;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TokenAuthorizer} backed by the token service's {@code POST /api/authorize} endpoint.
 * The endpoint defaults to {@value #DEFAULT_ENDPOINT} and can be overridden with {@code CS_CTS_ENDPOINT}.
 */
public final class CtsTokenAuthorizer implements TokenAuthorizer {
  public static final String DEFAULT_ENDPOINT = "https://ap-southeast-2.aws.auth.viturhosted.net";
  public static final String ENDPOINT_ENV = "CS_CTS_ENDPOINT";

  private final URI authorizeUri;
  private final HttpClient http;
  private final ObjectMapper mapper;

  public CtsTokenAuthorizer(URI endpoint) {
    this(endpoint, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), Json.mapper());
  }

  public CtsTokenAuthorizer(URI endpoint, HttpClient http, ObjectMapper mapper) {
    Objects.requireNonNull(endpoint, "endpoint");
    String base = endpoint.toString();
    this.authorizeUri = URI.create((base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/api/authorize");
    this.http = Objects.requireNonNull(http, "http");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public static CtsTokenAuthorizer fromEnvironment() {
    String endpoint = System.getenv(ENDPOINT_ENV);
    return new CtsTokenAuthorizer(URI.create(endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint));
  }

  @Override
  public SessionToken authorize(String workspaceId, String jwt) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("workspaceId", workspaceId);
    body.put("oidcToken", jwt);

    HttpResponse<String> response;
    try {
      HttpRequest request = HttpRequest.newBuilder(authorizeUri)
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
          .build();
      response = http.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new LockContextException("Failed to reach the token service: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LockContextException("Interrupted while waiting for the token service", e);
    }

    if (response.statusCode() / 100 != 2) {
      throw new LockContextException("Token service returned HTTP " + response.statusCode());
    }
    return parse(response.body());
  }

  private SessionToken parse(String json) {
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new LockContextException("Token service returned malformed JSON", e);
    }
    JsonNode token = root == null ? null : root.get("accessToken");
    if (token == null || !token.isTextual() || token.asText().isEmpty()) {
      throw new LockContextException("The token service response did not contain an access token");
    }
    JsonNode expiry = root.get("expiry");
    return new SessionToken(token.asText(), expiry == null ? 0L : expiry.asLong());
  }
}
