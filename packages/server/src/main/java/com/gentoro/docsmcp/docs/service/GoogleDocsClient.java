package com.gentoro.docsmcp.docs.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docsmcp.exception.DocumentServiceException;
import com.gentoro.docsmcp.exception.NetworkException;
import com.gentoro.docsmcp.exception.ValidationException;
import com.gentoro.docsmcp.utility.JacksonUtility;
import java.io.IOException;
import java.util.List;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link DocumentService} over the Docs REST API ({@code GET /v1/documents/{id}} and {@code POST
 * /v1/documents/{id}:batchUpdate}).
 *
 * <p>The supplied {@link OkHttpClient} carries base-url, credential and logging interceptors (see
 * {@link com.gentoro.docsmcp.http.OkHttpFactory}); this class only builds paths and maps
 * responses. Error bodies follow the Google API error envelope {@code {"error": {"code",
 * "message", "status"}}}. Nothing is retried here.
 */
public class GoogleDocsClient implements DocumentService {
  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(GoogleDocsClient.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final HttpUrl baseUrl;

  public GoogleDocsClient(OkHttpClient httpClient, String baseUrl) {
    this.httpClient = httpClient;
    HttpUrl parsed = HttpUrl.parse(baseUrl);
    if (parsed == null) {
      throw new ValidationException("Invalid document service base URL: " + baseUrl);
    }
    this.baseUrl = parsed;
  }

  @Override
  public JsonNode getDocument(String documentId, boolean includeTabsContent) {
    HttpUrl url =
        documentUrl(documentId)
            .addQueryParameter("includeTabsContent", String.valueOf(includeTabsContent))
            .build();
    log.debug("Fetching document {} (tabs: {})", documentId, includeTabsContent);
    return execute(new Request.Builder().url(url).get().build(), "get document " + documentId);
  }

  @Override
  public BatchUpdateResponse batchUpdate(String documentId, List<? extends JsonNode> requests) {
    ObjectNode payload = JacksonUtility.getJsonMapper().createObjectNode();
    ArrayNode array = payload.putArray("requests");
    requests.forEach(array::add);

    // The ":batchUpdate" suffix belongs to the id path segment.
    HttpUrl url =
        baseUrl
            .newBuilder()
            .addPathSegment("v1")
            .addPathSegment("documents")
            .addPathSegment(requireId(documentId) + ":batchUpdate")
            .build();
    Request request =
        new Request.Builder()
            .url(url)
            .post(RequestBody.create(JacksonUtility.toJson(payload), JSON))
            .build();
    log.debug("Submitting batch of {} request(s) to document {}", requests.size(), documentId);
    JsonNode response = execute(request, "batch update " + documentId);
    return BatchUpdateResponse.fromJson(response);
  }

  private HttpUrl.Builder documentUrl(String documentId) {
    return baseUrl
        .newBuilder()
        .addPathSegment("v1")
        .addPathSegment("documents")
        .addPathSegment(requireId(documentId));
  }

  private static String requireId(String documentId) {
    if (documentId == null || documentId.isBlank()) {
      throw new ValidationException("Document ID is required");
    }
    return documentId.trim();
  }

  private JsonNode execute(Request request, String description) {
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String content = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw toServiceException(response.code(), content);
      }
      return JacksonUtility.readTree(content);
    } catch (IOException e) {
      throw new NetworkException("Document service unreachable during " + description, e);
    }
  }

  static DocumentServiceException toServiceException(int httpStatus, String content) {
    JsonNode error = JacksonUtility.getJsonMapper().createObjectNode();
    try {
      error = JacksonUtility.readTree(content).path("error");
    } catch (RuntimeException e) {
      log.debug("Error body is not JSON: {}", content);
    }
    String status = error.path("status").isTextual() ? error.path("status").asText() : null;
    String message =
        error.path("message").isTextual()
            ? error.path("message").asText()
            : "HTTP " + httpStatus + (content.isBlank() ? "" : ": " + content);
    return new DocumentServiceException(httpStatus, status, message);
  }
}
