package com.gentoro.docsmcp.docs.service;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.docsmcp.docs.request.EditRequests;
import com.gentoro.docsmcp.exception.DocumentServiceException;
import com.gentoro.docsmcp.exception.NetworkException;
import com.gentoro.docsmcp.exception.ValidationException;
import com.gentoro.docsmcp.http.OkHttpFactory;
import com.gentoro.docsmcp.utility.JacksonUtility;
import java.util.List;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GoogleDocsClientTest {

  private MockWebServer server;
  private GoogleDocsClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("docs.api.access-token", "ya29.test-token");
    OkHttpClient httpClient = OkHttpFactory.create(cfg);
    client = new GoogleDocsClient(httpClient, server.url("/").toString());
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  private static MockResponse json(int code, String body) {
    return new MockResponse()
        .setResponseCode(code)
        .setHeader("Content-Type", "application/json")
        .setBody(body);
  }

  @Test
  @DisplayName("documents are fetched with tab content and the bearer token")
  void getDocument() throws Exception {
    server.enqueue(json(200, "{\"documentId\":\"doc123\",\"title\":\"Plan\"}"));

    JsonNode document = client.getDocument("doc123", true);

    assertEquals("Plan", document.path("title").asText());
    RecordedRequest request = server.takeRequest();
    assertEquals("GET", request.getMethod());
    assertEquals("/v1/documents/doc123?includeTabsContent=true", request.getPath());
    assertEquals("Bearer ya29.test-token", request.getHeader("Authorization"));
  }

  @Test
  @DisplayName("a batch is posted as one requests array and its replies are kept in order")
  void batchUpdate() throws Exception {
    server.enqueue(
        json(
            200,
            "{\"documentId\":\"doc123\",\"replies\":[{},"
                + "{\"replaceAllText\":{\"occurrencesChanged\":2}}]}"));

    BatchUpdateResponse response =
        client.batchUpdate(
            "doc123",
            List.of(
                EditRequests.insertText(1, "Hi").toRequest(),
                EditRequests.findReplace("a", "b", true).toRequest()));

    RecordedRequest request = server.takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals("/v1/documents/doc123:batchUpdate", request.getPath());
    JsonNode body = JacksonUtility.readTree(request.getBody().readUtf8());
    assertEquals(2, body.path("requests").size());
    assertEquals("Hi", body.path("requests").get(0).path("insertText").path("text").asText());
    assertEquals(2, response.repliesCount());
    assertEquals(2, response.occurrencesChanged());
  }

  @Test
  @DisplayName("service errors carry status and message, and boundary rejections are recognized")
  void boundaryError() {
    server.enqueue(
        json(
            400,
            "{\"error\":{\"code\":400,\"status\":\"INVALID_ARGUMENT\",\"message\":"
                + "\"Invalid requests[0].insertTable: Index 50 must be less than the end index"
                + " of the referenced segment, 50.\"}}"));

    DocumentServiceException e =
        assertThrows(
            DocumentServiceException.class,
            () ->
                client.batchUpdate(
                    "doc123", List.of(EditRequests.insertTable(50, 1, 1).toRequest())));

    assertEquals(400, e.getHttpStatus());
    assertEquals("INVALID_ARGUMENT", e.getServiceStatus());
    assertTrue(e.isBoundaryViolation());
  }

  @Test
  void permissionError() {
    server.enqueue(
        json(
            403,
            "{\"error\":{\"code\":403,\"status\":\"PERMISSION_DENIED\","
                + "\"message\":\"The caller does not have permission\"}}"));

    DocumentServiceException e =
        assertThrows(DocumentServiceException.class, () -> client.getDocument("doc123", false));

    assertEquals("The caller does not have permission", e.getMessage());
    assertFalse(e.isBoundaryViolation());
  }

  @Test
  @DisplayName("a non-JSON error body falls back to the HTTP status")
  void plainTextError() {
    server.enqueue(new MockResponse().setResponseCode(502).setBody("Bad gateway"));

    DocumentServiceException e =
        assertThrows(DocumentServiceException.class, () -> client.getDocument("doc123", false));

    assertEquals("HTTP 502: Bad gateway", e.getMessage());
    assertNull(e.getServiceStatus());
  }

  @Test
  void unreachableService() {
    server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

    assertThrows(NetworkException.class, () -> client.getDocument("doc123", false));
  }

  @Test
  void requiresDocumentId() {
    assertThrows(ValidationException.class, () -> client.getDocument(" ", false));
    assertThrows(
        ValidationException.class,
        () -> new GoogleDocsClient(new OkHttpClient(), "not a url"));
  }
}
