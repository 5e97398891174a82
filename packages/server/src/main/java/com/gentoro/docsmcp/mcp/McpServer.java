package com.gentoro.docsmcp.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.docsmcp.DocsMcp;
import com.gentoro.docsmcp.exception.ExceptionUtil;
import com.gentoro.docsmcp.tools.DocsTools;
import com.gentoro.docsmcp.tools.ToolArguments;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Objects;
import java.util.function.Function;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Publishes the document tools over MCP Streamable HTTP on the shared Jetty server.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) – servlet path; default: "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean) – reject HTTP DELETE; default: false
 *   <li><b>http.mcp.server.name</b> (string) – server name reported to clients; default:
 *       "docs-mcp"
 *   <li><b>http.mcp.server.version</b> (string) – server version reported to clients; default:
 *       "1.0.0"
 * </ul>
 *
 * <p>Tool calls run synchronously on the request thread. A failed call is answered with an error
 * result whose text starts with {@code "Error: "}.
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(McpServer.class);

  static final String ERROR_PREFIX = "Error: ";

  private final DocsMcp docsMcp;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(DocsMcp docsMcp) {
    this.docsMcp = docsMcp;
  }

  /** Registers the MCP servlet on the shared context handler; Jetty's lifecycle stays outside. */
  public void register() {
    String endpoint =
        normalizeEndpoint(docsMcp.configuration().getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = docsMcp.configuration().getBoolean("http.mcp.disallow-delete", false);
    String serverName = docsMcp.configuration().getString("http.mcp.server.name", "docs-mcp");
    String serverVersion = docsMcp.configuration().getString("http.mcp.server.version", "1.0.0");

    var json = new JacksonMcpJsonMapper(new ObjectMapper());
    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(json)
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    DocsTools tools = docsMcp.docsTools();
    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName, serverVersion)
            .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
            .tools(
                toolSpecification(ToolDefinitions.getDocContent(), tools::getDocContent),
                toolSpecification(ToolDefinitions.modifyDocContent(), tools::modifyDocContent),
                toolSpecification(ToolDefinitions.insertDocElements(), tools::insertDocElements),
                toolSpecification(
                    ToolDefinitions.manageDocOperations(), tools::manageDocOperations))
            .build();

    docsMcp
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(servletTransport), endpoint);

    log.info(
        "MCP servlet registered at http://localhost:{}{}",
        docsMcp.httpServer().getPort(),
        endpoint);
  }

  static McpServerFeatures.SyncToolSpecification toolSpecification(
      McpSchema.Tool tool, Function<ToolArguments, String> handler) {
    return McpServerFeatures.SyncToolSpecification.builder()
        .tool(tool)
        .callHandler(
            (srv, request) ->
                invoke(tool.name(), handler, ToolArguments.of(request.arguments())))
        .build();
  }

  static McpSchema.CallToolResult invoke(
      String toolName, Function<ToolArguments, String> handler, ToolArguments arguments) {
    try {
      log.info("[{}] invoked", toolName);
      return new McpSchema.CallToolResult(handler.apply(arguments), false);
    } catch (Exception e) {
      log.warn("[{}] failed: {}", toolName, e.getMessage());
      log.debug("[{}] failure detail", toolName, e);
      return new McpSchema.CallToolResult(
          ERROR_PREFIX
              + Objects.requireNonNullElse(
                  e.getMessage(), ExceptionUtil.formatCompactStackTrace(e)),
          true);
    }
  }

  @Override
  public void close() {
    if (servletTransport != null) {
      try {
        servletTransport.destroy();
      } finally {
        servletTransport = null;
      }
    }
    mcpServer = null;
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
