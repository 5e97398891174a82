package com.gentoro.docsmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.docsmcp.docs.batch.BatchOperationManager;
import com.gentoro.docsmcp.docs.batch.BatchResult;
import com.gentoro.docsmcp.docs.edit.CompiledEdit;
import com.gentoro.docsmcp.docs.edit.EditCompiler;
import com.gentoro.docsmcp.docs.edit.TextEditIntent;
import com.gentoro.docsmcp.docs.header.HeaderFooterManager;
import com.gentoro.docsmcp.docs.header.HeaderFooterResult;
import com.gentoro.docsmcp.docs.header.HeaderFooterVariant;
import com.gentoro.docsmcp.docs.header.SectionType;
import com.gentoro.docsmcp.docs.request.TextStyle;
import com.gentoro.docsmcp.docs.service.BatchUpdateResponse;
import com.gentoro.docsmcp.docs.service.DocumentService;
import com.gentoro.docsmcp.docs.structure.DocumentStructureParser;
import com.gentoro.docsmcp.docs.structure.DocumentTextExtractor;
import com.gentoro.docsmcp.docs.structure.StructureReporter;
import com.gentoro.docsmcp.docs.table.TableCreationResult;
import com.gentoro.docsmcp.docs.table.TableOperationManager;
import com.gentoro.docsmcp.docs.validation.DocumentValidator;
import com.gentoro.docsmcp.exception.ExecutionException;
import com.gentoro.docsmcp.exception.NotFoundException;
import com.gentoro.docsmcp.exception.ValidationException;
import com.gentoro.docsmcp.utility.JacksonUtility;
import java.util.List;
import java.util.function.Supplier;
import org.apache.commons.configuration2.Configuration;

/**
 * The four document tools. Each call reads its arguments, runs one high-level operation against
 * the document service and answers with a text description ending in the document's web link.
 *
 * <p>Invalid arguments surface as {@link ValidationException} before anything is sent. Every other
 * failure is wrapped in an {@link ExecutionException} whose message starts with the tool name.
 */
public class DocsTools {
  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(DocsTools.class);

  public static final String GET_DOC_CONTENT = "get_doc_content";
  public static final String MODIFY_DOC_CONTENT = "modify_doc_content";
  public static final String INSERT_DOC_ELEMENTS = "insert_doc_elements";
  public static final String MANAGE_DOC_OPERATIONS = "manage_doc_operations";

  static final String DEFAULT_WEB_LINK_TEMPLATE = "https://docs.google.com/document/d/%s/edit";
  static final String DOCUMENT_MIME_TYPE = "application/vnd.google-apps.document";

  private final DocumentService documentService;
  private final String webLinkTemplate;
  private final DocumentValidator validator;
  private final EditCompiler compiler;
  private final DocumentTextExtractor textExtractor;
  private final StructureReporter structureReporter;
  private final TableOperationManager tableManager;
  private final HeaderFooterManager headerFooterManager;
  private final BatchOperationManager batchManager;

  public DocsTools(DocumentService documentService, Configuration configuration) {
    this.documentService = documentService;
    this.webLinkTemplate =
        configuration.getString("docs.web-link-template", DEFAULT_WEB_LINK_TEMPLATE);
    this.validator = new DocumentValidator();
    this.compiler = new EditCompiler(validator);
    this.textExtractor = new DocumentTextExtractor();
    this.structureReporter = new StructureReporter(new DocumentStructureParser());
    this.tableManager = new TableOperationManager(documentService, validator);
    this.headerFooterManager = new HeaderFooterManager(documentService, validator);
    this.batchManager = new BatchOperationManager(documentService, validator);
  }

  /** Title, id and link, then the text of the main body and every tab. */
  public String getDocContent(ToolArguments arguments) {
    String documentId = documentId(arguments);
    return run(
        GET_DOC_CONTENT,
        () -> {
          JsonNode document = documentService.getDocument(documentId, true);
          String title = document.path("title").asText("Untitled Document");
          return "File: \""
              + title
              + "\" (ID: "
              + documentId
              + ", Type: "
              + DOCUMENT_MIME_TYPE
              + ")\nLink: "
              + webLink(documentId)
              + "\n\n--- CONTENT ---\n"
              + textExtractor.extract(document);
        });
  }

  /** Dispatches on {@code payload.operation}: edit_text, find_replace or headers_footers. */
  public String modifyDocContent(ToolArguments arguments) {
    String documentId = documentId(arguments);
    ToolArguments payload = arguments.object("payload", MODIFY_DOC_CONTENT);
    String operation = payload.requiredString("operation", MODIFY_DOC_CONTENT);
    return switch (operation) {
      case "edit_text" -> editText(documentId, payload);
      case "find_replace" -> findReplace(documentId, payload);
      case "headers_footers" -> headersFooters(documentId, payload);
      default -> throw invalidOperation(operation, "edit_text, find_replace, headers_footers");
    };
  }

  private String editText(String documentId, ToolArguments payload) {
    String text = payload.string("text");
    CompiledEdit edit =
        compiler.compileTextEdit(
            new TextEditIntent(
                payload.integer("start_index"),
                payload.integer("end_index"),
                text,
                new TextStyle(
                    payload.bool("bold"),
                    payload.bool("italic"),
                    payload.bool("underline"),
                    payload.integer("font_size"),
                    payload.string("font_family"))));
    return run(
        MODIFY_DOC_CONTENT,
        () -> {
          documentService.submit(documentId, edit.operations());
          String textInfo =
              text != null ? " Text length: " + text.length() + " characters." : "";
          return edit.summary()
              + " in document "
              + documentId
              + "."
              + textInfo
              + " Link: "
              + webLink(documentId);
        });
  }

  private String findReplace(String documentId, ToolArguments payload) {
    String find = payload.requiredString("find_text", "find_replace operation");
    String replace = payload.string("replace_text");
    if (replace == null) {
      throw new ValidationException("'replace_text' is required for find_replace operation");
    }
    CompiledEdit edit =
        compiler.compileFindReplace(find, replace, payload.bool("match_case", false));
    return run(
        MODIFY_DOC_CONTENT,
        () -> {
          BatchUpdateResponse response = documentService.submit(documentId, edit.operations());
          return "Replaced "
              + response.occurrencesChanged()
              + " occurrence(s) of '"
              + find
              + "' with '"
              + replace
              + "' in document "
              + documentId
              + ". Link: "
              + webLink(documentId);
        });
  }

  private String headersFooters(String documentId, ToolArguments payload) {
    SectionType type = SectionType.parse(payload.string("section_type"));
    HeaderFooterVariant variant = HeaderFooterVariant.parse(payload.string("header_footer_type"));
    String content = payload.requiredString("content", "headers_footers operation");
    return run(
        MODIFY_DOC_CONTENT,
        () -> {
          HeaderFooterResult result =
              headerFooterManager.upsert(documentId, type, variant, content);
          return result.describe() + ". Link: " + webLink(documentId);
        });
  }

  /** {@code operation}: {@code text_elements}, {@code image} or {@code table}. */
  public String insertDocElements(ToolArguments arguments) {
    String documentId = documentId(arguments);
    String operation = arguments.requiredString("operation", INSERT_DOC_ELEMENTS);
    Integer index = arguments.integer("index");
    validator.validateIndex(index, "index");
    return switch (operation) {
      case "text_elements" -> insertTextElement(documentId, index, arguments);
      case "image" -> insertImage(documentId, index, arguments);
      case "table" -> insertTable(documentId, index, arguments);
      default -> throw invalidOperation(operation, "text_elements, image, table");
    };
  }

  private String insertTextElement(String documentId, int index, ToolArguments arguments) {
    String elementType = arguments.requiredString("element_type", "text_elements operation");
    CompiledEdit edit =
        switch (elementType) {
          case "table" ->
              compiler.compileEmptyTable(
                  index, arguments.integer("rows"), arguments.integer("columns"));
          case "list" ->
              compiler.compileListItem(
                  index,
                  arguments.string("text"),
                  arguments.requiredString("list_type", "list insertion"));
          case "page_break" -> compiler.compilePageBreak(index);
          default ->
              throw new ValidationException(
                  "Unsupported element type '"
                      + elementType
                      + "'. Supported types: 'table', 'list', 'page_break'");
        };
    return submitCompiled(INSERT_DOC_ELEMENTS, documentId, edit);
  }

  private String insertImage(String documentId, int index, ToolArguments arguments) {
    CompiledEdit edit =
        compiler.compileImage(
            index,
            arguments.string("image_source"),
            arguments.integer("width"),
            arguments.integer("height"));
    return submitCompiled(INSERT_DOC_ELEMENTS, documentId, edit);
  }

  private String insertTable(String documentId, int index, ToolArguments arguments) {
    List<List<String>> data = arguments.table("table_data");
    if (data == null) {
      throw new ValidationException("'table_data' is required for table operation");
    }
    validator.validateTableData(data);
    boolean boldHeaders = arguments.bool("bold_headers", true);
    return run(
        INSERT_DOC_ELEMENTS,
        () -> {
          TableCreationResult result =
              tableManager.createAndPopulate(documentId, index, data, boldHeaders);
          return "Created "
              + result.rows()
              + "x"
              + result.columns()
              + " table at index "
              + result.tableIndex()
              + (result.retried() ? " (retried one position earlier)" : "")
              + " with "
              + result.cellsPopulated()
              + " populated cell(s) in document "
              + documentId
              + ". Link: "
              + webLink(documentId);
        });
  }

  /**
   * {@code operation}: {@code batch_update}, {@code inspect_structure} or {@code debug_table}.
   */
  public String manageDocOperations(ToolArguments arguments) {
    String documentId = documentId(arguments);
    String operation = arguments.requiredString("operation", MANAGE_DOC_OPERATIONS);
    return switch (operation) {
      case "batch_update" -> batchUpdate(documentId, arguments);
      case "inspect_structure" -> inspectStructure(documentId, arguments.bool("detailed", false));
      case "debug_table" -> debugTable(documentId, arguments);
      default ->
          throw invalidOperation(operation, "batch_update, inspect_structure, debug_table");
    };
  }

  private String batchUpdate(String documentId, ToolArguments arguments) {
    List<JsonNode> operations = arguments.array("operations");
    if (operations == null || operations.isEmpty()) {
      throw new ValidationException("'operations' is required for batch_update operation");
    }
    return run(
        MANAGE_DOC_OPERATIONS,
        () -> {
          BatchResult result = batchManager.execute(documentId, operations);
          StringBuilder message =
              new StringBuilder(result.message())
                  .append(" on document ")
                  .append(documentId)
                  .append(". API replies: ")
                  .append(result.repliesCount())
                  .append(". Link: ")
                  .append(webLink(documentId));
          if (result.replies().stream().anyMatch(r -> !"empty".equals(r.kind()))) {
            message
                .append("\n\nReplies:\n")
                .append(JacksonUtility.toPrettyJson(result.replies()));
          }
          return message.toString();
        });
  }

  private String inspectStructure(String documentId, boolean detailed) {
    return run(
        MANAGE_DOC_OPERATIONS,
        () -> {
          JsonNode document = documentService.getDocument(documentId, false);
          JsonNode report =
              detailed ? structureReporter.detailed(document) : structureReporter.basic(document);
          return "Document structure analysis for "
              + documentId
              + ":\n\n"
              + JacksonUtility.toPrettyJson(report)
              + "\n\nLink: "
              + webLink(documentId);
        });
  }

  private String debugTable(String documentId, ToolArguments arguments) {
    Integer tableIndex = arguments.integer("table_index");
    int index = tableIndex == null ? 0 : tableIndex;
    validator.validateIndex(index, "table_index");
    return run(
        MANAGE_DOC_OPERATIONS,
        () -> {
          JsonNode document = documentService.getDocument(documentId, false);
          JsonNode report = structureReporter.debugTable(document, index);
          return "Table structure debug for table "
              + index
              + ":\n\n"
              + JacksonUtility.toPrettyJson(report)
              + "\n\nLink: "
              + webLink(documentId);
        });
  }

  private String submitCompiled(String tool, String documentId, CompiledEdit edit) {
    return run(
        tool,
        () -> {
          documentService.submit(documentId, edit.operations());
          return edit.summary() + " in document " + documentId + ". Link: " + webLink(documentId);
        });
  }

  private String documentId(ToolArguments arguments) {
    String documentId = arguments.string("document_id");
    validator.validateDocumentId(documentId);
    return documentId.trim();
  }

  String webLink(String documentId) {
    return String.format(webLinkTemplate, documentId);
  }

  private static ValidationException invalidOperation(String operation, String supported) {
    return new ValidationException(
        "Invalid operation '" + operation + "'. Supported operations: " + supported);
  }

  /**
   * Runs the service-facing part of a tool. Validation and lookup failures pass through as they
   * are; anything else is reported as a failure of {@code tool}.
   */
  private <T> T run(String tool, Supplier<T> body) {
    try {
      return body.get();
    } catch (ValidationException | NotFoundException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("{} failed", tool, e);
      throw ExecutionException.forOperation(tool, e);
    }
  }
}
