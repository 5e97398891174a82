package com.gentoro.docsmcp.docs.edit;

import com.gentoro.docsmcp.docs.index.DocumentIndex;
import com.gentoro.docsmcp.docs.index.IndexRange;
import com.gentoro.docsmcp.docs.request.BulletPreset;
import com.gentoro.docsmcp.docs.request.EditOperation;
import com.gentoro.docsmcp.docs.request.EditRequests;
import com.gentoro.docsmcp.docs.request.InsertText;
import com.gentoro.docsmcp.docs.validation.DocumentValidator;
import com.gentoro.docsmcp.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns high-level edit intents into ordered primitive operations.
 *
 * <p>The service applies a batch sequentially and every operation sees the document as left by the
 * ones before it. Each sequence produced here is therefore laid out so that later operations
 * already account for the index shift of earlier ones, and nothing ever touches position 0.
 *
 * <p>The compiler is pure: it never calls the service and the same intent always yields the same
 * operations.
 */
public class EditCompiler {

  static final String DEFAULT_LIST_ITEM = "List item";
  static final String DRIVE_DOWNLOAD_URL = "https://drive.google.com/uc?id=";

  private final DocumentValidator validator;

  public EditCompiler(DocumentValidator validator) {
    this.validator = validator;
  }

  /**
   * Compiles an insert, replace and/or format intent.
   *
   * <ul>
   *   <li>replace starting at 0: {@code [insert(1, text), delete(1+len, end+len)]}
   *   <li>replace starting after 0: {@code [delete(start, end), insert(start, text)]}
   *   <li>insert: {@code [insert(start, text)]}, start 0 redirected to 1
   *   <li>format: appended last, over the new text if any, otherwise over the caller's range
   * </ul>
   */
  public CompiledEdit compileTextEdit(TextEditIntent intent) {
    validate(intent);

    int start = intent.startIndex();
    Integer end = intent.endIndex();
    List<EditOperation> operations = new ArrayList<>();
    List<String> descriptions = new ArrayList<>();
    IndexRange newText = null;

    if (intent.isReplacement()) {
      if (start == DocumentIndex.SECTION_MARKER) {
        InsertText insert = EditRequests.insertText(DocumentIndex.FIRST_WRITABLE, intent.text());
        operations.add(insert);
        // the old content after the marker now sits past the inserted text
        IndexRange old =
            IndexRange.of(DocumentIndex.FIRST_WRITABLE, end)
                .shift(insert.insertedRange().length());
        if (!old.isEmpty()) {
          operations.add(EditRequests.deleteRange(old.start(), old.end()));
        }
        newText = insert.insertedRange();
      } else {
        operations.add(EditRequests.deleteRange(start, end));
        InsertText insert = EditRequests.insertText(start, intent.text());
        operations.add(insert);
        newText = insert.insertedRange();
      }
      descriptions.add("Replaced text in range " + IndexRange.of(start, end));
    } else if (intent.hasText()) {
      InsertText insert = EditRequests.insertText(DocumentIndex.writable(start), intent.text());
      operations.add(insert);
      newText = insert.insertedRange();
      descriptions.add("Inserted text at index " + insert.index());
    }

    if (intent.hasStyle()) {
      IndexRange target =
          (newText != null ? newText : IndexRange.of(DocumentIndex.writable(start), end))
              .atLeastOneUnit();
      operations.add(EditRequests.formatText(target.start(), target.end(), intent.style()));
      descriptions.add("Applied formatting (" + intent.style().describe() + ") to " + target);
    }
    return new CompiledEdit(operations, descriptions);
  }

  private void validate(TextEditIntent intent) {
    if (intent.startIndex() == null) {
      throw new ValidationException("'start_index' is required");
    }
    validator.validateIndex(intent.startIndex(), "start_index");
    Integer end = intent.endIndex();
    if (end != null && end < intent.startIndex()) {
      throw new ValidationException(
          "'end_index' ("
              + end
              + ") must not be less than 'start_index' ("
              + intent.startIndex()
              + ")");
    }
    if (!intent.hasText() && !intent.hasStyle()) {
      throw new ValidationException(
          "Nothing to do: provide 'text' to insert or replace, or at least one formatting"
              + " parameter (bold, italic, underline, font_size, font_family)");
    }
    if (intent.hasText()) {
      validator.validateTextContent(intent.text(), "text");
    }
    if (intent.hasStyle()) {
      validator.validateTextFormatting(intent.style());
      if (end == null) {
        throw new ValidationException("'end_index' is required when applying formatting");
      }
      validator.validateIndexRange(intent.startIndex(), end);
    }
  }

  /**
   * One bulleted paragraph: the text plus a paragraph break, then bullets over exactly that
   * paragraph.
   */
  public CompiledEdit compileListItem(Integer index, String text, String listType) {
    validator.validateIndex(index, "index");
    String presetId = BulletPreset.resolve(listType);
    String item = text == null || text.isEmpty() ? DEFAULT_LIST_ITEM : text;
    int at = DocumentIndex.writable(index);
    InsertText insert = EditRequests.insertText(at, item + "\n");
    IndexRange paragraph = insert.insertedRange();
    return new CompiledEdit(
        List.of(insert, EditRequests.bulletList(paragraph.start(), paragraph.end(), presetId)),
        List.of(
            "Inserted "
                + listType.trim().toLowerCase(Locale.ROOT)
                + " list item at index "
                + at));
  }

  public CompiledEdit compilePageBreak(Integer index) {
    validator.validateIndex(index, "index");
    int at = DocumentIndex.writable(index);
    return new CompiledEdit(
        List.of(EditRequests.insertPageBreak(at)), List.of("Inserted page break at index " + at));
  }

  /** An empty table; population happens through the table manager. */
  public CompiledEdit compileEmptyTable(Integer index, Integer rows, Integer columns) {
    validator.validateIndex(index, "index");
    validator.validateTableDimensions(rows, columns);
    int at = DocumentIndex.writable(index);
    return new CompiledEdit(
        List.of(EditRequests.insertTable(at, rows, columns)),
        List.of("Inserted " + rows + "x" + columns + " table at index " + at));
  }

  /**
   * Inline image from an http(s) URL, or from a Drive file id which is turned into its download
   * URL.
   */
  public CompiledEdit compileImage(Integer index, String source, Integer width, Integer height) {
    validator.validateIndex(index, "index");
    if (source == null || source.isBlank()) {
      throw new ValidationException("'image_source' is required for image insertion");
    }
    if ((width != null && width <= 0) || (height != null && height <= 0)) {
      throw new ValidationException("Image 'width' and 'height' must be positive when given");
    }
    String trimmed = source.trim();
    boolean url = isHttpUrl(trimmed);
    String uri = url ? trimmed : DRIVE_DOWNLOAD_URL + trimmed;
    int at = DocumentIndex.writable(index);
    StringBuilder description =
        new StringBuilder("Inserted image from ")
            .append(url ? "URL" : "Drive file " + trimmed)
            .append(" at index ")
            .append(at);
    if (width != null || height != null) {
      description
          .append(" (")
          .append(width != null ? width : "auto")
          .append("x")
          .append(height != null ? height : "auto")
          .append(" pt)");
    }
    return new CompiledEdit(
        List.of(EditRequests.insertImage(at, uri, width, height)),
        List.of(description.toString()));
  }

  public CompiledEdit compileFindReplace(String find, String replace, boolean matchCase) {
    return new CompiledEdit(
        List.of(EditRequests.findReplace(find, replace, matchCase)),
        List.of("Replaced '" + find + "' with '" + replace + "'"));
  }

  static boolean isHttpUrl(String source) {
    String lower = source.toLowerCase(Locale.ROOT);
    return lower.startsWith("http://") || lower.startsWith("https://");
  }
}
