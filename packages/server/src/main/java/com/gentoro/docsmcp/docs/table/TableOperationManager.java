package com.gentoro.docsmcp.docs.table;

import com.gentoro.docsmcp.docs.index.DocumentIndex;
import com.gentoro.docsmcp.docs.request.EditOperation;
import com.gentoro.docsmcp.docs.request.EditRequests;
import com.gentoro.docsmcp.docs.request.TextStyle;
import com.gentoro.docsmcp.docs.service.DocumentService;
import com.gentoro.docsmcp.docs.validation.DocumentValidator;
import com.gentoro.docsmcp.exception.DocumentServiceException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Creates a table and fills it with data.
 *
 * <p>Creation and population are two batches. The empty table goes first; when the service
 * rejects the index as sitting on the end of the body, creation is retried once, one position
 * earlier. Cell positions are then derived from the table geometry and all cells are written in a
 * single batch in descending index order, so no write shifts a cell that is still pending.
 */
public class TableOperationManager {
  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(TableOperationManager.class);

  private final DocumentService documentService;
  private final DocumentValidator validator;

  public TableOperationManager(DocumentService documentService, DocumentValidator validator) {
    this.documentService = documentService;
    this.validator = validator;
  }

  public TableCreationResult createAndPopulate(
      String documentId, Integer index, List<List<String>> data, boolean boldHeaderRow) {
    validator.validateDocumentId(documentId);
    validator.validateIndex(index, "index");
    validator.validateTableData(data);

    int rows = data.size();
    int columns = data.get(0).size();
    int requested = DocumentIndex.writable(index);

    int used = requested;
    boolean retried = false;
    try {
      createEmptyTable(documentId, requested, rows, columns);
    } catch (DocumentServiceException e) {
      if (!e.isBoundaryViolation() || requested - 1 < DocumentIndex.FIRST_WRITABLE) {
        throw e;
      }
      log.debug(
          "Index {} is at the end of the body, retrying table at {}", requested, requested - 1);
      used = requested - 1;
      retried = true;
      try {
        createEmptyTable(documentId, used, rows, columns);
      } catch (DocumentServiceException retryFailure) {
        if (retryFailure.isBoundaryViolation()) {
          e.addSuppressed(retryFailure);
          throw e;
        }
        throw retryFailure;
      }
    }

    TableGeometry geometry = TableGeometry.forNewTable(used, rows, columns);
    List<EditOperation> writes = populationRequests(geometry, data, boldHeaderRow);
    int populated = (int) writes.stream().filter(op -> "insertText".equals(op.kind())).count();
    if (!writes.isEmpty()) {
      documentService.submit(documentId, writes);
    }
    log.info(
        "Created {}x{} table at index {} in document {} ({} cells populated{})",
        rows,
        columns,
        used,
        documentId,
        populated,
        retried ? ", after boundary retry" : "");
    return new TableCreationResult(rows, columns, used, populated, retried);
  }

  private void createEmptyTable(String documentId, int index, int rows, int columns) {
    documentService.submit(documentId, List.of(EditRequests.insertTable(index, rows, columns)));
  }

  /**
   * Cell inserts in descending index order, followed by the optional header-row bold. Indices are
   * all computed against the empty table before any of them is used.
   */
  List<EditOperation> populationRequests(
      TableGeometry geometry, List<List<String>> data, boolean boldHeaderRow) {
    record CellWrite(int index, String text) {}

    List<CellWrite> cells = new ArrayList<>();
    for (int r = 0; r < geometry.rows(); r++) {
      for (int c = 0; c < geometry.columns(); c++) {
        String text = data.get(r).get(c);
        if (!text.isEmpty()) {
          cells.add(new CellWrite(geometry.cellInsertionIndex(r, c), text));
        }
      }
    }
    cells.sort(Comparator.comparingInt(CellWrite::index).reversed());

    List<EditOperation> operations = new ArrayList<>();
    for (CellWrite cell : cells) {
      operations.add(EditRequests.insertText(cell.index(), cell.text()));
    }

    if (boldHeaderRow) {
      int headerLength = data.get(0).stream().mapToInt(DocumentIndex::width).sum();
      if (headerLength > 0) {
        // cells left of the last one have pushed it right by their combined length
        int start = geometry.cellInsertionIndex(0, 0);
        int end = geometry.cellInsertionIndex(0, geometry.columns() - 1) + headerLength;
        operations.add(EditRequests.formatText(start, end, TextStyle.boldOnly()));
      }
    }
    return operations;
  }
}
