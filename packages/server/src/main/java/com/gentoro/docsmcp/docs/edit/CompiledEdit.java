package com.gentoro.docsmcp.docs.edit;

import com.gentoro.docsmcp.docs.request.EditOperation;
import java.util.List;

/**
 * Ordered operations for one intent, ready to submit as a single batch, with a human-readable
 * line per step for the caller's summary.
 */
public record CompiledEdit(List<EditOperation> operations, List<String> descriptions) {

  public CompiledEdit {
    operations = List.copyOf(operations);
    descriptions = List.copyOf(descriptions);
  }

  public String summary() {
    return String.join("; ", descriptions);
  }
}
