package com.gentoro.docsmcp.docs.table;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a create-and-populate call.
 *
 * @param tableIndex index the table was actually inserted at, one less than requested after a
 *     boundary retry
 */
public record TableCreationResult(
    @JsonProperty("rows") int rows,
    @JsonProperty("columns") int columns,
    @JsonProperty("table_index") int tableIndex,
    @JsonProperty("cells_populated") int cellsPopulated,
    @JsonProperty("retried") boolean retried) {}
