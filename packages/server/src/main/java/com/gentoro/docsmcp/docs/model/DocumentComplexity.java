package com.gentoro.docsmcp.docs.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Summary counts for a document, without the per-element breakdown. */
public record DocumentComplexity(
    @JsonProperty("total_elements") int totalElements,
    @JsonProperty("tables") int tables,
    @JsonProperty("paragraphs") int paragraphs,
    @JsonProperty("section_breaks") int sectionBreaks,
    @JsonProperty("table_cells") int tableCells,
    @JsonProperty("total_length") int totalLength,
    @JsonProperty("has_headers") boolean hasHeaders,
    @JsonProperty("has_footers") boolean hasFooters,
    @JsonProperty("complexity") String complexity) {}
