package com.gentoro.docsmcp.docs.model;

/**
 * One cell of a parsed table.
 *
 * @param insertionIndex position at which inserted text lands inside this cell: the start of the
 *     cell's first paragraph, or {@code startIndex + 1} when the cell reports no content
 * @param content recursively extracted text of the cell, nested tables included up to the depth
 *     limit
 * @param contentElementCount number of structural elements directly inside the cell
 */
public record TableCell(
    int row,
    int column,
    int startIndex,
    int endIndex,
    int insertionIndex,
    String content,
    int contentElementCount) {}
