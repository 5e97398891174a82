package com.gentoro.docsmcp.docs.header;

import static com.gentoro.docsmcp.docs.request.EditRequests.deleteRange;
import static com.gentoro.docsmcp.docs.request.EditRequests.insertText;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.docsmcp.docs.service.BatchUpdateResponse;
import com.gentoro.docsmcp.docs.service.DocumentService;
import com.gentoro.docsmcp.docs.validation.DocumentValidator;
import com.gentoro.docsmcp.exception.StateException;
import com.gentoro.docsmcp.exception.ValidationException;
import com.gentoro.docsmcp.utility.JacksonUtility;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HeaderFooterManagerTest {

  private static final String DOC = "doc-123";

  @Mock private DocumentService documentService;

  private HeaderFooterManager manager;

  @BeforeEach
  void setUp() {
    manager = new HeaderFooterManager(documentService, new DocumentValidator());
  }

  private static JsonNode json(String text) throws Exception {
    return JacksonUtility.getJsonMapper().readTree(text.replace('\'', '"'));
  }

  @Test
  @DisplayName("an existing header is cleared up to its final newline, then rewritten")
  void replacesExistingHeader() throws Exception {
    when(documentService.getDocument(DOC, false))
        .thenReturn(
            json(
                "{'documentStyle':{'defaultHeaderId':'kix.h1'},"
                    + "'headers':{'kix.h1':{'content':["
                    + "{'startIndex':0,'endIndex':1},{'startIndex':1,'endIndex':12}]}}}"));

    HeaderFooterResult result =
        manager.upsert(DOC, SectionType.HEADER, HeaderFooterVariant.DEFAULT, "Quarterly");

    verify(documentService)
        .submit(
            DOC, List.of(deleteRange(1, 11, "kix.h1"), insertText(1, "Quarterly", "kix.h1")));
    verify(documentService, never()).batchUpdate(eq(DOC), anyList());
    assertFalse(result.created());
    assertEquals("Updated default header (kix.h1) with 9 characters", result.describe());
  }

  @Test
  @DisplayName("a header holding only its newline is written without a delete")
  void nothingToClear() throws Exception {
    when(documentService.getDocument(DOC, false))
        .thenReturn(
            json(
                "{'documentStyle':{'defaultFooterId':'kix.f1'},"
                    + "'footers':{'kix.f1':{'content':[{'startIndex':1,'endIndex':2}]}}}"));

    manager.upsert(DOC, SectionType.FOOTER, HeaderFooterVariant.DEFAULT, "Page");

    verify(documentService).submit(DOC, List.of(insertText(1, "Page", "kix.f1")));
  }

  @Test
  @DisplayName("a missing header is created first and written through the returned id")
  @SuppressWarnings("unchecked")
  void createsMissingHeader() throws Exception {
    when(documentService.getDocument(DOC, false)).thenReturn(json("{'documentStyle':{}}"));
    when(documentService.batchUpdate(eq(DOC), anyList()))
        .thenReturn(
            new BatchUpdateResponse(
                DOC, List.of(json("{'createHeader':{'headerId':'kix.new'}}"))));

    HeaderFooterResult result =
        manager.upsert(DOC, SectionType.HEADER, HeaderFooterVariant.DEFAULT, "Title");

    ArgumentCaptor<List<JsonNode>> created = ArgumentCaptor.forClass(List.class);
    verify(documentService).batchUpdate(eq(DOC), created.capture());
    assertEquals(json("{'createHeader':{'type':'DEFAULT'}}"), created.getValue().get(0));
    verify(documentService).submit(DOC, List.of(insertText(1, "Title", "kix.new")));
    assertTrue(result.created());
    assertEquals("kix.new", result.segmentId());
    assertEquals("Created default header (kix.new) with 5 characters", result.describe());
  }

  @Test
  @DisplayName("variants other than the default read their own style field")
  void firstPageVariant() throws Exception {
    when(documentService.getDocument(DOC, false))
        .thenReturn(
            json(
                "{'documentStyle':{'defaultFooterId':'kix.d','firstPageFooterId':'kix.fp'},"
                    + "'footers':{'kix.fp':{'content':[{'startIndex':1,'endIndex':2}]}}}"));

    HeaderFooterResult result =
        manager.upsert(DOC, SectionType.FOOTER, HeaderFooterVariant.FIRST_PAGE_ONLY, "First");

    verify(documentService).submit(DOC, List.of(insertText(1, "First", "kix.fp")));
    assertEquals("Updated first page only footer (kix.fp) with 5 characters", result.describe());
  }

  @Test
  @DisplayName("a missing first page header is refused even when a default header exists")
  void missingNonDefaultVariant() throws Exception {
    when(documentService.getDocument(DOC, false))
        .thenReturn(
            json(
                "{'documentStyle':{'defaultHeaderId':'kix.d'},"
                    + "'headers':{'kix.d':{'content':[{'startIndex':1,'endIndex':2}]}}}"));

    ValidationException e =
        assertThrows(
            ValidationException.class,
            () ->
                manager.upsert(
                    DOC, SectionType.HEADER, HeaderFooterVariant.FIRST_PAGE_ONLY, "First"));

    assertTrue(e.getMessage().contains("no FIRST_PAGE_ONLY header"), e.getMessage());
    verify(documentService, never()).batchUpdate(eq(DOC), anyList());
    verify(documentService, never()).submit(eq(DOC), anyList());
  }

  @Test
  @DisplayName("a missing even page footer is refused without creating anything")
  void missingEvenPageFooter() throws Exception {
    when(documentService.getDocument(DOC, false)).thenReturn(json("{'documentStyle':{}}"));

    assertThrows(
        ValidationException.class,
        () -> manager.upsert(DOC, SectionType.FOOTER, HeaderFooterVariant.EVEN_PAGE, "Even"));

    verify(documentService).getDocument(DOC, false);
    verifyNoMoreInteractions(documentService);
  }

  @Test
  @DisplayName("a segment whose content is not a list is treated as empty")
  void malformedSegmentContent() throws Exception {
    when(documentService.getDocument(DOC, false))
        .thenReturn(
            json(
                "{'documentStyle':{'defaultHeaderId':'kix.h1'},"
                    + "'headers':{'kix.h1':{'content':{'a':{'endIndex':9}}}}}"));

    manager.upsert(DOC, SectionType.HEADER, HeaderFooterVariant.DEFAULT, "Top");

    verify(documentService).submit(DOC, List.of(insertText(1, "Top", "kix.h1")));
  }

  @Test
  @DisplayName("a creation reply without an id is an error")
  void creationWithoutId() throws Exception {
    when(documentService.getDocument(DOC, false)).thenReturn(json("{'documentStyle':{}}"));
    when(documentService.batchUpdate(eq(DOC), anyList()))
        .thenReturn(new BatchUpdateResponse(DOC, List.of(json("{}"))));

    assertThrows(
        StateException.class,
        () -> manager.upsert(DOC, SectionType.FOOTER, HeaderFooterVariant.DEFAULT, "x"));
  }

  @Test
  void rejectsEmptyContent() {
    assertThrows(
        ValidationException.class,
        () -> manager.upsert(DOC, SectionType.HEADER, HeaderFooterVariant.DEFAULT, ""));
    verifyNoInteractions(documentService);
  }

  @Test
  void parsesVariantsAndTypes() {
    assertEquals(HeaderFooterVariant.DEFAULT, HeaderFooterVariant.parse(null));
    assertEquals(HeaderFooterVariant.EVEN_PAGE, HeaderFooterVariant.parse("even_page"));
    assertEquals(
        "firstPageHeaderId", HeaderFooterVariant.FIRST_PAGE_ONLY.styleField(SectionType.HEADER));
    assertEquals(SectionType.FOOTER, SectionType.parse("footer"));
    assertThrows(ValidationException.class, () -> HeaderFooterVariant.parse("odd"));
    assertThrows(ValidationException.class, () -> SectionType.parse("sidebar"));
  }
}
