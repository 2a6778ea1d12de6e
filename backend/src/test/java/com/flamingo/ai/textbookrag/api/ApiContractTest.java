package com.flamingo.ai.textbookrag.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.textbookrag.api.rest.DocumentController;
import com.flamingo.ai.textbookrag.api.rest.SearchController;
import java.util.Arrays;
import java.util.Objects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the REST surface.
 *
 * <ul>
 *   <li>POST /api/documents - Index extracted pages
 *   <li>POST /api/documents/pdf - Upload and index a PDF
 *   <li>GET /api/documents - List indexed documents
 *   <li>GET /api/documents/{documentId}/chunks - Get chunks of a document
 *   <li>DELETE /api/documents/{documentId} - Delete a document
 *   <li>GET /api/stats - Index statistics
 *   <li>POST /api/search - Intent-aware search
 *   <li>POST /api/retrieve - Plain hybrid retrieval
 *   <li>GET /api/chunks/{chunkId}/related - Related chunks
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("DocumentController API contract")
  class DocumentControllerContract {

    @Test
    @DisplayName("should be mapped under /api prefix")
    void shouldBeMappedUnderApiPrefix() {
      RequestMapping mapping = DocumentController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
    }

    @Test
    @DisplayName("should expose document endpoints")
    void shouldExposeDocumentEndpoints() {
      assertThat(postPaths(DocumentController.class))
          .containsExactlyInAnyOrder("/documents", "/documents/pdf");
      assertThat(getPaths(DocumentController.class))
          .containsExactlyInAnyOrder("/documents", "/documents/{documentId}/chunks", "/stats");
    }
  }

  @Nested
  @DisplayName("SearchController API contract")
  class SearchControllerContract {

    @Test
    @DisplayName("should be mapped under /api prefix")
    void shouldBeMappedUnderApiPrefix() {
      RequestMapping mapping = SearchController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
    }

    @Test
    @DisplayName("should expose search endpoints")
    void shouldExposeSearchEndpoints() {
      assertThat(postPaths(SearchController.class))
          .containsExactlyInAnyOrder("/search", "/retrieve");
      assertThat(getPaths(SearchController.class)).containsExactly("/chunks/{chunkId}/related");
    }
  }

  private static String[] postPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map(m -> m.getAnnotation(PostMapping.class))
        .filter(Objects::nonNull)
        .flatMap(mapping -> Arrays.stream(mapping.value()))
        .toArray(String[]::new);
  }

  private static String[] getPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map(m -> m.getAnnotation(GetMapping.class))
        .filter(Objects::nonNull)
        .flatMap(mapping -> Arrays.stream(mapping.value()))
        .toArray(String[]::new);
  }
}
