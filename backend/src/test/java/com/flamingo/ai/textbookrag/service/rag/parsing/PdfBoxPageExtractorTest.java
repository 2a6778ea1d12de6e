package com.flamingo.ai.textbookrag.service.rag.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.textbookrag.exception.DocumentProcessingException;
import com.flamingo.ai.textbookrag.service.rag.model.BoundingBox;
import com.flamingo.ai.textbookrag.service.rag.model.PageImage;
import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PdfBoxPageExtractor Tests")
class PdfBoxPageExtractorTest {

  private PdfBoxPageExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor = new PdfBoxPageExtractor();
  }

  @Test
  @DisplayName("should extract text, line blocks and image positions per page")
  void shouldExtractTextBlocksAndImages() throws IOException {
    byte[] pdf = createPdf();

    List<PageRecord> pages = extractor.extract(new ByteArrayInputStream(pdf), "sample");

    assertThat(pages).hasSize(2);
    PageRecord first = pages.get(0);
    assertThat(first.pageNumber()).isEqualTo(1);
    assertThat(first.text()).contains("EXERCISE 3.1").contains("1. Solve x.");
    assertThat(first.blocks()).hasSizeGreaterThanOrEqualTo(2);
    assertThat(first.blocks().get(0).text()).contains("EXERCISE 3.1");

    assertThat(first.images()).hasSize(1);
    PageImage image = first.images().get(0);
    assertThat(image.imageId()).isEqualTo("img_p1_1");
    assertThat(image.pageNumber()).isEqualTo(1);
    BoundingBox bbox = image.bbox();
    assertThat(bbox.x0()).isCloseTo(100f, within(0.5f));
    assertThat(bbox.x1()).isCloseTo(150f, within(0.5f));
    assertThat(bbox.y0()).isCloseTo(792f - 450f, within(0.5f));

    PageRecord second = pages.get(1);
    assertThat(second.pageNumber()).isEqualTo(2);
    assertThat(second.text()).contains("MISCELLANEOUS EXERCISE");
    assertThat(second.images()).isEmpty();
  }

  @Test
  @DisplayName("should separate paragraphs with a blank line at a large vertical gap")
  void shouldSeparateParagraphs_atLargeVerticalGap() throws IOException {
    byte[] pdf;
    try (PDDocument document = new PDDocument()) {
      PDPage page = new PDPage(PDRectangle.LETTER);
      document.addPage(page);
      try (PDPageContentStream content = new PDPageContentStream(document, page)) {
        content.beginText();
        content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
        content.newLineAtOffset(50, 700);
        content.showText("First paragraph line one.");
        content.newLineAtOffset(0, -14);
        content.showText("First paragraph line two.");
        content.newLineAtOffset(0, -60);
        content.showText("Second paragraph after a large gap.");
        content.endText();
      }
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      document.save(out);
      pdf = out.toByteArray();
    }

    String text = extractor.extract(new ByteArrayInputStream(pdf), "paragraphs").get(0).text();

    assertThat(text).containsPattern("line two\\.\\R\\RSecond paragraph");
    assertThat(text).doesNotContainPattern("line one\\.\\R\\R");
  }

  @Test
  @DisplayName("should wrap unreadable input in DocumentProcessingException")
  void shouldWrapUnreadableInput() {
    ByteArrayInputStream garbage =
        new ByteArrayInputStream("not a pdf".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> extractor.extract(garbage, "broken"))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("Failed to extract PDF");
  }

  @Test
  @DisplayName("should support only PDF mime type")
  void shouldSupportOnlyPdf() {
    assertThat(extractor.supports("application/pdf")).isTrue();
    assertThat(extractor.supports("APPLICATION/PDF")).isTrue();
    assertThat(extractor.supports("text/plain")).isFalse();
    assertThat(extractor.supports(null)).isFalse();
  }

  private static byte[] createPdf() throws IOException {
    try (PDDocument document = new PDDocument()) {
      PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

      PDPage first = new PDPage(PDRectangle.LETTER);
      document.addPage(first);
      BufferedImage pixels = new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB);
      PDImageXObject image = LosslessFactory.createFromImage(document, pixels);
      try (PDPageContentStream content = new PDPageContentStream(document, first)) {
        writeLines(content, font, "EXERCISE 3.1", "1. Solve x.");
        content.drawImage(image, 100, 400, 50, 50);
      }

      PDPage second = new PDPage(PDRectangle.LETTER);
      document.addPage(second);
      try (PDPageContentStream content = new PDPageContentStream(document, second)) {
        writeLines(content, font, "MISCELLANEOUS EXERCISE", "1. Prove it.");
      }

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      document.save(out);
      return out.toByteArray();
    }
  }

  private static void writeLines(PDPageContentStream content, PDType1Font font, String... lines)
      throws IOException {
    content.beginText();
    content.setFont(font, 12);
    content.setLeading(16);
    content.newLineAtOffset(50, 700);
    for (String line : lines) {
      content.showText(line);
      content.newLine();
    }
    content.endText();
  }
}
