package com.flamingo.ai.textbookrag.service.rag.parsing;

import com.flamingo.ai.textbookrag.exception.DocumentProcessingException;
import com.flamingo.ai.textbookrag.service.rag.model.BoundingBox;
import com.flamingo.ai.textbookrag.service.rag.model.PageImage;
import com.flamingo.ai.textbookrag.service.rag.model.PageRecord;
import com.flamingo.ai.textbookrag.service.rag.model.TextBlock;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.OperatorProcessor;
import org.apache.pdfbox.contentstream.operator.state.Concatenate;
import org.apache.pdfbox.contentstream.operator.state.Restore;
import org.apache.pdfbox.contentstream.operator.state.Save;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Service;

/**
 * {@link PageExtractor} for PDFs using Apache PDFBox.
 *
 * <p>For every page it records the plain text, one positioned text block per line, and the
 * positions of drawn images. Coordinates are converted to a top-left origin so that text blocks and
 * images share one coordinate system. Tables are not detected.
 */
@Slf4j
@Service
public class PdfBoxPageExtractor implements PageExtractor {

  @Override
  public List<PageRecord> extract(InputStream inputStream, String documentId) {
    try {
      byte[] bytes = inputStream.readAllBytes();
      try (PDDocument pdfDoc = Loader.loadPDF(bytes)) {
        return extractPages(pdfDoc, documentId);
      }
    } catch (IOException e) {
      log.error("PDFBox extraction failed for {}: {}", documentId, e.getMessage());
      throw new DocumentProcessingException(
          documentId, "Failed to extract PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    return "application/pdf".equalsIgnoreCase(mimeType);
  }

  private List<PageRecord> extractPages(PDDocument pdfDoc, String documentId) throws IOException {
    List<PageRecord> pages = new ArrayList<>();
    LineStripper stripper = new LineStripper();
    ImageLocator locator = new ImageLocator();

    for (int index = 0; index < pdfDoc.getNumberOfPages(); index++) {
      int pageNumber = index + 1;
      PDPage page = pdfDoc.getPage(index);

      stripper.setStartPage(pageNumber);
      stripper.setEndPage(pageNumber);
      String text = stripper.getText(pdfDoc);
      List<TextBlock> blocks = stripper.drainBlocks();

      List<PageImage> images = List.of();
      try {
        images = locator.locate(page, pageNumber);
      } catch (IOException e) {
        // the page text is still usable without image positions
        log.warn(
            "Could not locate images on page {} of {}: {}",
            pageNumber,
            documentId,
            e.getMessage());
      }
      pages.add(new PageRecord(pageNumber, text, blocks, images, List.of()));
    }
    log.info("Extracted {} pages from {}", pages.size(), documentId);
    return pages;
  }

  /** Collects one text block per line while PDFTextStripper walks a page. */
  private static final class LineStripper extends PDFTextStripper {

    private final List<TextBlock> blocks = new ArrayList<>();
    private final List<TextPosition> currentLine = new ArrayList<>();
    private float lastY = Float.NaN;

    LineStripper() throws IOException {
      super();
      setSortByPosition(true);
      // detected paragraph breaks become blank lines
      setParagraphEnd(getLineSeparator());
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
      for (TextPosition pos : textPositions) {
        float y = pos.getYDirAdj();
        if (Float.isNaN(lastY) || Math.abs(y - lastY) > 2.0f) {
          flushLine();
          lastY = y;
        }
        currentLine.add(pos);
      }
      super.writeString(text, textPositions);
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
      flushLine();
      lastY = Float.NaN;
      super.endPage(page);
    }

    private void flushLine() {
      if (currentLine.isEmpty()) {
        return;
      }
      StringBuilder text = new StringBuilder();
      float x0 = Float.MAX_VALUE;
      float y0 = Float.MAX_VALUE;
      float x1 = -Float.MAX_VALUE;
      float y1 = -Float.MAX_VALUE;
      for (TextPosition pos : currentLine) {
        text.append(pos.getUnicode());
        x0 = Math.min(x0, pos.getXDirAdj());
        x1 = Math.max(x1, pos.getXDirAdj() + pos.getWidthDirAdj());
        y0 = Math.min(y0, pos.getYDirAdj() - pos.getHeightDir());
        y1 = Math.max(y1, pos.getYDirAdj());
      }
      blocks.add(new TextBlock(text.toString(), new BoundingBox(x0, y0, x1, y1)));
      currentLine.clear();
    }

    List<TextBlock> drainBlocks() {
      List<TextBlock> drained = List.copyOf(blocks);
      blocks.clear();
      return drained;
    }
  }

  /**
   * Records image positions using PDFStreamEngine.
   *
   * <p>Intercepts "Do" (draw XObject) operations and reads the image's placement from the current
   * transformation matrix, which the graphics-state operators keep up to date.
   */
  private static final class ImageLocator extends PDFStreamEngine {

    private final List<PageImage> images = new ArrayList<>();
    private int pageNumber;
    private float pageHeight;

    ImageLocator() {
      addOperator(new Save(this));
      addOperator(new Restore(this));
      addOperator(new Concatenate(this));
      addOperator(new DrawObject(this));
    }

    List<PageImage> locate(PDPage page, int pageNumber) throws IOException {
      this.pageNumber = pageNumber;
      this.pageHeight = page.getMediaBox().getHeight();
      images.clear();
      processPage(page);
      return List.copyOf(images);
    }

    /** Processes "Do" commands to record image positions. */
    private static class DrawObject extends OperatorProcessor {
      private final ImageLocator locator;

      DrawObject(ImageLocator locator) {
        super(locator);
        this.locator = locator;
      }

      @Override
      public void process(Operator operator, List<COSBase> operands) throws IOException {
        if (operands.isEmpty() || !(operands.get(0) instanceof COSName objectName)) {
          return;
        }
        PDXObject xObject = locator.getResources().getXObject(objectName);
        if (!(xObject instanceof PDImageXObject)) {
          return;
        }

        Matrix ctm = locator.getGraphicsState().getCurrentTransformationMatrix();
        float width = Math.abs(ctm.getScalingFactorX());
        float height = Math.abs(ctm.getScalingFactorY());
        float x0 = ctm.getTranslateX();
        float top = locator.pageHeight - ctm.getTranslateY() - height;
        BoundingBox bbox = new BoundingBox(x0, top, x0 + width, top + height);

        String imageId = "img_p" + locator.pageNumber + "_" + (locator.images.size() + 1);
        locator.images.add(new PageImage(imageId, "", bbox, "", locator.pageNumber));
        log.debug("Located image {} at {}", imageId, bbox);
      }

      @Override
      public String getName() {
        return OperatorName.DRAW_OBJECT;
      }
    }
  }
}
