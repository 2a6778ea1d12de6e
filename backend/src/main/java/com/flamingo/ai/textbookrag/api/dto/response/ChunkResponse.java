package com.flamingo.ai.textbookrag.api.dto.response;

import com.flamingo.ai.textbookrag.service.rag.model.Chunk;
import com.flamingo.ai.textbookrag.service.rag.model.EquationData;
import com.flamingo.ai.textbookrag.service.rag.model.PageImage;
import com.flamingo.ai.textbookrag.service.rag.model.PageTable;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for chunk data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

  private String chunkId;
  private String documentId;
  private String classLevel;
  private int chapterNumber;
  private String chapterName;
  private String sectionName;
  private String contentType;
  private int pageNumber;
  private List<Integer> pageNumbers;
  private String text;
  private List<String> equations;
  private List<String> imageIds;
  private List<String> tableIds;
  private String exerciseNumber;
  private String exampleNumber;
  private int partNumber;
  private int totalParts;
  private int tokenCount;
  private double mathDensity;

  /** Creates a ChunkResponse from a Chunk. */
  public static ChunkResponse fromChunk(Chunk chunk) {
    return ChunkResponse.builder()
        .chunkId(chunk.chunkId())
        .documentId(chunk.documentId())
        .classLevel(chunk.classLevel())
        .chapterNumber(chunk.context().chapterNumber())
        .chapterName(chunk.context().chapterName())
        .sectionName(chunk.context().sectionName())
        .contentType(chunk.contentType().value())
        .pageNumber(chunk.pageNumber())
        .pageNumbers(chunk.pageNumbers())
        .text(chunk.text())
        .equations(chunk.equations().stream().map(EquationData::latex).toList())
        .imageIds(chunk.images().stream().map(PageImage::imageId).toList())
        .tableIds(chunk.tables().stream().map(PageTable::tableId).toList())
        .exerciseNumber(chunk.exerciseNumber())
        .exampleNumber(chunk.exampleNumber())
        .partNumber(chunk.partNumber())
        .totalParts(chunk.totalParts())
        .tokenCount(chunk.tokenCount())
        .mathDensity(chunk.mathDensity())
        .build();
  }
}
