package com.flamingo.storyboard.api.dto.response;

import com.flamingo.storyboard.domain.enums.ImportErrorKind;
import com.flamingo.storyboard.service.importing.ImportBatchResult;
import com.flamingo.storyboard.service.importing.ImportFailure;
import com.flamingo.storyboard.service.importing.ImportedChapter;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a DOCX chapter import batch. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChapterImportResponse {

  private List<ChapterDraft> chapters;
  private List<FailedFile> failures;

  /** A converted chapter the client stores as a new record. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ChapterDraft {
    private String title;
    private String sourceFileName;
    private String html;
    private int blockCount;
  }

  /** A file that could not be imported. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class FailedFile {
    private String fileName;
    private ImportErrorKind errorKind;
    private String message;
  }

  /** Creates a ChapterImportResponse from a batch result. */
  public static ChapterImportResponse fromResult(ImportBatchResult result) {
    return ChapterImportResponse.builder()
        .chapters(result.chapters().stream().map(ChapterImportResponse::toDraft).toList())
        .failures(result.failures().stream().map(ChapterImportResponse::toFailedFile).toList())
        .build();
  }

  private static ChapterDraft toDraft(ImportedChapter chapter) {
    return ChapterDraft.builder()
        .title(chapter.title())
        .sourceFileName(chapter.sourceFileName())
        .html(chapter.html())
        .blockCount(chapter.document().size())
        .build();
  }

  private static FailedFile toFailedFile(ImportFailure failure) {
    return FailedFile.builder()
        .fileName(failure.fileName())
        .errorKind(failure.kind())
        .message(failure.message())
        .build();
  }
}
