package com.flamingo.storyboard.api.rest;

import com.flamingo.storyboard.api.dto.response.ChapterImportResponse;
import com.flamingo.storyboard.service.importing.ChapterImportService;
import com.flamingo.storyboard.service.importing.ImportBatchResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST controller for importing DOCX files as chapters.
 *
 * <p>Files that fail to convert are listed in the response body; the request itself still
 * succeeds.
 */
@RestController
@RequestMapping("/api/chapters")
@RequiredArgsConstructor
@Slf4j
public class ChapterImportController {

  private final ChapterImportService chapterImportService;
  private final MeterRegistry meterRegistry;

  /** Converts the uploaded DOCX files into chapter drafts. */
  @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ChapterImportResponse> importChapters(
      @RequestParam("files") List<MultipartFile> files) {
    meterRegistry.counter("chapter.import.requests").increment();
    ImportBatchResult result = chapterImportService.importFiles(files);
    if (result.hasFailures()) {
      log.info("Chapter import finished with {} failed files", result.failures().size());
    }
    return ResponseEntity.ok(ChapterImportResponse.fromResult(result));
  }
}
