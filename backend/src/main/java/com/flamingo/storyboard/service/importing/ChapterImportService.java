package com.flamingo.storyboard.service.importing;

import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/** Service for importing DOCX files as chapters. */
public interface ChapterImportService {

  /**
   * Converts each package independently. A failing package is recorded in {@link
   * ImportBatchResult#failures()} and never stops the rest of the batch.
   *
   * @param packages packages in upload order
   * @return converted chapters and failures, each in input order
   */
  ImportBatchResult importPackages(List<DocxPackage> packages);

  /**
   * Reads and converts uploaded files.
   *
   * @param files uploaded files in upload order
   * @return converted chapters and failures, each in input order
   * @throws com.flamingo.storyboard.exception.InvalidImportRequestException if no files were sent
   *     or the batch exceeds the configured limit
   */
  ImportBatchResult importFiles(List<MultipartFile> files);
}
