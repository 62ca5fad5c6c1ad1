package com.flamingo.storyboard.service.importing;

import java.util.List;

/**
 * Outcome of importing a batch of packages. Both lists keep the relative input order.
 *
 * @param chapters successfully converted packages
 * @param failures packages that failed, one entry each
 */
public record ImportBatchResult(List<ImportedChapter> chapters, List<ImportFailure> failures) {

  public ImportBatchResult {
    chapters = List.copyOf(chapters);
    failures = List.copyOf(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
