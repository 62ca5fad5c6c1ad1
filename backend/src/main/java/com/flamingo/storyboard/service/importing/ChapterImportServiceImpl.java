package com.flamingo.storyboard.service.importing;

import com.flamingo.storyboard.config.DocxImportConfig;
import com.flamingo.storyboard.domain.enums.ImportErrorKind;
import com.flamingo.storyboard.exception.DocxConversionException;
import com.flamingo.storyboard.exception.InvalidImportRequestException;
import com.flamingo.storyboard.service.docx.ConversionOptions;
import com.flamingo.storyboard.service.docx.DocxConverter;
import com.flamingo.storyboard.service.docx.model.OutputDocument;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the ChapterImportService. */
@Service
@Slf4j
public class ChapterImportServiceImpl implements ChapterImportService {

  private final DocxConverter docxConverter;
  private final DocxImportConfig importConfig;
  private final MeterRegistry meterRegistry;
  private final Executor importExecutor;

  public ChapterImportServiceImpl(
      DocxConverter docxConverter,
      DocxImportConfig importConfig,
      MeterRegistry meterRegistry,
      @Qualifier("docxImportExecutor") Executor importExecutor) {
    this.docxConverter = docxConverter;
    this.importConfig = importConfig;
    this.meterRegistry = meterRegistry;
    this.importExecutor = importExecutor;
  }

  @Override
  @Timed(value = "docx.import.batch", description = "Time to import a batch of DOCX packages")
  public ImportBatchResult importPackages(List<DocxPackage> packages) {
    ConversionOptions options = importConfig.toConversionOptions();
    List<Supplier<Outcome>> tasks = new ArrayList<>(packages.size());
    for (DocxPackage docxPackage : packages) {
      tasks.add(() -> convert(docxPackage, options));
    }
    return runBatch(tasks);
  }

  @Override
  @Timed(value = "docx.import.batch", description = "Time to import a batch of DOCX packages")
  public ImportBatchResult importFiles(List<MultipartFile> files) {
    validateBatch(files);
    ConversionOptions options = importConfig.toConversionOptions();

    List<Supplier<Outcome>> tasks = new ArrayList<>(files.size());
    for (MultipartFile file : files) {
      String displayName = displayNameOf(file);
      try {
        DocxPackage docxPackage = new DocxPackage(displayName, file.getBytes());
        tasks.add(() -> convert(docxPackage, options));
      } catch (IOException e) {
        log.warn("Failed to read uploaded file {}: {}", displayName, e.getMessage());
        Outcome unreadable = failed(displayName, ImportErrorKind.UNREADABLE_UPLOAD);
        tasks.add(() -> unreadable);
      }
    }
    return runBatch(tasks);
  }

  private ImportBatchResult runBatch(List<Supplier<Outcome>> tasks) {
    boolean parallel = importConfig.getBatch().isParallel() && tasks.size() > 1;
    log.info("Importing {} DOCX packages (parallel={})", tasks.size(), parallel);

    List<Outcome> outcomes = parallel ? runParallel(tasks) : runSequential(tasks);

    List<ImportedChapter> chapters = new ArrayList<>();
    List<ImportFailure> failures = new ArrayList<>();
    for (Outcome outcome : outcomes) {
      if (outcome.chapter() != null) {
        chapters.add(outcome.chapter());
      } else {
        failures.add(outcome.failure());
      }
    }

    log.info(
        "Imported {} of {} packages, {} failed", chapters.size(), tasks.size(), failures.size());
    return new ImportBatchResult(chapters, failures);
  }

  private List<Outcome> runSequential(List<Supplier<Outcome>> tasks) {
    List<Outcome> outcomes = new ArrayList<>(tasks.size());
    for (Supplier<Outcome> task : tasks) {
      outcomes.add(task.get());
    }
    return outcomes;
  }

  private List<Outcome> runParallel(List<Supplier<Outcome>> tasks) {
    List<CompletableFuture<Outcome>> futures = new ArrayList<>(tasks.size());
    for (Supplier<Outcome> task : tasks) {
      futures.add(submit(task));
    }
    // join in submission order so results keep the input order
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private CompletableFuture<Outcome> submit(Supplier<Outcome> task) {
    try {
      return CompletableFuture.supplyAsync(task, importExecutor);
    } catch (RejectedExecutionException e) {
      log.warn("Import executor saturated, converting on the calling thread");
      return CompletableFuture.completedFuture(task.get());
    }
  }

  private Outcome convert(DocxPackage docxPackage, ConversionOptions options) {
    String name = docxPackage.displayName();
    try {
      OutputDocument document = docxConverter.convert(docxPackage.content(), options);
      String html = docxConverter.toHtml(document);
      meterRegistry.counter("docx.import.succeeded").increment();
      log.debug("Imported {} with {} blocks", name, document.size());
      return new Outcome(new ImportedChapter(deriveTitle(name), name, document, html), null);
    } catch (DocxConversionException e) {
      log.warn("Failed to import {} [{}]: {}", name, e.getKind(), e.getMessage());
      return failed(name, e.getKind(), e.getUserMessage());
    } catch (RuntimeException | StackOverflowError e) {
      log.error("Unexpected error importing {}: {}", name, e.getMessage(), e);
      return failed(name, ImportErrorKind.UNEXPECTED_ERROR);
    }
  }

  private Outcome failed(String displayName, ImportErrorKind kind) {
    return failed(displayName, kind, kind.getUserMessage());
  }

  private Outcome failed(String displayName, ImportErrorKind kind, String userMessage) {
    meterRegistry.counter("docx.import.failed", "kind", kind.name()).increment();
    return new Outcome(null, new ImportFailure(displayName, kind, userMessage));
  }

  private void validateBatch(List<MultipartFile> files) {
    if (files == null || files.isEmpty()) {
      throw new InvalidImportRequestException("No files provided");
    }
    int maxFiles = importConfig.getBatch().getMaxFiles();
    if (files.size() > maxFiles) {
      throw new InvalidImportRequestException(
          "Too many files: " + files.size() + " (maximum " + maxFiles + ")");
    }
  }

  /** Derives a chapter title by stripping the configured suffix, ignoring case. */
  @VisibleForTesting
  String deriveTitle(String displayName) {
    String suffix = importConfig.getTitleSuffix();
    if (suffix == null || suffix.isEmpty()) {
      return displayName;
    }
    String lower = displayName.toLowerCase(Locale.ROOT);
    if (lower.endsWith(suffix.toLowerCase(Locale.ROOT))) {
      return displayName.substring(0, displayName.length() - suffix.length());
    }
    return displayName;
  }

  private static String displayNameOf(MultipartFile file) {
    String original = StringUtils.getFilename(file.getOriginalFilename());
    return StringUtils.hasText(original) ? original : file.getName();
  }

  /** Either a chapter or a failure, never both. */
  private record Outcome(ImportedChapter chapter, ImportFailure failure) {}
}
