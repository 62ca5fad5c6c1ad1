package com.flamingo.storyboard.config;

import com.flamingo.storyboard.service.docx.ConversionOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for DOCX chapter import. */
@Configuration
@ConfigurationProperties(prefix = "docx-import")
@Getter
@Setter
public class DocxImportConfig {

  /** Namespace URI of the WordprocessingML vocabulary. */
  private String wordNamespace = ConversionOptions.WORDPROCESSINGML_NAMESPACE;

  /** Path of the main document part inside the package. */
  private String mainDocumentPart = ConversionOptions.DEFAULT_MAIN_DOCUMENT_PART;

  /** Suffix stripped (case-insensitively) from a file name to derive the chapter title. */
  private String titleSuffix = ".docx";

  private Batch batch = new Batch();

  @Getter
  @Setter
  public static class Batch {
    /** Convert the files of one request concurrently on the import executor. */
    private boolean parallel = false;

    /** Maximum number of files accepted in one request. */
    private int maxFiles = 50;
  }

  public ConversionOptions toConversionOptions() {
    return new ConversionOptions(wordNamespace, mainDocumentPart);
  }
}
