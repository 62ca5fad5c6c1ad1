package com.flamingo.storyboard.service.docx.archive;

import com.flamingo.storyboard.domain.enums.ImportErrorKind;
import com.flamingo.storyboard.exception.DocxConversionException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts a single named entry from an in-memory ZIP package.
 *
 * <p>Stateless; the input bytes are never modified.
 */
@Component
@Slf4j
public class DocxArchiveReader {

  // "PK\3\4" starts a local file header, "PK\5\6" is the end record of an empty archive.
  private static final byte[] LOCAL_HEADER_SIGNATURE = {0x50, 0x4B, 0x03, 0x04};
  private static final byte[] EMPTY_ARCHIVE_SIGNATURE = {0x50, 0x4B, 0x05, 0x06};

  /**
   * Reads the content of {@code entryPath} from the package.
   *
   * @param packageBytes raw package bytes
   * @param entryPath path of the entry inside the package, e.g. {@code word/document.xml}
   * @return the entry's uncompressed bytes
   * @throws DocxConversionException with {@link ImportErrorKind#CORRUPT_ARCHIVE} if the bytes
   *     are not a readable ZIP package, or {@link ImportErrorKind#MISSING_DOCUMENT_PART} if the
   *     entry is absent
   */
  public byte[] readEntry(byte[] packageBytes, String entryPath) {
    if (packageBytes == null || packageBytes.length == 0) {
      throw new DocxConversionException(ImportErrorKind.CORRUPT_ARCHIVE, "Package is empty");
    }
    if (startsWith(packageBytes, EMPTY_ARCHIVE_SIGNATURE)) {
      throw missingEntry(entryPath);
    }
    if (!startsWith(packageBytes, LOCAL_HEADER_SIGNATURE)) {
      throw new DocxConversionException(
          ImportErrorKind.CORRUPT_ARCHIVE, "Package does not start with a ZIP header");
    }

    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(packageBytes))) {
      int entries = 0;
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        entries++;
        if (!entry.isDirectory() && entryPath.equals(normalize(entry.getName()))) {
          byte[] content = zip.readAllBytes();
          log.debug("Read entry {} ({} bytes, entry #{})", entryPath, content.length, entries);
          return content;
        }
      }
      if (entries == 0) {
        throw new DocxConversionException(
            ImportErrorKind.CORRUPT_ARCHIVE, "Package has no readable entries");
      }
    } catch (IOException | IllegalArgumentException e) {
      throw new DocxConversionException(
          ImportErrorKind.CORRUPT_ARCHIVE, "Failed to read package: " + e.getMessage(), e);
    }
    throw missingEntry(entryPath);
  }

  private DocxConversionException missingEntry(String entryPath) {
    return new DocxConversionException(
        ImportErrorKind.MISSING_DOCUMENT_PART, "Package has no entry " + entryPath);
  }

  // Some producers write Windows separators or a leading slash.
  private static String normalize(String name) {
    String normalized = name.replace('\\', '/');
    return normalized.startsWith("/") ? normalized.substring(1) : normalized;
  }

  private static boolean startsWith(byte[] bytes, byte[] prefix) {
    if (bytes.length < prefix.length) {
      return false;
    }
    for (int i = 0; i < prefix.length; i++) {
      if (bytes[i] != prefix[i]) {
        return false;
      }
    }
    return true;
  }
}
