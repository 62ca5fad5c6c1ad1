package com.flamingo.storyboard.service.docx;

import com.flamingo.storyboard.service.docx.archive.DocxArchiveReader;
import com.flamingo.storyboard.service.docx.model.OutputDocument;
import com.flamingo.storyboard.service.docx.xml.WordXmlParser;
import com.flamingo.storyboard.service.docx.xml.XmlElement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Converts a DOCX package into an {@link OutputDocument}: archive → XML tree → blocks.
 *
 * <p>Stateless and synchronous. The parsed tree lives only for the duration of one call, so a
 * single instance can convert several packages concurrently. Any failure propagates as a {@link
 * com.flamingo.storyboard.exception.DocxConversionException}; there is no partial output.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocxConverter {

  private final DocxArchiveReader archiveReader;
  private final WordXmlParser xmlParser;
  private final ParagraphAssembler paragraphAssembler;
  private final QuillHtmlWriter htmlWriter;

  public OutputDocument convert(byte[] packageBytes, ConversionOptions options) {
    byte[] documentPart = archiveReader.readEntry(packageBytes, options.mainDocumentPart());
    XmlElement root = xmlParser.parse(documentPart, options.wordNamespace());
    OutputDocument document = paragraphAssembler.assembleDocument(root);
    log.debug("Converted {} bytes into {} blocks", packageBytes.length, document.size());
    return document;
  }

  /** Converts a package and serializes the result to editor HTML. */
  public String convertToHtml(byte[] packageBytes, ConversionOptions options) {
    return htmlWriter.write(convert(packageBytes, options));
  }

  public String toHtml(OutputDocument document) {
    return htmlWriter.write(document);
  }
}
