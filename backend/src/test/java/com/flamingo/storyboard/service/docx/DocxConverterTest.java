package com.flamingo.storyboard.service.docx;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.storyboard.domain.enums.ImportErrorKind;
import com.flamingo.storyboard.exception.DocxConversionException;
import com.flamingo.storyboard.service.docx.archive.DocxArchiveReader;
import com.flamingo.storyboard.service.docx.model.Block;
import com.flamingo.storyboard.service.docx.model.OutputDocument;
import com.flamingo.storyboard.service.docx.xml.WordXmlParser;
import com.flamingo.storyboard.support.DocxFixtures;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DocxConverter Tests")
class DocxConverterTest {

  private static final ConversionOptions OPTIONS = ConversionOptions.defaults();

  private static final String STORY_BODY =
      "<w:p><w:pPr><w:pStyle w:val=\"Heading1\"/></w:pPr>"
          + "<w:r><w:t>Chapter One</w:t></w:r></w:p>"
          + "<w:p><w:pPr><w:jc w:val=\"center\"/><w:ind w:firstLine=\"720\"/></w:pPr>"
          + "<w:r><w:rPr><w:b/><w:i/></w:rPr><w:t>Bold</w:t></w:r>"
          + "<w:r><w:t xml:space=\"preserve\"> and plain</w:t></w:r></w:p>"
          + "<w:p/>"
          + "<w:p><w:pPr><w:jc w:val=\"both\"/></w:pPr>"
          + "<w:r><w:t>A</w:t><w:tab/><w:t>B</w:t><w:br/><w:t>C</w:t></w:r></w:p>";

  private DocxConverter converter;

  @BeforeEach
  void setUp() {
    converter =
        new DocxConverter(
            new DocxArchiveReader(),
            new WordXmlParser(),
            new ParagraphAssembler(new PropertyExtractor(), new RunRenderer()),
            new QuillHtmlWriter());
  }

  @Test
  @DisplayName("should convert a package into editor HTML")
  void shouldConvertPackageToHtml() {
    String html = converter.convertToHtml(DocxFixtures.docx(STORY_BODY), OPTIONS);

    assertThat(html)
        .isEqualTo(
            "<h1>Chapter One</h1>"
                + "<p class=\"ql-align-center\">&nbsp;&nbsp;&nbsp;&nbsp;"
                + "<strong><em>Bold</em></strong> and plain</p>"
                + "<p><br></p>"
                + "<p class=\"ql-align-justify\">A&nbsp;&nbsp;&nbsp;&nbsp;B<br>C</p>");
  }

  @Test
  @DisplayName("should produce one block per paragraph")
  void shouldProduceOneBlockPerParagraph() {
    OutputDocument document = converter.convert(DocxFixtures.docx(STORY_BODY), OPTIONS);

    assertThat(document.blocks()).hasSize(4);
    assertThat(document.blocks().get(0)).isInstanceOf(Block.Heading.class);
    assertThat(document.blocks().subList(1, 4)).allMatch(Block.Paragraph.class::isInstance);
  }

  @Test
  @DisplayName("should produce identical output when converting the same bytes twice")
  void shouldBeDeterministic() {
    byte[] docx = DocxFixtures.docx(STORY_BODY);

    String first = converter.convertToHtml(docx, OPTIONS);
    String second = converter.convertToHtml(docx, OPTIONS);

    assertThat(second.getBytes(StandardCharsets.UTF_8))
        .isEqualTo(first.getBytes(StandardCharsets.UTF_8));
    assertThat(converter.convert(docx, OPTIONS)).isEqualTo(converter.convert(docx, OPTIONS));
  }

  @Test
  @DisplayName("should not depend on the namespace prefix used by the producer")
  void shouldIgnoreProducerPrefix() {
    String xml =
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<wp:document xmlns:wp=\""
            + DocxFixtures.W_NS
            + "\"><wp:body><wp:p><wp:pPr><wp:jc wp:val=\"right\"/></wp:pPr>"
            + "<wp:r><wp:rPr><wp:u wp:val=\"single\"/></wp:rPr><wp:t>signed</wp:t></wp:r>"
            + "</wp:p></wp:body></wp:document>";

    String html = converter.convertToHtml(DocxFixtures.docxWithDocumentPart(xml), OPTIONS);

    assertThat(html).isEqualTo("<p class=\"ql-align-right\"><u>signed</u></p>");
  }

  @Test
  @DisplayName("should use the configured main document part")
  void shouldUseConfiguredDocumentPart() {
    byte[] docx = DocxFixtures.docx("<w:p><w:r><w:t>x</w:t></w:r></w:p>");
    ConversionOptions options =
        new ConversionOptions(ConversionOptions.WORDPROCESSINGML_NAMESPACE, "word/other.xml");

    assertThatThrownBy(() -> converter.convert(docx, options))
        .isInstanceOf(DocxConversionException.class)
        .extracting(e -> ((DocxConversionException) e).getKind())
        .isEqualTo(ImportErrorKind.MISSING_DOCUMENT_PART);
  }

  @Test
  @DisplayName("should fail with MALFORMED_XML when the document part is broken")
  void shouldFailWithMalformedXml() {
    byte[] docx = DocxFixtures.docxWithDocumentPart("<w:document><unclosed>");

    assertThatThrownBy(() -> converter.convert(docx, OPTIONS))
        .isInstanceOf(DocxConversionException.class)
        .extracting(e -> ((DocxConversionException) e).getKind())
        .isEqualTo(ImportErrorKind.MALFORMED_XML);
  }

  @Test
  @DisplayName("should escape markup characters from document text")
  void shouldEscapeDocumentText() {
    byte[] docx =
        DocxFixtures.docx("<w:p><w:r><w:t>&lt;script&gt;alert(1)&lt;/script&gt;</w:t></w:r></w:p>");

    String html = converter.convertToHtml(docx, OPTIONS);

    assertThat(html).isEqualTo("<p>&lt;script&gt;alert(1)&lt;/script&gt;</p>");
  }
}
