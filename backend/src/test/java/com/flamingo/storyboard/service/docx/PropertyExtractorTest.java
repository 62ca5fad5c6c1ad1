package com.flamingo.storyboard.service.docx;

import static com.flamingo.storyboard.support.DocxFixtures.element;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.storyboard.service.docx.model.Alignment;
import com.flamingo.storyboard.service.docx.model.ParagraphProperties;
import com.flamingo.storyboard.service.docx.model.RunProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("PropertyExtractor Tests")
class PropertyExtractorTest {

  private PropertyExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor = new PropertyExtractor();
  }

  private ParagraphProperties paragraph(String pPr) {
    return extractor.paragraphProperties(element("<w:p>" + pPr + "<w:r><w:t>x</w:t></w:r></w:p>"));
  }

  private RunProperties run(String rPr) {
    return extractor.runProperties(element("<w:r>" + rPr + "<w:t>x</w:t></w:r>"));
  }

  @Nested
  @DisplayName("paragraph properties")
  class ParagraphPropertiesTests {

    @Test
    @DisplayName("should use defaults when there is no pPr")
    void shouldUseDefaults_whenNoPropertiesBlock() {
      ParagraphProperties properties = paragraph("");

      assertThat(properties).isEqualTo(ParagraphProperties.DEFAULT);
      assertThat(properties.alignment()).isEqualTo(Alignment.LEFT);
      assertThat(properties.hasFirstLineIndent()).isFalse();
      assertThat(properties.heading()).isFalse();
    }

    @Test
    @DisplayName("should use defaults when pPr is empty")
    void shouldUseDefaults_whenPropertiesBlockEmpty() {
      assertThat(paragraph("<w:pPr/>")).isEqualTo(ParagraphProperties.DEFAULT);
    }

    @ParameterizedTest(name = "jc={0} -> {1}")
    @CsvSource({
      "center, CENTER",
      "right, RIGHT",
      "both, JUSTIFY",
      "justify, JUSTIFY",
      "left, LEFT",
      "distributed, LEFT",
      "start, LEFT"
    })
    void shouldMapAlignment(String value, Alignment expected) {
      ParagraphProperties properties = paragraph("<w:pPr><w:jc w:val=\"" + value + "\"/></w:pPr>");

      assertThat(properties.alignment()).isEqualTo(expected);
    }

    @Test
    @DisplayName("should default alignment to left when jc has no value")
    void shouldDefaultAlignment_whenJcHasNoValue() {
      assertThat(paragraph("<w:pPr><w:jc/></w:pPr>").alignment()).isEqualTo(Alignment.LEFT);
    }

    @Test
    @DisplayName("should read the first-line indent")
    void shouldReadFirstLineIndent() {
      ParagraphProperties properties =
          paragraph("<w:pPr><w:ind w:left=\"0\" w:firstLine=\"720\"/></w:pPr>");

      assertThat(properties.firstLineIndent()).isEqualTo(720);
      assertThat(properties.hasFirstLineIndent()).isTrue();
    }

    @Test
    @DisplayName("should treat a non-numeric first-line indent as none")
    void shouldIgnoreIndent_whenNotNumeric() {
      assertThat(paragraph("<w:pPr><w:ind w:firstLine=\"wide\"/></w:pPr>").firstLineIndent())
          .isZero();
    }

    @Test
    @DisplayName("should ignore hanging indents")
    void shouldIgnoreHangingIndent() {
      assertThat(paragraph("<w:pPr><w:ind w:hanging=\"360\"/></w:pPr>").hasFirstLineIndent())
          .isFalse();
    }

    @ParameterizedTest(name = "style={0} -> heading={1}")
    @CsvSource({
      "Heading1, true",
      "heading2, true",
      "Heading Centered, true",
      "MyHEADINGStyle, true",
      "Normal, false",
      "Title, false"
    })
    void shouldDetectHeadingBySubstring(String style, boolean expected) {
      ParagraphProperties properties =
          paragraph("<w:pPr><w:pStyle w:val=\"" + style + "\"/></w:pPr>");

      assertThat(properties.heading()).isEqualTo(expected);
    }

    @Test
    @DisplayName("should only look at the paragraph's own pPr")
    void shouldIgnoreNestedProperties() {
      ParagraphProperties properties =
          extractor.paragraphProperties(
              element(
                  "<w:p><w:r><w:pPr><w:pStyle w:val=\"Heading1\"/></w:pPr>"
                      + "<w:t>x</w:t></w:r></w:p>"));

      assertThat(properties.heading()).isFalse();
    }
  }

  @Nested
  @DisplayName("run properties")
  class RunPropertiesTests {

    @Test
    @DisplayName("should be plain when there is no rPr")
    void shouldBePlain_whenNoPropertiesBlock() {
      assertThat(run("")).isEqualTo(RunProperties.PLAIN);
    }

    @Test
    @DisplayName("bold element absent means not bold")
    void shouldNotBeBold_whenElementAbsent() {
      assertThat(run("<w:rPr><w:i/></w:rPr>").bold()).isFalse();
    }

    @Test
    @DisplayName("bold element without a value means bold")
    void shouldBeBold_whenElementPresentWithoutValue() {
      assertThat(run("<w:rPr><w:b/></w:rPr>").bold()).isTrue();
    }

    @Test
    @DisplayName("bold element with value 0 means not bold")
    void shouldNotBeBold_whenValueIsZero() {
      assertThat(run("<w:rPr><w:b w:val=\"0\"/></w:rPr>").bold()).isFalse();
    }

    @Test
    @DisplayName("bold element with value 1 means bold")
    void shouldBeBold_whenValueIsOne() {
      assertThat(run("<w:rPr><w:b w:val=\"1\"/></w:rPr>").bold()).isTrue();
    }

    @Test
    @DisplayName("should read italic and strike with the 0 sentinel")
    void shouldReadItalicAndStrike() {
      RunProperties properties = run("<w:rPr><w:i/><w:strike w:val=\"0\"/></w:rPr>");

      assertThat(properties.italic()).isTrue();
      assertThat(properties.strike()).isFalse();
    }

    @Test
    @DisplayName("underline is off only for the none sentinel")
    void shouldReadUnderline() {
      assertThat(run("<w:rPr><w:u w:val=\"single\"/></w:rPr>").underline()).isTrue();
      assertThat(run("<w:rPr><w:u/></w:rPr>").underline()).isTrue();
      assertThat(run("<w:rPr><w:u w:val=\"none\"/></w:rPr>").underline()).isFalse();
      assertThat(run("<w:rPr><w:u w:val=\"0\"/></w:rPr>").underline()).isTrue();
    }

    @Test
    @DisplayName("should read all flags together")
    void shouldReadAllFlags() {
      assertThat(run("<w:rPr><w:b/><w:i/><w:u w:val=\"double\"/><w:strike/></w:rPr>"))
          .isEqualTo(new RunProperties(true, true, true, true));
    }

    @Test
    @DisplayName("should ignore toggles from other namespaces")
    void shouldIgnoreForeignToggles() {
      RunProperties properties =
          extractor.runProperties(
              element("<w:r><w:rPr><o:b xmlns:o=\"urn:other\"/></w:rPr><w:t>x</w:t></w:r>"));

      assertThat(properties.bold()).isFalse();
    }
  }

  @Nested
  @DisplayName("indent parsing")
  class IndentParsingTests {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({"720, 720", "720.5, 720", "' 360', 360", "+15, 15", "-240, 0", "abc, 0", "'', 0"})
    void shouldParseLeadingInteger(String value, int expected) {
      assertThat(PropertyExtractor.parseIndent(value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should saturate oversized values")
    void shouldSaturate_whenValueTooLarge() {
      assertThat(PropertyExtractor.parseIndent("99999999999999999999999"))
          .isEqualTo(Integer.MAX_VALUE);
    }
  }
}
