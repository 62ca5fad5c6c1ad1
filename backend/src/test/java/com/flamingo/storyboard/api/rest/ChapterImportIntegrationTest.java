package com.flamingo.storyboard.api.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.storyboard.support.DocxFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

/** End-to-end import through the full application context. */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Chapter import integration")
class ChapterImportIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  @DisplayName("should import good files and report the broken one")
  void shouldImportBatch() throws Exception {
    byte[] first =
        DocxFixtures.docx(
            "<w:p><w:pPr><w:pStyle w:val=\"Heading1\"/></w:pPr><w:r><w:t>Arrival</w:t></w:r></w:p>"
                + "<w:p><w:r><w:rPr><w:i/></w:rPr><w:t>It rained.</w:t></w:r></w:p>");
    byte[] third = DocxFixtures.docx("<w:p><w:pPr><w:jc w:val=\"center\"/></w:pPr></w:p>");

    mockMvc
        .perform(
            multipart("/api/chapters/import")
                .file(new MockMultipartFile("files", "Chapter 1.docx", null, first))
                .file(
                    new MockMultipartFile(
                        "files", "Chapter 2.docx", null, DocxFixtures.docxWithoutDocumentPart()))
                .file(new MockMultipartFile("files", "Chapter 3.docx", null, third)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.chapters.length()").value(2))
        .andExpect(jsonPath("$.chapters[0].title").value("Chapter 1"))
        .andExpect(
            jsonPath("$.chapters[0].html").value("<h1>Arrival</h1><p><em>It rained.</em></p>"))
        .andExpect(jsonPath("$.chapters[1].title").value("Chapter 3"))
        .andExpect(jsonPath("$.chapters[1].html").value("<p class=\"ql-align-center\"><br></p>"))
        .andExpect(jsonPath("$.failures.length()").value(1))
        .andExpect(jsonPath("$.failures[0].fileName").value("Chapter 2.docx"))
        .andExpect(jsonPath("$.failures[0].errorKind").value("MISSING_DOCUMENT_PART"));
  }
}
