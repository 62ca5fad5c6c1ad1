package com.flamingo.storyboard.service.importing;

import com.flamingo.storyboard.service.docx.model.OutputDocument;

/**
 * A successfully converted package, ready to be stored as a new chapter.
 *
 * @param title chapter title derived from the file name
 * @param sourceFileName display name of the originating package
 * @param document converted block sequence
 * @param html {@code document} serialized as editor HTML, the chapter body
 */
public record ImportedChapter(
    String title, String sourceFileName, OutputDocument document, String html) {}
