package com.flamingo.storyboard.service.importing;

/**
 * An uploaded DOCX package awaiting conversion.
 *
 * @param displayName file name shown to the user; used for the chapter title and failure reports
 * @param content raw package bytes
 */
public record DocxPackage(String displayName, byte[] content) {}
