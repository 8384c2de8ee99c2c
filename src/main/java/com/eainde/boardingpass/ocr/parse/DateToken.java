package com.eainde.boardingpass.ocr.parse;

import java.time.LocalDate;

/**
 * A date recognised in OCR text.
 *
 * @param confidence base confidence of the notation, before any keyword proximity bonus
 * @param yearInferred true when the text carried no year and one was chosen
 */
public record DateToken(LocalDate date, double confidence, boolean yearInferred, int start, int end) {
}
