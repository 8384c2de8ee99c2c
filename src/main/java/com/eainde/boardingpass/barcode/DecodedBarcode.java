package com.eainde.boardingpass.barcode;

/**
 * Raw text of one symbol found on a page, with the symbology ZXing reported (e.g. {@code PDF_417}).
 */
public record DecodedBarcode(String text, String format, int page) {
}
