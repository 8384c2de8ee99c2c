package com.eainde.boardingpass.ocr;

import java.util.List;
import java.util.Locale;

/**
 * A page-segmentation assumption handed to the recognizer.
 */
public record OcrConfiguration(String name, int pageSegMode) {

    public static final OcrConfiguration AUTO = new OcrConfiguration("auto", 3);
    /** Also detects orientation, which covers passes photographed upside down. */
    public static final OcrConfiguration AUTO_OSD = new OcrConfiguration("auto_osd", 1);
    public static final OcrConfiguration BLOCK = new OcrConfiguration("block", 6);
    public static final OcrConfiguration SPARSE = new OcrConfiguration("sparse", 11);

    public static List<OcrConfiguration> defaults() {
        return List.of(AUTO, AUTO_OSD, BLOCK, SPARSE);
    }

    public static OcrConfiguration named(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "auto_osd" -> AUTO_OSD;
            case "block" -> BLOCK;
            case "sparse" -> SPARSE;
            default -> throw new IllegalArgumentException("Unknown OCR configuration: " + name);
        };
    }
}
