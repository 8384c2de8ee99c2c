package com.eainde.boardingpass.ocr;

import java.awt.image.BufferedImage;

/**
 * Text recognizer. Implementations must be safe to call concurrently.
 */
public interface OcrEngine {

    String recognize(BufferedImage image, OcrConfiguration configuration);
}
