package com.eainde.boardingpass.ocr;

import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

import java.awt.image.BufferedImage;

/**
 * {@link OcrEngine} backed by Tess4J. A {@link Tesseract} handle is not thread-safe, so every call
 * builds its own. Without a data path Tess4J falls back to {@code TESSDATA_PREFIX}.
 */
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

    private static final int OEM_LSTM_ONLY = 1;

    private final String dataPath;
    private final String language;

    public TesseractOcrEngine(String dataPath, String language) {
        this.dataPath = dataPath;
        this.language = language;
    }

    @Override
    public String recognize(BufferedImage image, OcrConfiguration configuration) {
        Tesseract tesseract = new Tesseract();
        if (dataPath != null && !dataPath.isBlank()) {
            tesseract.setDatapath(dataPath);
        }
        tesseract.setLanguage(language);
        tesseract.setPageSegMode(configuration.pageSegMode());
        tesseract.setOcrEngineMode(OEM_LSTM_ONLY);
        tesseract.setVariable("user_defined_dpi", "300");
        try {
            return tesseract.doOCR(image);
        } catch (TesseractException e) {
            throw new OcrException("Tesseract failed with configuration " + configuration.name(), e);
        } catch (UnsatisfiedLinkError | NoClassDefFoundError e) {
            log.error("Tesseract is not usable on this host", e);
            throw new OcrException("Tesseract native library unavailable", e);
        }
    }
}
