package com.eainde.boardingpass.image;

import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Produces the OCR input variants of a page. Pure and deterministic: the same image always yields
 * the same variants in the same order.
 */
@Slf4j
public class ImagePreprocessor {

    public static final String ORIENTED = "oriented";
    public static final String CONTRAST = "contrast";
    public static final String SHARPENED = "sharpened";
    public static final String BINARY = "binary";
    public static final String UPSCALED = "upscaled";

    private static final double SIDEWAYS_RATIO = 1.5;
    private static final int PROFILE_SAMPLE_WIDTH = 400;

    private final int upscaleBelowWidth;

    public ImagePreprocessor(int upscaleBelowWidth) {
        this.upscaleBelowWidth = upscaleBelowWidth;
    }

    public List<NamedVariant> preprocess(BufferedImage image) {
        BufferedImage oriented = isSideways(image) ? ImageOps.rotateClockwise(image) : image;
        BufferedImage gray = ImageOps.toGray(oriented);
        BufferedImage contrast = ImageOps.stretchContrast(gray, 0.01, 0.99);

        List<NamedVariant> variants = new ArrayList<>();
        variants.add(new NamedVariant(ORIENTED, oriented));
        variants.add(new NamedVariant(CONTRAST, contrast));
        variants.add(new NamedVariant(SHARPENED, ImageOps.sharpen(contrast)));
        variants.add(new NamedVariant(BINARY, ImageOps.binarize(contrast, ImageOps.otsuThreshold(contrast))));
        if (oriented.getWidth() < upscaleBelowWidth) {
            variants.add(new NamedVariant(UPSCALED, ImageOps.scale(contrast, 2.0)));
        }
        log.debug("Prepared {} OCR variants from {}x{} page", variants.size(), image.getWidth(), image.getHeight());
        return variants;
    }

    /**
     * Horizontal text produces strongly alternating row sums (lines and gaps) while column sums stay
     * flat. When the column profile varies much more than the row profile the text runs vertically.
     */
    boolean isSideways(BufferedImage image) {
        BufferedImage sample = image.getWidth() > PROFILE_SAMPLE_WIDTH
                ? ImageOps.scale(image, (double) PROFILE_SAMPLE_WIDTH / image.getWidth())
                : image;
        BufferedImage gray = ImageOps.toGray(sample);
        int threshold = ImageOps.otsuThreshold(gray);
        int w = gray.getWidth();
        int h = gray.getHeight();
        double[] rows = new double[h];
        double[] cols = new double[w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (gray.getRaster().getSample(x, y, 0) <= threshold) {
                    rows[y]++;
                    cols[x]++;
                }
            }
        }
        double rowVariance = normalizedVariance(rows, w);
        double colVariance = normalizedVariance(cols, h);
        return colVariance > rowVariance * SIDEWAYS_RATIO;
    }

    private static double normalizedVariance(double[] profile, int length) {
        if (profile.length == 0 || length == 0) {
            return 0;
        }
        double mean = 0;
        for (double v : profile) {
            mean += v / length;
        }
        mean /= profile.length;
        double variance = 0;
        for (double v : profile) {
            double d = v / length - mean;
            variance += d * d;
        }
        return variance / profile.length;
    }
}
