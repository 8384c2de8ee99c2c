package com.eainde.boardingpass.image;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;

/**
 * Pixel-level helpers. Every method returns a new image and leaves its input untouched.
 */
public final class ImageOps {

    private static final float[] SHARPEN = {
            0f, -1f, 0f,
            -1f, 5f, -1f,
            0f, -1f, 0f
    };

    private ImageOps() {
    }

    public static BufferedImage toGray(BufferedImage src) {
        BufferedImage gray = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        for (int y = 0; y < src.getHeight(); y++) {
            for (int x = 0; x < src.getWidth(); x++) {
                int lum = luminance(src.getRGB(x, y));
                gray.getRaster().setSample(x, y, 0, lum);
            }
        }
        return gray;
    }

    public static int luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
    }

    /** Histogram of an 8-bit grayscale image. */
    public static int[] histogram(BufferedImage gray) {
        int[] histogram = new int[256];
        for (int y = 0; y < gray.getHeight(); y++) {
            for (int x = 0; x < gray.getWidth(); x++) {
                histogram[gray.getRaster().getSample(x, y, 0)]++;
            }
        }
        return histogram;
    }

    /**
     * Linear stretch mapping the low percentile to black and the high percentile to white.
     */
    public static BufferedImage stretchContrast(BufferedImage gray, double lowPercentile, double highPercentile) {
        int[] histogram = histogram(gray);
        long total = (long) gray.getWidth() * gray.getHeight();
        int low = percentile(histogram, total, lowPercentile);
        int high = percentile(histogram, total, highPercentile);
        BufferedImage out = new BufferedImage(gray.getWidth(), gray.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        if (high <= low) {
            out.setData(gray.getData());
            return out;
        }
        double scale = 255.0 / (high - low);
        for (int y = 0; y < gray.getHeight(); y++) {
            for (int x = 0; x < gray.getWidth(); x++) {
                int v = gray.getRaster().getSample(x, y, 0);
                int stretched = (int) Math.round((v - low) * scale);
                out.getRaster().setSample(x, y, 0, Math.max(0, Math.min(255, stretched)));
            }
        }
        return out;
    }

    private static int percentile(int[] histogram, long total, double fraction) {
        long target = (long) Math.ceil(total * fraction);
        long seen = 0;
        for (int i = 0; i < histogram.length; i++) {
            seen += histogram[i];
            if (seen >= target) {
                return i;
            }
        }
        return 255;
    }

    public static BufferedImage sharpen(BufferedImage gray) {
        ConvolveOp op = new ConvolveOp(new Kernel(3, 3, SHARPEN), ConvolveOp.EDGE_NO_OP, null);
        BufferedImage out = new BufferedImage(gray.getWidth(), gray.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        return op.filter(gray, out);
    }

    /**
     * Otsu's threshold: the grey level maximising between-class variance.
     */
    public static int otsuThreshold(BufferedImage gray) {
        int[] histogram = histogram(gray);
        long total = (long) gray.getWidth() * gray.getHeight();
        double sum = 0;
        for (int i = 0; i < 256; i++) {
            sum += (double) i * histogram[i];
        }
        double sumBackground = 0;
        long weightBackground = 0;
        double bestVariance = -1;
        int threshold = 127;
        for (int t = 0; t < 256; t++) {
            weightBackground += histogram[t];
            if (weightBackground == 0) {
                continue;
            }
            long weightForeground = total - weightBackground;
            if (weightForeground == 0) {
                break;
            }
            sumBackground += (double) t * histogram[t];
            double meanBackground = sumBackground / weightBackground;
            double meanForeground = (sum - sumBackground) / weightForeground;
            double between = (double) weightBackground * weightForeground
                    * (meanBackground - meanForeground) * (meanBackground - meanForeground);
            if (between > bestVariance) {
                bestVariance = between;
                threshold = t;
            }
        }
        return threshold;
    }

    public static BufferedImage binarize(BufferedImage gray, int threshold) {
        BufferedImage out = new BufferedImage(gray.getWidth(), gray.getHeight(), BufferedImage.TYPE_BYTE_BINARY);
        for (int y = 0; y < gray.getHeight(); y++) {
            for (int x = 0; x < gray.getWidth(); x++) {
                int v = gray.getRaster().getSample(x, y, 0);
                out.getRaster().setSample(x, y, 0, v > threshold ? 1 : 0);
            }
        }
        return out;
    }

    public static BufferedImage scale(BufferedImage src, double factor) {
        int w = (int) Math.round(src.getWidth() * factor);
        int h = (int) Math.round(src.getHeight() * factor);
        int type = src.getType() == BufferedImage.TYPE_CUSTOM ? BufferedImage.TYPE_INT_RGB : src.getType();
        BufferedImage out = new BufferedImage(w, h, type == BufferedImage.TYPE_BYTE_BINARY ? BufferedImage.TYPE_BYTE_GRAY : type);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.drawImage(src, 0, 0, w, h, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /** Quarter turn clockwise. */
    public static BufferedImage rotateClockwise(BufferedImage src) {
        int w = src.getWidth();
        int h = src.getHeight();
        BufferedImage rotated = new BufferedImage(h, w, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                rotated.setRGB(h - 1 - y, x, src.getRGB(x, y));
            }
        }
        return rotated;
    }
}
