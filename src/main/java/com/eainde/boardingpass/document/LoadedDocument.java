package com.eainde.boardingpass.document;

import com.eainde.boardingpass.exception.ExtractionException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * A decoded upload: the raster pages the strategies work on. Only the first page feeds the AI and
 * OCR strategies; the barcode strategy scans all loaded pages.
 */
public final class LoadedDocument {

    private static final List<String> PASS_THROUGH_TYPES = List.of("image/jpeg", "image/png");

    private final String mediaType;
    private final byte[] content;
    private final List<BufferedImage> pages;

    public LoadedDocument(String mediaType, byte[] content, List<BufferedImage> pages) {
        if (pages.isEmpty()) {
            throw new IllegalArgumentException("A document needs at least one page");
        }
        this.mediaType = mediaType;
        this.content = content;
        this.pages = List.copyOf(pages);
    }

    public String getMediaType() {
        return mediaType;
    }

    public List<BufferedImage> getPages() {
        return pages;
    }

    public BufferedImage firstPage() {
        return pages.get(0);
    }

    /**
     * The first page as JPEG/PNG. Uploads already in one of those formats are sent untouched;
     * everything else is re-encoded as PNG.
     */
    public EncodedImage firstPageEncoded() {
        if (PASS_THROUGH_TYPES.contains(mediaType)) {
            return new EncodedImage(content, mediaType);
        }
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(firstPage(), "png", out)) {
                throw new ExtractionException("No PNG writer available");
            }
            return new EncodedImage(out.toByteArray(), "image/png");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode first page as PNG", e);
        }
    }
}
