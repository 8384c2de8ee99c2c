package com.eainde.boardingpass.document;

import com.eainde.boardingpass.exception.FatalInputException;
import com.eainde.boardingpass.exception.FatalInputException.Reason;
import com.eainde.boardingpass.model.ExtractionRequest;
import com.eainde.boardingpass.pipeline.ExtractionSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validates an upload and decodes it into raster pages. Raster formats go through {@link ImageIO};
 * PDFs are rendered page by page with PDFBox.
 */
@Slf4j
public class DocumentLoader {

    static final String PDF = "application/pdf";

    private static final Set<String> SUPPORTED = Set.of(
            "image/jpeg", "image/png", "image/gif", "image/bmp", "image/tiff", PDF);

    private static final Map<String, String> ALIASES = Map.of(
            "image/jpg", "image/jpeg",
            "image/pjpeg", "image/jpeg",
            "image/x-png", "image/png",
            "image/x-ms-bmp", "image/bmp",
            "image/tif", "image/tiff");

    private final ExtractionSettings settings;

    public DocumentLoader(ExtractionSettings settings) {
        this.settings = settings;
    }

    /**
     * @throws FatalInputException when the upload is empty, too large, of an unsupported type or undecodable
     */
    public LoadedDocument load(ExtractionRequest request) {
        byte[] content = request.getContent();
        if (content == null || content.length == 0) {
            throw new FatalInputException(Reason.EMPTY, "Uploaded document is empty");
        }
        if (content.length > settings.getMaxUploadBytes()) {
            throw new FatalInputException(Reason.TOO_LARGE, String.format(
                    "Uploaded document is %d bytes, limit is %d", content.length, settings.getMaxUploadBytes()));
        }

        String mediaType = normalize(request.getMediaType());
        if (!SUPPORTED.contains(mediaType)) {
            throw new FatalInputException(Reason.UNSUPPORTED_MEDIA_TYPE,
                    "Unsupported media type: " + request.getMediaType());
        }

        int pageLimit = request.getPageLimit() == null
                ? settings.getMaxPages()
                : Math.min(request.getPageLimit(), settings.getMaxPages());

        List<BufferedImage> pages = PDF.equals(mediaType)
                ? renderPdf(content, pageLimit)
                : readRaster(content, mediaType, pageLimit);

        log.debug("Loaded {} page(s) of {} ({} bytes)", pages.size(), mediaType, content.length);
        return new LoadedDocument(mediaType, content, pages);
    }

    static String normalize(String mediaType) {
        if (mediaType == null) {
            return "";
        }
        String base = mediaType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(base, base);
    }

    private List<BufferedImage> renderPdf(byte[] content, int pageLimit) {
        try (PDDocument document = Loader.loadPDF(content)) {
            int pageCount = document.getNumberOfPages();
            if (pageCount == 0) {
                throw new FatalInputException(Reason.UNREADABLE, "PDF has no pages");
            }
            PDFRenderer renderer = new PDFRenderer(document);
            List<BufferedImage> pages = new ArrayList<>();
            for (int i = 0; i < Math.min(pageCount, pageLimit); i++) {
                pages.add(renderPage(renderer, i));
            }
            return pages;
        } catch (FatalInputException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            // PDFBox reports some malformed content as unchecked exceptions
            throw new FatalInputException(Reason.UNREADABLE, "PDF could not be read: " + e.getMessage(), e);
        }
    }

    protected BufferedImage renderPage(PDFRenderer renderer, int pageIndex) throws IOException {
        return renderer.renderImageWithDPI(pageIndex, settings.getRenderDpi(), ImageType.RGB);
    }

    private List<BufferedImage> readRaster(byte[] content, String mediaType, int pageLimit) {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(content))) {
            Iterator<ImageReader> readers = input == null ? null : ImageIO.getImageReaders(input);
            if (readers == null || !readers.hasNext()) {
                throw new FatalInputException(Reason.UNREADABLE, "No decoder recognises the " + mediaType + " upload");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input);
                // Only TIFF carries one pass per frame; animated GIF frames are not separate pages.
                int frames = "image/tiff".equals(mediaType) ? Math.max(1, reader.getNumImages(true)) : 1;
                List<BufferedImage> pages = new ArrayList<>();
                for (int i = 0; i < Math.min(frames, pageLimit); i++) {
                    pages.add(reader.read(i));
                }
                return pages;
            } finally {
                reader.dispose();
            }
        } catch (FatalInputException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new FatalInputException(Reason.UNREADABLE, "Image could not be decoded: " + e.getMessage(), e);
        }
    }
}
