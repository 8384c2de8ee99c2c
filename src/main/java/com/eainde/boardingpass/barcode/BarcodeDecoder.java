package com.eainde.boardingpass.barcode;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.GlobalHistogramBinarizer;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.multi.GenericMultipleBarcodeReader;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Finds every boarding-pass symbology on a page image using ZXing. A page is decoded with the
 * hybrid binarizer first and the global histogram binarizer as a second chance for flat screenshots.
 */
@Slf4j
public class BarcodeDecoder {

    static final Set<BarcodeFormat> FORMATS = EnumSet.of(
            BarcodeFormat.PDF_417,
            BarcodeFormat.QR_CODE,
            BarcodeFormat.AZTEC,
            BarcodeFormat.DATA_MATRIX,
            BarcodeFormat.CODE_128);

    private final Map<DecodeHintType, Object> hints;

    public BarcodeDecoder() {
        Map<DecodeHintType, Object> h = new EnumMap<>(DecodeHintType.class);
        h.put(DecodeHintType.POSSIBLE_FORMATS, FORMATS);
        h.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
        h.put(DecodeHintType.CHARACTER_SET, "ISO-8859-1");
        this.hints = h;
    }

    /**
     * Decodes all symbols on the image. Returns an empty list, never throws, when nothing is found.
     */
    public List<DecodedBarcode> decode(BufferedImage image, int page) {
        LuminanceSource source = new BufferedImageLuminanceSource(image);
        List<Function<LuminanceSource, BinaryBitmap>> binarizers = List.of(
                s -> new BinaryBitmap(new HybridBinarizer(s)),
                s -> new BinaryBitmap(new GlobalHistogramBinarizer(s)));

        for (Function<LuminanceSource, BinaryBitmap> binarizer : binarizers) {
            List<DecodedBarcode> found = decodeMultiple(binarizer.apply(source), page);
            if (!found.isEmpty()) {
                return found;
            }
        }
        return List.of();
    }

    private List<DecodedBarcode> decodeMultiple(BinaryBitmap bitmap, int page) {
        MultiFormatReader delegate = new MultiFormatReader();
        delegate.setHints(hints);
        GenericMultipleBarcodeReader reader = new GenericMultipleBarcodeReader(delegate);
        try {
            Result[] results = reader.decodeMultiple(bitmap, hints);
            // Same symbol may be reported more than once from overlapping sub-regions
            Map<String, DecodedBarcode> unique = new LinkedHashMap<>();
            for (Result result : results) {
                unique.putIfAbsent(result.getText(),
                        new DecodedBarcode(result.getText(), result.getBarcodeFormat().name(), page));
            }
            return new ArrayList<>(unique.values());
        } catch (NotFoundException e) {
            return List.of();
        } catch (RuntimeException e) {
            log.warn("Barcode reader failed on page {}: {}", page, e.toString());
            return List.of();
        }
    }
}
