package com.eainde.boardingpass.barcode;

import com.eainde.boardingpass.document.LoadedDocument;
import com.eainde.boardingpass.image.ImageOps;
import com.eainde.boardingpass.model.ExtractionField;
import com.eainde.boardingpass.model.ExtractionMethod;
import com.eainde.boardingpass.model.FlightSegment;
import com.eainde.boardingpass.model.Passenger;
import com.eainde.boardingpass.pipeline.Candidate;
import com.eainde.boardingpass.pipeline.Deadline;
import com.eainde.boardingpass.pipeline.ExtractionSettings;
import com.eainde.boardingpass.pipeline.ExtractionStrategy;
import com.eainde.boardingpass.pipeline.StrategyFailure;
import com.eainde.boardingpass.pipeline.StrategyOutcome;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Reads BCBP barcodes from every loaded page, upright and rotated a quarter turn in parallel.
 * Several passes (one per passenger or per leg) are combined into one candidate.
 */
@Slf4j
public class BarcodeExtractionStrategy implements ExtractionStrategy {

    static final double FIELD_CONFIDENCE = 0.95;
    static final double SEAT_CONFIDENCE = 0.90;

    private final BarcodeDecoder decoder;
    private final BcbpParser parser;
    private final ExecutorService executor;
    private final ExtractionSettings settings;

    public BarcodeExtractionStrategy(BarcodeDecoder decoder, BcbpParser parser,
                                     ExecutorService executor, ExtractionSettings settings) {
        this.decoder = decoder;
        this.parser = parser;
        this.executor = executor;
        this.settings = settings;
    }

    @Override
    public String name() {
        return "barcode";
    }

    @Override
    public ExtractionMethod.Kind kind() {
        return ExtractionMethod.Kind.BARCODE;
    }

    @Override
    public StrategyOutcome attempt(LoadedDocument document, Deadline deadline) {
        List<DecodedBarcode> decoded = decodeAllPages(document.getPages(), deadline.budget(settings.getBarcodeBudget()));
        if (decoded.isEmpty()) {
            return StrategyOutcome.failure(new StrategyFailure(name(), StrategyFailure.Reason.NOT_FOUND,
                    "no barcode detected"));
        }

        List<BcbpRecord> records = new ArrayList<>();
        String format = null;
        for (DecodedBarcode barcode : decoded) {
            var record = parser.parse(barcode.text());
            if (record.isPresent()) {
                records.add(record.get());
                if (format == null) {
                    format = barcode.format();
                }
            } else {
                log.info("Decoded {} on page {} is not an IATA BCBP payload", barcode.format(), barcode.page());
            }
        }
        if (records.isEmpty()) {
            return StrategyOutcome.failure(new StrategyFailure(name(), StrategyFailure.Reason.UNPARSEABLE,
                    "barcode decoded (" + decoded.get(0).format() + ") but payload is not a valid boarding pass"));
        }

        log.info("Parsed {} boarding pass barcode(s), first format {}", records.size(), format);
        return StrategyOutcome.success(toCandidate(records, format));
    }

    private Candidate toCandidate(List<BcbpRecord> records, String format) {
        Map<String, FlightSegment> segments = new LinkedHashMap<>();
        Set<Passenger> passengers = new LinkedHashSet<>();
        for (BcbpRecord record : records) {
            passengers.add(record.passenger());
            for (FlightSegment leg : record.legs()) {
                segments.putIfAbsent(leg.flightNumber() + "|" + leg.flightDate(), leg);
            }
        }

        List<FlightSegment> segmentList = new ArrayList<>(segments.values());
        FlightSegment primary = segmentList.get(0);
        Map<ExtractionField, Double> confidence = new EnumMap<>(ExtractionField.class);
        confidence.put(ExtractionField.FLIGHT_NUMBER, FIELD_CONFIDENCE);
        confidence.put(ExtractionField.DEPARTURE_AIRPORT, FIELD_CONFIDENCE);
        confidence.put(ExtractionField.ARRIVAL_AIRPORT, FIELD_CONFIDENCE);
        confidence.put(ExtractionField.FLIGHT_DATE, FIELD_CONFIDENCE);
        confidence.put(ExtractionField.PASSENGER_NAME, FIELD_CONFIDENCE);
        confidence.put(ExtractionField.BOOKING_REFERENCE, FIELD_CONFIDENCE);
        if (primary.seat() != null) {
            confidence.put(ExtractionField.SEAT, SEAT_CONFIDENCE);
        }

        return Candidate.builder()
                .method(ExtractionMethod.barcode(format))
                .segments(segmentList)
                .passengers(new ArrayList<>(passengers))
                .bookingReference(records.get(0).bookingReference())
                .fieldConfidence(confidence)
                .build();
    }

    private List<DecodedBarcode> decodeAllPages(List<BufferedImage> pages, Duration budget) {
        List<Callable<List<DecodedBarcode>>> scans = new ArrayList<>();
        for (int i = 0; i < pages.size(); i++) {
            BufferedImage page = pages.get(i);
            int pageNumber = i + 1;
            scans.add(() -> decoder.decode(page, pageNumber));
            scans.add(() -> decoder.decode(ImageOps.rotateClockwise(page), pageNumber));
        }

        List<Future<List<DecodedBarcode>>> futures;
        try {
            futures = executor.invokeAll(scans, budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        }

        // Upright reads come before rotated ones, so their order wins on duplicates
        Map<String, DecodedBarcode> unique = new LinkedHashMap<>();
        boolean timedOut = false;
        for (Future<List<DecodedBarcode>> future : futures) {
            if (future.isCancelled()) {
                timedOut = true;
                continue;
            }
            try {
                future.get().forEach(b -> unique.putIfAbsent(b.text(), b));
            } catch (ExecutionException e) {
                log.warn("Barcode scan failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (timedOut) {
            log.warn("Barcode scan exceeded its {} ms budget; using symbols found so far", budget.toMillis());
        }
        return new ArrayList<>(unique.values());
    }
}
