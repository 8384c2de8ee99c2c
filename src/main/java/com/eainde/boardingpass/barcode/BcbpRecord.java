package com.eainde.boardingpass.barcode;

import com.eainde.boardingpass.model.FlightSegment;
import com.eainde.boardingpass.model.Passenger;

import java.util.List;

/**
 * Content of one IATA BCBP "M" payload: one passenger and one segment per encoded leg.
 */
public record BcbpRecord(Passenger passenger, String bookingReference, List<FlightSegment> legs) {

    public BcbpRecord {
        legs = List.copyOf(legs);
    }
}
