package com.eainde.boardingpass.airport;

import java.util.Optional;

/**
 * Reference dataset of airports. Every airport code in an extraction result must pass
 * {@link #isValidAirportCode(String)}.
 */
public interface AirportDirectory {

    boolean isValidAirportCode(String iataCode);

    Optional<AirportInfo> lookup(String iataCode);
}
