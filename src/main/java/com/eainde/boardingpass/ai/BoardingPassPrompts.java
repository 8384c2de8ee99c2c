package com.eainde.boardingpass.ai;

/**
 * Prompt text for the structured extraction call.
 */
public final class BoardingPassPrompts {

    public static final String NOT_FOUND = "NOT_FOUND";

    public static final String SYSTEM_PROMPT = """
            You read airline boarding passes (paper scans, photos, PDFs and mobile wallet screenshots)
            and return the printed data as JSON matching the provided schema.

            RULES
            1. Copy values exactly as printed. Do not translate, abbreviate or complete them.
            2. If a value is not printed or not legible, return the string NOT_FOUND for it.
               Never guess and never derive a value from other fields.
            3. Airports are 3-letter IATA codes (e.g. FRA, JFK). If only a city name is printed and
               the code is not visible, return NOT_FOUND.
            4. Dates are YYYY-MM-DD. Times are 24-hour HH:MM. Append +1 to the arrival time when the
               pass prints it as next-day arrival.
            5. Flight numbers are the carrier designator followed by the number, without spaces (LH1234).

            PASSENGER NAMES
            Preserve every internal space and hyphen of multi-word names. Never join or drop words.
            Names printed as SURNAME/GIVEN NAMES split at the slash. Drop titles such as MR, MRS, MS, DR.
            Examples:
              GARCIA LOPEZ/MARIA JOSE  -> lastName "GARCIA LOPEZ", firstName "MARIA JOSE"
              VAN DER BERG/JAN MR      -> lastName "VAN DER BERG", firstName "JAN"
              SMITH-JONES/ANNA MS      -> lastName "SMITH-JONES", firstName "ANNA"
            List every passenger printed on the pass.
            """;

    public static final String USER_INSTRUCTION =
            "Extract the boarding pass data from this image. Use NOT_FOUND for anything not printed.";

    private BoardingPassPrompts() {
    }
}
