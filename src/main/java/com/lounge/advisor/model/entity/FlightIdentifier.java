package com.lounge.advisor.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.lounge.advisor.exception.ValidationException;
import lombok.Value;

import java.util.Locale;

/**
 * A flight designator split into its carrier code and numeric part.
 * <p>
 * Parsing trims and upper-cases the input, takes the leading run of ASCII
 * letters (truncated to two characters) as the carrier and keeps only the
 * digits of whatever follows. {@code "aa123"}, {@code " AA 123 "} and
 * {@code "AAL123"} all parse to {@code AA/123}.
 */
@Value
public class FlightIdentifier {

    String carrierCode;
    String flightNumber;

    public static FlightIdentifier parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Flight number is required");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);

        int letters = 0;
        while (letters < normalized.length() && isAsciiLetter(normalized.charAt(letters))) {
            letters++;
        }
        if (letters < 2) {
            throw new ValidationException("Invalid flight number '" + raw.trim()
                    + "': expected a 2-letter carrier code followed by digits, e.g. AA123");
        }

        StringBuilder digits = new StringBuilder();
        for (char c : normalized.substring(letters).toCharArray()) {
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        if (digits.length() == 0) {
            throw new ValidationException("Invalid flight number '" + raw.trim()
                    + "': no digits after carrier code");
        }

        return new FlightIdentifier(normalized.substring(0, 2), digits.toString());
    }

    private static boolean isAsciiLetter(char c) {
        return c >= 'A' && c <= 'Z';
    }

    @JsonIgnore
    public String getDesignator() {
        return carrierCode + flightNumber;
    }
}
