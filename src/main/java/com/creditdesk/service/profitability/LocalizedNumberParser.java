package com.creditdesk.service.profitability;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses amounts and rates as typed in fr-FR forms: "200 000 €", "8,5 %", "1.250,75".
 *
 * Never throws. The leading decimal number is read and trailing text ignored,
 * so "12 m²" reads 12. Input with no leading digits reads as 0.
 */
public final class LocalizedNumberParser {

    // Regular, no-break and narrow no-break spaces are all thousands separators
    private static final Pattern NOISE = Pattern.compile("[\\s\\u00A0\\u202F€%]|EUR", Pattern.CASE_INSENSITIVE);
    // Plain decimal only: no exponent, hex or type suffix
    private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(\\d+(\\.\\d+)?|\\.\\d+)");

    private LocalizedNumberParser() {
    }

    public static double parse(String raw) {
        if (raw == null) {
            return 0;
        }
        String cleaned = NOISE.matcher(raw).replaceAll("");
        if (cleaned.isEmpty()) {
            return 0;
        }
        // "1.250,75": dots group thousands, the comma is the decimal mark
        if (cleaned.indexOf(',') >= 0 && cleaned.indexOf('.') >= 0) {
            cleaned = cleaned.replace(".", "");
        }
        cleaned = cleaned.replace(',', '.');
        Matcher matcher = LEADING_NUMBER.matcher(cleaned);
        if (!matcher.find()) {
            return 0;
        }
        return Double.parseDouble(matcher.group());
    }
}
