package com.exhibition.ledger.identity;

import com.exhibition.ledger.rules.ValueNormalizer;

/**
 * Canonicalizes phone numbers to digit strings in national format.
 *
 * <p>International numbers with the default country code ({@code +98 21 1234},
 * {@code 0098211234}) are rewritten to the national form with a trunk zero
 * ({@code 0211234}), so the same line written either way produces the same key.
 * Numbers with another country code keep their international digits.</p>
 */
public final class PhoneNormalizer {

    private PhoneNormalizer() {
        // Utility class
    }

    /**
     * Canonical digit string plus the number of significant digits it represents
     * in international form (country code included).
     */
    public record CanonicalPhone(String digits, int internationalLength) {
        public boolean isEmpty() {
            return digits.isEmpty();
        }
    }

    public static CanonicalPhone canonicalize(String phone, String countryCode) {
        String raw = ValueNormalizer.normalize(DomainNormalizer.firstSegment(phone));
        String digits = digitsOnly(raw);
        if (digits.isEmpty()) {
            return new CanonicalPhone("", 0);
        }

        boolean international = raw.startsWith("+") || digits.startsWith("00");
        if (international) {
            String intl = digits.startsWith("00") ? digits.substring(2) : digits;
            if (intl.startsWith(countryCode) && intl.length() > countryCode.length()) {
                String national = "0" + intl.substring(countryCode.length());
                return new CanonicalPhone(national, intl.length());
            }
            return new CanonicalPhone(intl, intl.length());
        }
        if (digits.startsWith("0")) {
            // trunk zero stands in for the country code
            return new CanonicalPhone(digits, digits.length() - 1 + countryCode.length());
        }
        return new CanonicalPhone(digits, digits.length());
    }

    /**
     * Strips everything but ASCII digits, after converting Persian digits.
     */
    public static String digitsOnly(String value) {
        String ascii = ValueNormalizer.toAsciiDigits(value);
        StringBuilder sb = new StringBuilder(ascii.length());
        for (int i = 0; i < ascii.length(); i++) {
            char c = ascii.charAt(i);
            if (c >= '0' && c <= '9') {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
