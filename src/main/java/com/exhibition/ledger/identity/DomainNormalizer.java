package com.exhibition.ledger.identity;

import com.exhibition.ledger.rules.ValueNormalizer;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces a URL-ish value to a bare host name.
 * {@code https://www.Acme.com:8080/contact?x=1} becomes {@code acme.com}.
 */
public final class DomainNormalizer {

    private static final Pattern SCHEME = Pattern.compile("^[a-z][a-z0-9+.-]*://");
    private static final Pattern WWW = Pattern.compile("^www\\d*\\.");

    private DomainNormalizer() {
        // Utility class
    }

    /**
     * Returns the normalized domain, or an empty string when the value carries none.
     * Only the first segment of a {@code " | "}-joined value is considered.
     */
    public static String normalize(String url) {
        String value = ValueNormalizer.normalize(firstSegment(url)).toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return "";
        }
        value = value.replace(" ", "");
        value = SCHEME.matcher(value).replaceFirst("");
        value = WWW.matcher(value).replaceFirst("");
        value = cut(value, '/');
        value = cut(value, '?');
        value = cut(value, '#');
        int at = value.lastIndexOf('@');
        if (at >= 0) {
            // user-info or a bare e-mail address is not a website
            return "";
        }
        value = cut(value, ':');
        while (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        // a host needs at least one dot; "tel:+98..." or "BEGIN:VCARD" payloads are not websites
        return value.indexOf('.') > 0 ? value : "";
    }

    static String firstSegment(String value) {
        if (value == null) {
            return "";
        }
        for (String part : value.split("\\|")) {
            if (!ValueNormalizer.normalize(part).isEmpty()) {
                return part;
            }
        }
        return "";
    }

    private static String cut(String value, char separator) {
        int idx = value.indexOf(separator);
        return idx >= 0 ? value.substring(0, idx) : value;
    }
}
