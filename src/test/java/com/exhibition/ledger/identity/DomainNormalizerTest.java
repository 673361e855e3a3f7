package com.exhibition.ledger.identity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class DomainNormalizerTest {

    @ParameterizedTest
    @DisplayName("Should reduce URLs to a bare host")
    @CsvSource({
            "https://acme.com,acme.com",
            "www.acme.com/contact,acme.com",
            "https://www.Acme.com:8080/contact?x=1,acme.com",
            "HTTP://WWW2.ACME.CO.IR/,acme.co.ir",
            "acme.com.,acme.com",
            "'  shop.acme.com#top ',shop.acme.com"
    })
    void testNormalize(String input, String expected) {
        assertEquals(expected, DomainNormalizer.normalize(input));
    }

    @ParameterizedTest
    @DisplayName("Should return empty string for values that are not websites")
    @ValueSource(strings = {"", "nan", "info@acme.com", "tel:+982188776655", "BEGIN:VCARD", "localhost"})
    void testNotAWebsite(String input) {
        assertEquals("", DomainNormalizer.normalize(input));
    }

    @Test
    @DisplayName("Should use the first non-empty segment of a joined value")
    void testJoinedValue() {
        assertEquals("acme.com", DomainNormalizer.normalize("acme.com | apex.com"));
        assertEquals("apex.com", DomainNormalizer.normalize(" | apex.com"));
        assertEquals("", DomainNormalizer.normalize(null));
    }
}
