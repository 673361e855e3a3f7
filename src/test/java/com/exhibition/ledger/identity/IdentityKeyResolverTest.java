package com.exhibition.ledger.identity;

import com.exhibition.ledger.core.model.IdentityKey;
import com.exhibition.ledger.core.model.KeyType;
import com.exhibition.ledger.core.model.RawRecord;
import com.exhibition.ledger.core.model.RecordSource;
import com.exhibition.ledger.rules.CompanyNameRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdentityKeyResolver Tests")
class IdentityKeyResolverTest {

    private IdentityKeyResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new IdentityKeyResolver();
    }

    @Nested
    @DisplayName("Precedence")
    class Precedence {

        @Test
        @DisplayName("Website should win over phone, e-mail and name")
        void websiteWins() {
            IdentityKey key = resolver.resolve(Map.of(
                    "Website", "https://acme.com",
                    "Phone1", "02188776655",
                    "Email", "info@acme.com",
                    "CompanyNameEN", "Acme"));
            assertEquals(IdentityKey.website("acme.com"), key);
        }

        @Test
        @DisplayName("Phone should win over e-mail when the website is unusable")
        void phoneWhenNoWebsite() {
            IdentityKey key = resolver.resolve(Map.of(
                    "Website", "nan",
                    "Phone1", "021-8877-6655",
                    "Email", "info@acme.com"));
            assertEquals(KeyType.PHONE, key.type());
            assertEquals("02188776655", key.value());
        }

        @Test
        @DisplayName("A phone below the digit threshold should be skipped")
        void shortPhoneSkipped() {
            IdentityKey key = resolver.resolve(Map.of(
                    "Phone1", "1234",
                    "Email", "mailto:Info@Acme.com"));
            assertEquals(IdentityKey.email("info@acme.com"), key);
        }

        @Test
        @DisplayName("Company name hash should be used when nothing else is present")
        void nameHash() {
            IdentityKey key = resolver.resolve(Map.of("CompanyNameFA", "شرکت آلفا"));
            assertEquals(KeyType.COMPANY_NAME_HASH, key.type());
            assertEquals(12, key.value().length());
        }

        @Test
        @DisplayName("Column lookup should fall back to a case-insensitive match")
        void caseInsensitiveLookup() {
            IdentityKey key = resolver.resolve(Map.of("WEBSITE", "acme.com"));
            assertEquals(IdentityKey.website("acme.com"), key);
        }
    }

    @Nested
    @DisplayName("Reproducibility")
    class Reproducibility {

        @Test
        @DisplayName("Equivalent website spellings should resolve to the same key")
        void websiteSpellings() {
            RawRecord a = new RawRecord(RecordSource.OCR_QR, "card_1.pdf", Map.of("Website", "https://acme.com"));
            RawRecord b = new RawRecord(RecordSource.SCRAPE, "acme.com", Map.of("Website", "www.acme.com/contact"));

            assertEquals(IdentityKey.website("acme.com"), resolver.resolve(a));
            assertEquals(resolver.resolve(a), resolver.resolve(b));
        }

        @Test
        @DisplayName("International and national phone forms should resolve to the same key")
        void phoneForms() {
            IdentityKey international = resolver.resolve(Map.of("Phone1", "+98 21 1234"));
            IdentityKey national = resolver.resolve(Map.of("Phone1", "0211234"));

            assertEquals(KeyType.PHONE, international.type());
            assertEquals(international, national);
            assertEquals(international.companyId(), national.companyId());
        }

        @Test
        @DisplayName("Company name variants should hash identically")
        void nameVariants() {
            IdentityKey a = resolver.resolve(Map.of("CompanyNameEN", "ACME Trading Co. Ltd"));
            IdentityKey b = resolver.resolve(Map.of("CompanyNameEN", "acme trading co"));
            assertEquals(a, b);
        }

        @Test
        @DisplayName("Keys should be identical across resolver instances")
        void acrossInstances() {
            Map<String, String> row = Map.of("Email", "sales@apex.ir");
            IdentityKeyResolver other = new IdentityKeyResolver(IdentityFields.defaults());
            assertEquals(resolver.resolve(row).companyId(), other.resolve(row).companyId());
            assertTrue(resolver.resolve(row).companyId().matches("COMP_[A-F0-9]{12}"));
        }
    }

    @Nested
    @DisplayName("Random fallback")
    class RandomFallback {

        @Test
        @DisplayName("Rows without identifying attributes should get distinct random keys")
        void distinctRandomKeys() {
            Map<String, String> row = Map.of("Notes", "met at hall 3");
            IdentityKey first = resolver.resolve(row);
            IdentityKey second = resolver.resolve(row);

            assertEquals(KeyType.RANDOM, first.type());
            assertFalse(first.isReproducible());
            assertNotEquals(first, second);
            assertTrue(first.companyId().startsWith(IdentityKey.UNKNOWN_COMPANY_ID_PREFIX));
        }

        @Test
        @DisplayName("resolveReproducible should be empty when only the random fallback applies")
        void reproducibleEmpty() {
            assertTrue(resolver.resolveReproducible(Map.of("Notes", "x")).isEmpty());
        }

        @Test
        @DisplayName("Random seed supplier should be consulted once per fallback")
        void seedSupplierUsed() {
            AtomicInteger calls = new AtomicInteger();
            IdentityKeyResolver seeded = new IdentityKeyResolver(IdentityFields.defaults(),
                    CompanyNameRules.createDefaultEngine(), () -> "seed-" + calls.incrementAndGet());

            seeded.resolve(Map.of());
            seeded.resolve(Map.of("Website", "acme.com"));

            assertEquals(1, calls.get());
        }
    }

    @Test
    @DisplayName("Custom identity fields should change the columns consulted")
    void customFields() {
        IdentityFields fields = IdentityFields.builder()
                .websiteColumns(List.of("homepage"))
                .phoneColumns(List.of())
                .emailColumns(List.of())
                .nameColumns(List.of())
                .build();
        IdentityKeyResolver custom = new IdentityKeyResolver(fields);

        assertEquals(IdentityKey.website("acme.com"), custom.resolve(Map.of("homepage", "acme.com")));
        assertEquals(KeyType.RANDOM, custom.resolve(Map.of("Website", "acme.com")).type());
    }

    @Test
    @DisplayName("Builder should reject invalid country codes")
    void invalidCountryCode() {
        assertThrows(IllegalArgumentException.class,
                () -> IdentityFields.builder().defaultCountryCode("+98"));
    }
}
