package com.exhibition.ledger.reconcile;

import com.exhibition.ledger.core.model.ColumnGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reconciliation pass detection")
class ReconciliationPassTest {

    @Nested
    @DisplayName("Numbered suffix pass")
    class Numbered {

        private final NumberedSuffixPass pass = new NumberedSuffixPass();

        @ParameterizedTest
        @DisplayName("Should strip trailing numbers and separators")
        @CsvSource({
                "Phone1,phone",
                "phone_3,phone",
                "Phone 10,phone",
                "Email-2,email",
                "Address,address",
                "2024,2024"
        })
        void testBaseName(String column, String expected) {
            assertEquals(expected, NumberedSuffixPass.baseName(column));
        }

        @Test
        @DisplayName("Shortest name should be canonical and members ordered by length")
        void testGroup() {
            List<ColumnGroup> groups = pass.detect(List.of("Phone10", "Phone2", "Phone1", "Fax"), Set.of());

            assertEquals(1, groups.size());
            assertEquals("Phone1", groups.get(0).canonical());
            assertEquals(List.of("Phone1", "Phone2", "Phone10"), groups.get(0).members());
        }

        @Test
        @DisplayName("Protected columns should be ignored")
        void testProtected() {
            List<ColumnGroup> groups = pass.detect(List.of("file_name", "file_name2"), Set.of("file_name"));
            assertTrue(groups.isEmpty());
        }
    }

    @Nested
    @DisplayName("Case duplicate pass")
    class CaseDuplicate {

        @Test
        @DisplayName("First spelling should be canonical")
        void testGroup() {
            List<ColumnGroup> groups = new CaseDuplicatePass()
                    .detect(List.of("website", "Notes", "Website", " WEBSITE"), Set.of());

            assertEquals(1, groups.size());
            assertEquals("website", groups.get(0).canonical());
            assertEquals(List.of("website", "Website", " WEBSITE"), groups.get(0).members());
        }
    }

    @Nested
    @DisplayName("Bilingual pair pass")
    class Bilingual {

        private final BilingualPairPass pass = new BilingualPairPass();

        @Test
        @DisplayName("Should pair each naming convention")
        void testConventions() {
            List<ColumnGroup> groups = pass.detect(List.of(
                    "CompanyNameEN", "CompanyNameFA",
                    "city_en", "city_fa",
                    "DescriptionEnglish", "DescriptionPersian",
                    "Address", "AddressFA",
                    "Services", "Services_translated",
                    "Notes"), Set.of());

            assertEquals(List.of(
                    ColumnGroup.of("CompanyNameEN", "CompanyNameEN", "CompanyNameFA"),
                    ColumnGroup.of("city_en", "city_en", "city_fa"),
                    ColumnGroup.of("DescriptionEnglish", "DescriptionEnglish", "DescriptionPersian"),
                    ColumnGroup.of("Address", "Address", "AddressFA"),
                    ColumnGroup.of("Services", "Services", "Services_translated")), groups);
        }

        @Test
        @DisplayName("A lone Persian column should not be grouped")
        void testUnpaired() {
            assertTrue(pass.detect(List.of("CompanyNameFA", "Notes"), Set.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Alias group pass")
    class Alias {

        private final AliasGroupPass pass = new AliasGroupPass(AliasGroupPass.defaultAliases());

        @Test
        @DisplayName("Present canonical should come first")
        void testCanonicalFirst() {
            List<ColumnGroup> groups = pass.detect(List.of("faxes", "Fax"), Set.of());
            assertEquals(List.of(ColumnGroup.of("Fax", "Fax", "faxes")), groups);
        }

        @Test
        @DisplayName("Absent canonical should be introduced by renaming")
        void testRename() {
            List<ColumnGroup> groups = pass.detect(List.of("urls", "qr_link"), Set.of());
            assertEquals(List.of(
                    ColumnGroup.of("Website", "urls"),
                    ColumnGroup.of("QRLink", "qr_link")), groups);
        }

        @Test
        @DisplayName("Canonical alone should produce no group")
        void testCanonicalAlone() {
            assertTrue(pass.detect(List.of("Email", "Website"), Set.of()).isEmpty());
        }
    }
}
