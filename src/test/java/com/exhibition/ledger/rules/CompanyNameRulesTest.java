package com.exhibition.ledger.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class CompanyNameRulesTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = CompanyNameRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        assertEquals("", engine.normalize(null));
        assertEquals("", engine.normalize(""));
        assertEquals("", engine.normalize("   "));
    }

    @ParameterizedTest
    @DisplayName("Should remove English legal-form words")
    @CsvSource({
            "Acme Company,acme",
            "Acme Ltd.,acme",
            "ACME Inc,acme",
            "Acme Group,acme",
            "Acme Corp.,acme"
    })
    void testEnglishStopWords(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @Test
    @DisplayName("Should remove stop words only as whole words")
    void testWholeWordsOnly() {
        assertEquals("income partners", engine.normalize("Income Partners"));
        assertEquals("groupon", engine.normalize("Groupon"));
    }

    @Test
    @DisplayName("Should remove Persian company and group words")
    void testPersianStopWords() {
        assertEquals("آلفا", engine.normalize("شرکت آلفا"));
        assertEquals("آلفا", engine.normalize("گروه آلفا"));
    }

    @Test
    @DisplayName("Should treat punctuation and zero-width non-joiner as spaces")
    void testPunctuation() {
        assertEquals("alpha beta", engine.normalize("Alpha-Beta"));
        assertEquals("alpha beta", engine.normalize("Alpha & Beta!"));
        assertEquals("می رسان", engine.normalize("می\u200Cرسان"));
    }

    @Test
    @DisplayName("Spelling variants should normalize to the same name")
    void testEquivalence() {
        assertEquals(engine.normalize("ACME trading co"), engine.normalize("Acme Trading Co. Ltd"));
        assertNotEquals(engine.normalize("Apex"), engine.normalize("Acme"));
    }
}
