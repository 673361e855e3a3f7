package com.exhibition.ledger.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KeyTypeTest {

    @Test
    @DisplayName("Declaration order should be precedence order")
    void testPrecedence() {
        assertTrue(KeyType.WEBSITE.isStrongerThan(KeyType.PHONE));
        assertTrue(KeyType.PHONE.isStrongerThan(KeyType.EMAIL));
        assertTrue(KeyType.EMAIL.isStrongerThan(KeyType.COMPANY_NAME_HASH));
        assertTrue(KeyType.COMPANY_NAME_HASH.isStrongerThan(KeyType.RANDOM));
        assertFalse(KeyType.PHONE.isStrongerThan(KeyType.PHONE));
    }

    @Test
    @DisplayName("IdentityKey should derive a token and reject blank values")
    void testIdentityKey() {
        assertEquals("website:acme.com", IdentityKey.website("acme.com").token());
        assertThrows(IllegalArgumentException.class, () -> IdentityKey.email(" "));
        assertEquals("COMP_UNKNOWN_ABCDEF012345", IdentityKey.random("abcdef012345").companyId());
    }

    @Test
    @DisplayName("SheetState should report the first duplicate column")
    void testSheetState() {
        SheetState state = new SheetState(List.of("CompanyID", "Email", "", "", "Email"), 4);
        assertEquals("Email", state.duplicateColumn().orElseThrow());
        assertEquals(3, state.dataRowCount());
        assertTrue(SheetState.empty().isEmpty());
    }

    @Test
    @DisplayName("MergedRecord should put CompanyID first")
    void testMergedRecordOrder() {
        MergedRecord record = new MergedRecord("COMP_1", Map.of("Email", "a@b.c"), 2);
        assertEquals(List.of("CompanyID", "Email"), List.copyOf(record.values().keySet()));
        assertTrue(record.isMerged());
    }
}
