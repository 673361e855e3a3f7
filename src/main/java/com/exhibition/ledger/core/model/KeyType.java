package com.exhibition.ledger.core.model;

/**
 * Kind of attribute an {@link IdentityKey} was derived from.
 * Declaration order is the precedence order: a lower ordinal is a stronger signal.
 */
public enum KeyType {
    WEBSITE,
    PHONE,
    EMAIL,
    COMPANY_NAME_HASH,

    /**
     * No identifying attribute was present. Keys of this type are not reproducible
     * across runs, so two unidentifiable records never merge.
     */
    RANDOM;

    public boolean isStrongerThan(KeyType other) {
        return this.ordinal() < other.ordinal();
    }
}
