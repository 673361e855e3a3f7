package com.exhibition.ledger.core.model;

import com.exhibition.ledger.core.Digests;

import java.util.Locale;
import java.util.Objects;

/**
 * Typed value used to decide whether two raw records describe the same entity.
 * Two records with equal keys are presumed to be the same company.
 *
 * @param type  the attribute the key was derived from
 * @param value the normalized attribute value (domain, digits, e-mail, or hash prefix)
 */
public record IdentityKey(KeyType type, String value) {

    /** Prefix shared by all generated company identifiers. */
    public static final String COMPANY_ID_PREFIX = "COMP_";

    /** Prefix for identifiers derived from the non-reproducible random fallback. */
    public static final String UNKNOWN_COMPANY_ID_PREFIX = COMPANY_ID_PREFIX + "UNKNOWN_";

    public IdentityKey {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(value, "value is required");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }

    public static IdentityKey website(String domain) {
        return new IdentityKey(KeyType.WEBSITE, domain);
    }

    public static IdentityKey phone(String digits) {
        return new IdentityKey(KeyType.PHONE, digits);
    }

    public static IdentityKey email(String email) {
        return new IdentityKey(KeyType.EMAIL, email);
    }

    public static IdentityKey companyNameHash(String hashPrefix) {
        return new IdentityKey(KeyType.COMPANY_NAME_HASH, hashPrefix);
    }

    public static IdentityKey random(String hashPrefix) {
        return new IdentityKey(KeyType.RANDOM, hashPrefix);
    }

    public boolean isReproducible() {
        return type != KeyType.RANDOM;
    }

    /**
     * Derives the {@code CompanyID} column value for this key.
     * Reproducible keys map to {@code COMP_<12 hex>} (a SHA-256 prefix of type and value);
     * random keys map to {@code COMP_UNKNOWN_<12 hex>}.
     */
    public String companyId() {
        if (type == KeyType.RANDOM) {
            return UNKNOWN_COMPANY_ID_PREFIX + value.toUpperCase(Locale.ROOT);
        }
        return COMPANY_ID_PREFIX + Digests.sha256Prefix(type.name() + ":" + value, 12).toUpperCase(Locale.ROOT);
    }

    /**
     * Stable grouping token, e.g. {@code website:acme.com}.
     */
    public String token() {
        return type.name().toLowerCase(Locale.ROOT) + ":" + value;
    }

    @Override
    public String toString() {
        return "IdentityKey{" + token() + '}';
    }
}
