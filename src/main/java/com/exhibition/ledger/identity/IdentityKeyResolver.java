package com.exhibition.ledger.identity;

import com.exhibition.ledger.core.Digests;
import com.exhibition.ledger.core.model.IdentityKey;
import com.exhibition.ledger.core.model.RawRecord;
import com.exhibition.ledger.rules.CompanyNameRules;
import com.exhibition.ledger.rules.NormalizationEngine;
import com.exhibition.ledger.rules.ValueNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Computes a stable identity key from a record's identifying attributes.
 *
 * <p>Precedence, strongest first:</p>
 * <ol>
 *   <li>website domain</li>
 *   <li>phone number with enough digits</li>
 *   <li>e-mail address</li>
 *   <li>hash of the normalized company name (English or Persian)</li>
 *   <li>random fallback, unique per call</li>
 * </ol>
 *
 * <p>Apart from the random fallback the result is a pure function of the attribute
 * values, so it is stable across calls, runs and process restarts.</p>
 */
public class IdentityKeyResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityKeyResolver.class);

    static final int HASH_LENGTH = 12;

    private final IdentityFields fields;
    private final NormalizationEngine nameEngine;
    private final Supplier<String> randomSeed;

    public IdentityKeyResolver() {
        this(IdentityFields.defaults());
    }

    public IdentityKeyResolver(IdentityFields fields) {
        this(fields, CompanyNameRules.createDefaultEngine(), () -> UUID.randomUUID().toString());
    }

    public IdentityKeyResolver(IdentityFields fields, NormalizationEngine nameEngine, Supplier<String> randomSeed) {
        this.fields = fields;
        this.nameEngine = nameEngine;
        this.randomSeed = randomSeed;
    }

    public IdentityKey resolve(RawRecord record) {
        return resolve(record.fields());
    }

    /**
     * Resolves the identity key of a row. Never returns null.
     */
    public IdentityKey resolve(Map<String, String> row) {
        Optional<IdentityKey> key = resolveReproducible(row);
        if (key.isPresent()) {
            return key.get();
        }
        IdentityKey random = IdentityKey.random(Digests.md5Prefix(randomSeed.get(), HASH_LENGTH));
        log.debug("identity.fallback key={}", random);
        return random;
    }

    /**
     * Resolves the key from identifying attributes only, without the random fallback.
     */
    public Optional<IdentityKey> resolveReproducible(Map<String, String> row) {
        for (String column : fields.getWebsiteColumns()) {
            String domain = DomainNormalizer.normalize(lookup(row, column));
            if (!domain.isEmpty()) {
                return Optional.of(IdentityKey.website(domain));
            }
        }

        for (String column : fields.getPhoneColumns()) {
            PhoneNormalizer.CanonicalPhone phone =
                    PhoneNormalizer.canonicalize(lookup(row, column), fields.getDefaultCountryCode());
            if (!phone.isEmpty() && phone.internationalLength() >= fields.getMinPhoneDigits()) {
                return Optional.of(IdentityKey.phone(phone.digits()));
            }
        }

        for (String column : fields.getEmailColumns()) {
            String email = normalizeEmail(lookup(row, column));
            if (!email.isEmpty()) {
                return Optional.of(IdentityKey.email(email));
            }
        }

        for (String column : fields.getNameColumns()) {
            String raw = ValueNormalizer.normalize(DomainNormalizer.firstSegment(lookup(row, column)));
            if (raw.isEmpty()) {
                continue;
            }
            String normalized = nameEngine.normalize(raw);
            String basis = normalized.length() >= fields.getMinNameLength() ? normalized : raw;
            return Optional.of(IdentityKey.companyNameHash(Digests.sha256Prefix(basis, HASH_LENGTH)));
        }

        return Optional.empty();
    }

    static String normalizeEmail(String value) {
        for (String part : (value != null ? value : "").split("\\|")) {
            String email = ValueNormalizer.normalize(part).toLowerCase(Locale.ROOT);
            if (email.startsWith("mailto:")) {
                email = email.substring("mailto:".length()).strip();
            }
            if (email.contains("@")) {
                return email;
            }
        }
        return "";
    }

    /**
     * Looks a column up by exact name, then case-insensitively.
     */
    static String lookup(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value != null) {
            return value;
        }
        for (Map.Entry<String, String> entry : row.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(column)) {
                return entry.getValue();
            }
        }
        return "";
    }

    public IdentityFields getFields() {
        return fields;
    }
}
