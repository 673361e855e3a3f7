package com.exhibition.ledger.identity;

import java.util.List;

/**
 * Which columns carry identifying attributes, and how phone numbers are canonicalized.
 * Each list is in priority order; column lookup falls back to a case-insensitive match.
 */
public class IdentityFields {

    private static final List<String> DEFAULT_WEBSITE_COLUMNS =
            List.of("Website", "url", "urls", "URL", "QRLink");
    private static final List<String> DEFAULT_PHONE_COLUMNS =
            List.of("Phone1", "Phone2", "Phone3", "Phone4", "Phone", "phones", "WhatsApp");
    private static final List<String> DEFAULT_EMAIL_COLUMNS =
            List.of("Email", "emails", "OtherEmails");
    private static final List<String> DEFAULT_NAME_COLUMNS =
            List.of("CompanyNameEN", "CompanyNameFA", "CompanyName", "company_names");
    private static final String DEFAULT_COUNTRY_CODE = "98";
    private static final int DEFAULT_MIN_PHONE_DIGITS = 8;
    private static final int DEFAULT_MIN_NAME_LENGTH = 2;

    private final List<String> websiteColumns;
    private final List<String> phoneColumns;
    private final List<String> emailColumns;
    private final List<String> nameColumns;
    private final String defaultCountryCode;
    private final int minPhoneDigits;
    private final int minNameLength;

    private IdentityFields(Builder builder) {
        this.websiteColumns = List.copyOf(builder.websiteColumns);
        this.phoneColumns = List.copyOf(builder.phoneColumns);
        this.emailColumns = List.copyOf(builder.emailColumns);
        this.nameColumns = List.copyOf(builder.nameColumns);
        this.defaultCountryCode = builder.defaultCountryCode;
        this.minPhoneDigits = builder.minPhoneDigits;
        this.minNameLength = builder.minNameLength;
    }

    public List<String> getWebsiteColumns() {
        return websiteColumns;
    }

    public List<String> getPhoneColumns() {
        return phoneColumns;
    }

    public List<String> getEmailColumns() {
        return emailColumns;
    }

    public List<String> getNameColumns() {
        return nameColumns;
    }

    public String getDefaultCountryCode() {
        return defaultCountryCode;
    }

    public int getMinPhoneDigits() {
        return minPhoneDigits;
    }

    public int getMinNameLength() {
        return minNameLength;
    }

    public static IdentityFields defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> websiteColumns = DEFAULT_WEBSITE_COLUMNS;
        private List<String> phoneColumns = DEFAULT_PHONE_COLUMNS;
        private List<String> emailColumns = DEFAULT_EMAIL_COLUMNS;
        private List<String> nameColumns = DEFAULT_NAME_COLUMNS;
        private String defaultCountryCode = DEFAULT_COUNTRY_CODE;
        private int minPhoneDigits = DEFAULT_MIN_PHONE_DIGITS;
        private int minNameLength = DEFAULT_MIN_NAME_LENGTH;

        public Builder websiteColumns(List<String> websiteColumns) {
            this.websiteColumns = websiteColumns;
            return this;
        }

        public Builder phoneColumns(List<String> phoneColumns) {
            this.phoneColumns = phoneColumns;
            return this;
        }

        public Builder emailColumns(List<String> emailColumns) {
            this.emailColumns = emailColumns;
            return this;
        }

        public Builder nameColumns(List<String> nameColumns) {
            this.nameColumns = nameColumns;
            return this;
        }

        public Builder defaultCountryCode(String defaultCountryCode) {
            if (defaultCountryCode == null || !defaultCountryCode.matches("\\d{1,3}")) {
                throw new IllegalArgumentException("defaultCountryCode must be 1-3 digits");
            }
            this.defaultCountryCode = defaultCountryCode;
            return this;
        }

        public Builder minPhoneDigits(int minPhoneDigits) {
            if (minPhoneDigits <= 0) {
                throw new IllegalArgumentException("minPhoneDigits must be positive");
            }
            this.minPhoneDigits = minPhoneDigits;
            return this;
        }

        public Builder minNameLength(int minNameLength) {
            if (minNameLength <= 0) {
                throw new IllegalArgumentException("minNameLength must be positive");
            }
            this.minNameLength = minNameLength;
            return this;
        }

        public IdentityFields build() {
            if (websiteColumns == null || phoneColumns == null
                    || emailColumns == null || nameColumns == null) {
                throw new IllegalArgumentException("column lists must not be null");
            }
            return new IdentityFields(this);
        }
    }
}
