package com.exhibition.ledger.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A set of differently-named input columns recognized as semantically identical,
 * mapped to one canonical column name.
 *
 * @param canonical the surviving column name
 * @param members   every column name in the group, canonical included, in table order
 */
public record ColumnGroup(String canonical, List<String> members) {

    public ColumnGroup {
        Objects.requireNonNull(canonical, "canonical is required");
        members = members != null ? List.copyOf(members) : List.of();
    }

    public static ColumnGroup of(String canonical, String... members) {
        return new ColumnGroup(canonical, List.of(members));
    }

    /**
     * Members other than the canonical column; these are dropped once merged.
     */
    public List<String> redundant() {
        return members.stream().filter(m -> !m.equals(canonical)).toList();
    }

    public boolean contains(String column) {
        return members.contains(column);
    }
}
