package com.exhibition.ledger.bulk;

import com.exhibition.ledger.rules.ValueNormalizer;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns one extracted JSON object into a flat row.
 *
 * <ul>
 *   <li>scalars map to one column (see {@link FieldMapping})</li>
 *   <li>arrays put element 1 in {@code Col} and element <i>i</i> in {@code Col{i}}</li>
 *   <li>objects become {@code key_subkey} columns</li>
 *   <li>company names and addresses are also split by script into {@code *FA} and {@code *EN}</li>
 *   <li>phones land in {@code Phone1}, {@code Phone2}, ...</li>
 *   <li>persons become {@code ContactName{i}} plus {@code PositionEN{i}} or {@code PositionFA{i}}</li>
 * </ul>
 * All cell values pass through {@link ValueNormalizer}; empty values are omitted.
 */
final class JsonRecordFlattener {

    private static final Pattern PERSIAN_SCRIPT = Pattern.compile("[\\u0600-\\u06FF]");

    private JsonRecordFlattener() {
        // Utility class
    }

    static Map<String, String> flatten(JsonNode object) {
        Map<String, String> row = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if (FieldMapping.isDropped(key) || value == null || value.isNull()) {
                continue;
            }
            switch (key) {
                case "phones" -> putNumbered(row, "Phone", textValues(value), 1);
                case "persons" -> putPersons(row, value);
                case "company_names" -> putByScript(row, "CompanyName", textValues(value));
                case "addresses" -> putByScript(row, "Address", textValues(value));
                default -> putGeneric(row, key, value);
            }
        }
        return row;
    }

    static boolean isPersian(String text) {
        return text != null && PERSIAN_SCRIPT.matcher(text).find();
    }

    private static void putGeneric(Map<String, String> row, String key, JsonNode value) {
        String column = FieldMapping.columnFor(key);
        if (value.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode element : value) {
                values.add(text(element));
            }
            putArray(row, column, values);
        } else if (value.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> subFields = value.fields();
            while (subFields.hasNext()) {
                Map.Entry<String, JsonNode> sub = subFields.next();
                put(row, key + "_" + sub.getKey(), text(sub.getValue()));
            }
        } else {
            put(row, column, text(value));
        }
    }

    /**
     * Element 1 goes to the base column, element i to {@code column + i}.
     */
    private static void putArray(Map<String, String> row, String column, List<String> values) {
        for (int i = 0; i < values.size(); i++) {
            put(row, i == 0 ? column : column + (i + 1), values.get(i));
        }
    }

    private static void putNumbered(Map<String, String> row, String base, List<String> values, int first) {
        int n = first;
        for (String value : values) {
            if (put(row, base + n, value)) {
                n++;
            }
        }
    }

    /**
     * The first Persian value fills {@code baseFA}, the first Latin one {@code baseEN};
     * values after the first stay in {@code base2}, {@code base3}, ... so none is lost.
     */
    private static void putByScript(Map<String, String> row, String base, List<String> values) {
        boolean fa = false;
        boolean en = false;
        for (int i = 0; i < values.size(); i++) {
            String value = ValueNormalizer.normalize(values.get(i));
            if (value.isEmpty()) {
                continue;
            }
            if (isPersian(value) && !fa) {
                put(row, base + "FA", value);
                fa = true;
            } else if (!isPersian(value) && !en) {
                put(row, base + "EN", value);
                en = true;
            }
            if (i > 0) {
                put(row, base + (i + 1), value);
            }
        }
    }

    private static void putPersons(Map<String, String> row, JsonNode persons) {
        if (!persons.isArray()) {
            putGeneric(row, "persons", persons);
            return;
        }
        int index = 1;
        for (JsonNode person : persons) {
            String suffix = index > 1 ? String.valueOf(index) : "";
            if (person.isObject()) {
                put(row, "ContactName" + suffix, text(person.get("name")));
                String position = ValueNormalizer.normalize(text(person.get("position")));
                put(row, (isPersian(position) ? "PositionFA" : "PositionEN") + suffix, position);
            } else {
                put(row, "ContactName" + suffix, text(person));
            }
            index++;
        }
    }

    private static List<String> textValues(JsonNode value) {
        List<String> values = new ArrayList<>();
        if (value.isArray()) {
            for (JsonNode element : value) {
                values.add(text(element));
            }
        } else {
            values.add(text(value));
        }
        return values;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        if (node.isValueNode()) {
            return node.isNumber() ? ValueNormalizer.normalize(node.decimalValue()) : node.asText();
        }
        return node.toString();
    }

    private static boolean put(Map<String, String> row, String column, String value) {
        String normalized = ValueNormalizer.normalize(value);
        if (normalized.isEmpty()) {
            return false;
        }
        row.put(column, normalized);
        return true;
    }
}
