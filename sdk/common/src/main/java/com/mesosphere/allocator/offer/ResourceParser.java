package com.mesosphere.allocator.offer;

import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;
import org.apache.mesos.Protos.Value;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parses resources from the Mesos agent text format: entries separated by {@code ;}, each of the form
 * {@code name(role):value}. The role is optional and defaults to {@code *} (unreserved); any other role denotes a
 * static reservation. Values are scalars ({@code 4.5}), ranges ({@code [31000-32000,33000-33010]}) or sets
 * ({@code {a,b,c}}).
 *
 * <pre>
 * cpus:4;mem:4096;ports:[31000-32000];cpus(eng):1;disks:{sda,sdb}
 * </pre>
 */
public final class ResourceParser {

    private ResourceParser() {
        // do not instantiate
    }

    /**
     * @throws IllegalArgumentException if the text is malformed
     */
    public static ResourceSet parse(String text) {
        Map<ResourceKey, Value> entries = new TreeMap<>();
        for (String item : Splitter.on(';').trimResults().omitEmptyStrings().split(text)) {
            int colon = item.indexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException(String.format(
                        "Malformed resource '%s' in '%s': expected name:value", item, text));
            }
            String nameAndRole = item.substring(0, colon).trim();
            String valueText = item.substring(colon + 1).trim();

            String name = nameAndRole;
            String role = Constants.ANY_ROLE;
            int paren = nameAndRole.indexOf('(');
            if (paren >= 0) {
                if (!nameAndRole.endsWith(")")) {
                    throw new IllegalArgumentException(String.format(
                            "Malformed role in '%s' in '%s'", nameAndRole, text));
                }
                name = nameAndRole.substring(0, paren).trim();
                role = nameAndRole.substring(paren + 1, nameAndRole.length() - 1).trim();
            }
            if (StringUtils.isBlank(name) || StringUtils.isBlank(role)) {
                throw new IllegalArgumentException(String.format("Missing name or role in '%s' in '%s'", item, text));
            }

            Value value = parseValue(valueText, item);
            ResourceKey key = ResourceKey.reserved(name, value.getType(), ResourceKey.ReservationKind.STATIC, role);
            Value current = entries.get(key);
            entries.put(key, current == null ? value : ValueUtils.add(current, value));
        }
        return ResourceSet.create(entries);
    }

    private static Value parseValue(String text, String item) {
        if (text.startsWith("[")) {
            if (!text.endsWith("]")) {
                throw new IllegalArgumentException(String.format("Unterminated ranges in '%s'", item));
            }
            Value.Ranges.Builder ranges = Value.Ranges.newBuilder();
            for (String range : splitItems(text)) {
                List<String> bounds = Splitter.on('-').trimResults().splitToList(range);
                if (bounds.size() != 2) {
                    throw new IllegalArgumentException(String.format("Malformed range '%s' in '%s'", range, item));
                }
                long begin = parseLong(bounds.get(0), item);
                long end = parseLong(bounds.get(1), item);
                if (begin > end) {
                    throw new IllegalArgumentException(String.format("Range begin > end: '%s' in '%s'", range, item));
                }
                ranges.addRange(Value.Range.newBuilder().setBegin(begin).setEnd(end));
            }
            // Normalize overlapping input ranges:
            Value zero = ValueUtils.getZero(Value.Type.RANGES);
            return ValueUtils.add(zero, Value.newBuilder().setType(Value.Type.RANGES).setRanges(ranges).build());
        } else if (text.startsWith("{")) {
            if (!text.endsWith("}")) {
                throw new IllegalArgumentException(String.format("Unterminated set in '%s'", item));
            }
            Value.Set.Builder set = Value.Set.newBuilder();
            for (String element : splitItems(text)) {
                set.addItem(element);
            }
            return ValueUtils.add(
                    ValueUtils.getZero(Value.Type.SET),
                    Value.newBuilder().setType(Value.Type.SET).setSet(set).build());
        } else {
            double scalar;
            try {
                scalar = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format("Malformed scalar in '%s'", item), e);
            }
            if (scalar < 0 || Double.isNaN(scalar) || Double.isInfinite(scalar)) {
                throw new IllegalArgumentException(String.format("Invalid scalar in '%s'", item));
            }
            return ValueUtils.toValue(scalar);
        }
    }

    private static List<String> splitItems(String bracketed) {
        return Splitter.on(',')
                .trimResults()
                .omitEmptyStrings()
                .splitToList(bracketed.substring(1, bracketed.length() - 1));
    }

    private static long parseLong(String text, String item) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Malformed range bound '%s' in '%s'", text, item), e);
        }
    }
}
