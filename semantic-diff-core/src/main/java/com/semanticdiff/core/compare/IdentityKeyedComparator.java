package com.semanticdiff.core.compare;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Compares two collections of items matched by an identity key.
 *
 * <p>This is the primitive every higher-level comparison is built on: the
 * structural diff runs it over entities, properties, relationships, rules and
 * metadata, and the merge engine reuses it through the diff.
 *
 * <p><b>Duplicate keys:</b> {@link #index(Collection, Function)} keeps the
 * <em>last</em> item for a key. A collection holding two items with the same
 * key therefore compares as if only the later one existed. Callers that need
 * duplicates rejected validate their input first (see
 * {@code com.semanticdiff.core.io.OntologyValidator}).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Map<String, OntologyEntity> before = IdentityKeyedComparator.index(a.entities(), OntologyEntity::name);
 * Map<String, OntologyEntity> after = IdentityKeyedComparator.index(b.entities(), OntologyEntity::name);
 *
 * ComparisonResult<OntologyEntity> result = IdentityKeyedComparator.compare(
 *     before, after,
 *     List.of(ComparedField.of("entity_type", OntologyEntity::entityType)));
 * }</pre>
 */
public final class IdentityKeyedComparator {

    private IdentityKeyedComparator() {
        // Utility class
    }

    /**
     * Builds an insertion-ordered identity map; the last item wins on key collision.
     *
     * @param items items to index
     * @param keyExtractor identity key function
     * @param <T> item type
     * @return key to item map
     */
    public static <T> Map<String, T> index(Collection<T> items, Function<T, String> keyExtractor) {
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(keyExtractor, "keyExtractor must not be null");

        Map<String, T> indexed = new LinkedHashMap<>();
        for (T item : items) {
            // a duplicate keeps the first position but takes the later value
            indexed.put(keyExtractor.apply(item), item);
        }
        return indexed;
    }

    /**
     * Compares two identity maps.
     *
     * @param source source (old) items by key
     * @param target target (new) items by key
     * @param fields scalar fields compared on common items, in reporting order
     * @param <T> item type
     * @return added, removed and common keys plus per-field differences
     */
    public static <T> ComparisonResult<T> compare(
        Map<String, T> source,
        Map<String, T> target,
        List<ComparedField<T>> fields
    ) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(fields, "fields must not be null");

        Map<String, T> added = new LinkedHashMap<>();
        for (Map.Entry<String, T> entry : target.entrySet()) {
            if (!source.containsKey(entry.getKey())) {
                added.put(entry.getKey(), entry.getValue());
            }
        }

        Map<String, T> removed = new LinkedHashMap<>();
        List<String> common = new ArrayList<>();
        for (Map.Entry<String, T> entry : source.entrySet()) {
            if (target.containsKey(entry.getKey())) {
                common.add(entry.getKey());
            } else {
                removed.put(entry.getKey(), entry.getValue());
            }
        }

        List<FieldDifference> modified = new ArrayList<>();
        for (String key : common) {
            modified.addAll(compareFields(key, source.get(key), target.get(key), fields));
        }

        return new ComparisonResult<>(added, removed, common, modified);
    }

    /**
     * Compares two flat string maps (e.g. metadata). Every common key whose
     * value differs yields one difference with field name {@code "value"}.
     *
     * @param source source map
     * @param target target map
     * @return comparison result
     */
    public static ComparisonResult<String> compareValues(Map<String, String> source, Map<String, String> target) {
        return compare(source, target, List.of(ComparedField.of("value", Function.identity())));
    }

    /**
     * Compares the given fields of two items sharing an identity key.
     *
     * @param key identity key
     * @param sourceItem source item
     * @param targetItem target item
     * @param fields fields to compare
     * @param <T> item type
     * @return one difference per unequal field
     */
    public static <T> List<FieldDifference> compareFields(
        String key,
        T sourceItem,
        T targetItem,
        List<ComparedField<T>> fields
    ) {
        List<FieldDifference> differences = new ArrayList<>();
        for (ComparedField<T> field : fields) {
            Object oldValue = field.valueOf(sourceItem);
            Object newValue = field.valueOf(targetItem);
            if (!Objects.equals(oldValue, newValue)) {
                differences.add(new FieldDifference(key, field.name(), render(oldValue), render(newValue)));
            }
        }
        return differences;
    }

    private static String render(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
