package com.semanticdiff.core.diff;

import java.util.Objects;

/**
 * A single change between two model versions.
 *
 * <p>Paths follow a fixed scheme:
 * <ul>
 *   <li>{@code Entity} and {@code Entity.field} for entities</li>
 *   <li>{@code Entity.Property} and {@code Entity.Property.field} for properties</li>
 *   <li>{@code From→To} and {@code From→To.field} for relationships</li>
 *   <li>{@code rule:Name} and {@code rule:Name.field} for business rules</li>
 *   <li>{@code metadata:key} for metadata entries</li>
 * </ul>
 *
 * @param changeType added, removed or modified
 * @param elementType kind of element changed
 * @param elementName name (or identity key) of the changed element
 * @param parentName owning entity for property changes, null otherwise
 * @param path full path of the change
 * @param oldValue old value or summary, null for additions
 * @param newValue new value or summary, null for removals
 * @param details free-text detail (may be empty)
 */
public record Change(
    ChangeType changeType,
    ElementType elementType,
    String elementName,
    String parentName,
    String path,
    String oldValue,
    String newValue,
    String details
) {
    /**
     * Compact constructor with validation.
     */
    public Change {
        Objects.requireNonNull(changeType, "changeType must not be null");
        Objects.requireNonNull(elementType, "elementType must not be null");
        Objects.requireNonNull(elementName, "elementName must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (details == null) {
            details = "";
        }
    }

    static Change added(ElementType elementType, String elementName, String parentName,
                        String path, String newValue, String details) {
        return new Change(ChangeType.ADDED, elementType, elementName, parentName, path, null, newValue, details);
    }

    static Change removed(ElementType elementType, String elementName, String parentName,
                          String path, String oldValue, String details) {
        return new Change(ChangeType.REMOVED, elementType, elementName, parentName, path, oldValue, null, details);
    }

    static Change modified(ElementType elementType, String elementName, String parentName,
                           String path, String oldValue, String newValue, String details) {
        return new Change(ChangeType.MODIFIED, elementType, elementName, parentName, path, oldValue, newValue, details);
    }
}
