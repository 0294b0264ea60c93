package com.example.synthesiseval.domain.model;

import com.example.synthesiseval.domain.exception.InvalidFieldRegistryException;

/**
 * Static declaration of how one record field is compared.
 */
public record FieldSpec(
        String name,
        ComparatorKind kind,
        ComparatorParams params
) {

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new InvalidFieldRegistryException("Field name is required.");
        }
        if (kind == null) {
            throw new InvalidFieldRegistryException("Field '" + name + "' declares no comparator kind.");
        }
        name = name.trim();
        if (params == null) {
            params = ComparatorParams.DEFAULTS;
        }
    }

    public static FieldSpec of(String name, ComparatorKind kind) {
        return new FieldSpec(name, kind, ComparatorParams.DEFAULTS);
    }
}
