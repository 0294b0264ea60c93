package com.example.synthesiseval.domain.model;

import com.example.synthesiseval.domain.exception.InvalidFieldRegistryException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Named, ordered set of field declarations shared by the predicted and gold collections of one run.
 * Declaration order is the order fields appear in every result and report.
 */
public record FieldRegistry(
        String name,
        List<FieldSpec> fields
) {

    public FieldRegistry {
        if (name == null || name.isBlank()) {
            throw new InvalidFieldRegistryException("Registry name is required.");
        }
        if (fields == null || fields.isEmpty()) {
            throw new InvalidFieldRegistryException("Registry '" + name + "' declares no fields.");
        }
        Set<String> seen = new HashSet<>();
        for (FieldSpec field : fields) {
            if (field == null) {
                throw new InvalidFieldRegistryException("Registry '" + name + "' contains an empty field entry.");
            }
            if (!seen.add(field.name())) {
                throw new InvalidFieldRegistryException(
                        "Registry '" + name + "' declares field '" + field.name() + "' more than once.");
            }
        }
        name = name.trim();
        fields = List.copyOf(fields);
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldSpec::name).toList();
    }
}
