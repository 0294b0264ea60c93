package com.example.synthesiseval.infrastructure.registry;

import com.example.synthesiseval.domain.exception.UnknownComparatorKindException;
import com.example.synthesiseval.domain.model.ComparatorKind;
import com.example.synthesiseval.domain.model.FieldRegistry;
import com.example.synthesiseval.domain.model.FieldSpec;
import com.example.synthesiseval.infrastructure.exception.RegistryLoadingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for reading field registries from JSON resources.
 */
class ClasspathFieldRegistryLoaderTest {

    private final ClasspathFieldRegistryLoader loader =
            new ClasspathFieldRegistryLoader(new DefaultResourceLoader(), new ObjectMapper());

    /**
     * Ensures the bundled characterisation registry declares its fields in order with their parameters.
     */
    @Test
    void loadsBundledCharacterisationRegistry() {
        FieldRegistry registry = loader.load("classpath:registries/characterisation.json");

        assertThat(registry.name()).isEqualTo("characterisation");
        assertThat(registry.fieldNames())
                .containsExactly("names", "ir_material", "ir_bands", "ea_formula", "ea_calc", "ea_exp");
        FieldSpec bands = registry.fields().get(2);
        assertThat(bands.kind()).isEqualTo(ComparatorKind.NUMERIC_SET_WITH_TOLERANCE);
        assertThat(bands.params().tolerance()).isEqualTo(3);
        assertThat(registry.fields().get(4).kind()).isEqualTo(ComparatorKind.KEYED_NUMERIC_SERIES);
    }

    @Test
    void loadAllKeepsLocationOrder() {
        List<FieldRegistry> registries = loader.loadAll(List.of(
                "classpath:registries/cbu.json", "classpath:registries/chemicals.json"));

        assertThat(registries).extracting(FieldRegistry::name).containsExactly("cbu", "chemicals");
    }

    /**
     * Ensures missing and unparsable resources surface as infrastructure failures.
     */
    @Test
    void unreadableResourcesFailAsInfrastructureErrors() {
        assertThrows(RegistryLoadingException.class, () -> loader.load("classpath:registries/missing.json"));
        assertThrows(RegistryLoadingException.class, () -> loader.load("classpath:fixtures/malformed-registry.json"));
    }

    /**
     * Ensures a bad declaration inside a readable file is reported as a configuration error.
     */
    @Test
    void unknownKindIsReportedAsConfigurationError() {
        assertThrows(UnknownComparatorKindException.class,
                () -> loader.load("classpath:fixtures/unknown-kind-registry.json"));
    }
}
