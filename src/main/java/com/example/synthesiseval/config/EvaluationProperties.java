package com.example.synthesiseval.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Binds {@code evaluation.*} from {@code application.properties}.
 *
 * @param defaultRegistry    registry used when a request names none
 * @param registryLocations  resource locations of the bundled registry files
 * @param debugByDefault     whether requests without an explicit flag collect mismatch explanations
 */
@ConfigurationProperties(prefix = "evaluation")
public record EvaluationProperties(
        String defaultRegistry,
        List<String> registryLocations,
        boolean debugByDefault
) {

    public static final String DEFAULT_REGISTRY = "characterisation";

    public EvaluationProperties {
        if (defaultRegistry == null || defaultRegistry.isBlank()) {
            defaultRegistry = DEFAULT_REGISTRY;
        }
        if (registryLocations == null || registryLocations.isEmpty()) {
            registryLocations = List.of(
                    "classpath:registries/characterisation.json",
                    "classpath:registries/chemicals.json",
                    "classpath:registries/cbu.json"
            );
        }
    }
}
