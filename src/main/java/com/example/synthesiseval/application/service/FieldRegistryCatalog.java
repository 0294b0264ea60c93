package com.example.synthesiseval.application.service;

import com.example.synthesiseval.config.EvaluationProperties;
import com.example.synthesiseval.domain.exception.InvalidFieldRegistryException;
import com.example.synthesiseval.domain.exception.UnknownRegistryException;
import com.example.synthesiseval.domain.model.FieldDeclaration;
import com.example.synthesiseval.domain.model.FieldRegistry;
import com.example.synthesiseval.infrastructure.registry.ClasspathFieldRegistryLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Application-layer lookup of the field registries bundled with the service.
 * Registries are loaded once at startup, so a broken registry file stops the application from booting.
 */
@Service
public class FieldRegistryCatalog {

    private static final Logger log = LoggerFactory.getLogger(FieldRegistryCatalog.class);
    private static final String CUSTOM_REGISTRY_NAME = "custom";

    private final Map<String, FieldRegistry> registries;
    private final String defaultRegistry;

	/**
	 * Loads every configured registry and checks that the default one exists.
	 *
	 * @param loader     infrastructure loader for registry resources
	 * @param properties evaluation configuration
	 */
    public FieldRegistryCatalog(ClasspathFieldRegistryLoader loader, EvaluationProperties properties) {
        Map<String, FieldRegistry> loaded = new LinkedHashMap<>();
        for (FieldRegistry registry : loader.loadAll(properties.registryLocations())) {
            if (loaded.putIfAbsent(registry.name(), registry) != null) {
                throw new InvalidFieldRegistryException("Field registry '" + registry.name() + "' is declared twice.");
            }
        }
        if (!loaded.containsKey(properties.defaultRegistry())) {
            throw new UnknownRegistryException(properties.defaultRegistry());
        }
        this.registries = Collections.unmodifiableMap(loaded);
        this.defaultRegistry = properties.defaultRegistry();
        log.info("Loaded field registries {} (default '{}')", registries.keySet(), defaultRegistry);
    }

	/**
	 * Picks the registry for a request: inline declarations win, then a named registry, then the default.
	 *
	 * @param name         registry name from the request, may be {@code null}
	 * @param declarations inline field declarations, may be {@code null} or empty
	 * @return resolved registry
	 * @throws UnknownRegistryException when the named registry does not exist
	 */
    public FieldRegistry resolve(String name, List<FieldDeclaration> declarations) {
        if (declarations != null && !declarations.isEmpty()) {
            String registryName = name == null || name.isBlank() ? CUSTOM_REGISTRY_NAME : name;
            return new FieldRegistry(registryName, declarations.stream().map(FieldDeclaration::toSpec).toList());
        }
        if (name == null || name.isBlank()) {
            return registries.get(defaultRegistry);
        }
        FieldRegistry registry = registries.get(name.trim());
        if (registry == null) {
            throw new UnknownRegistryException(name);
        }
        return registry;
    }

    public Set<String> names() {
        return registries.keySet();
    }
}
