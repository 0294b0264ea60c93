package com.example.synthesiseval.infrastructure.registry;

import com.example.synthesiseval.domain.model.FieldDeclaration;
import com.example.synthesiseval.domain.model.FieldRegistry;
import com.example.synthesiseval.infrastructure.exception.RegistryLoadingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Infrastructure adapter that reads field registries from JSON resources.
 * Hides resource resolution and Jackson parsing from the application layer.
 * <p>
 * Expected shape:
 * <pre>{"name": "characterisation", "fields": [{"name": "ir_bands", "kind": "NumericSetWithTolerance", "tolerance": 3}]}</pre>
 */
@Component
public class ClasspathFieldRegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(ClasspathFieldRegistryLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

	/**
	 * @param resourceLoader Spring resource loader resolving {@code classpath:} and {@code file:} locations
	 * @param objectMapper   application-wide Jackson mapper
	 */
    public ClasspathFieldRegistryLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

	/**
	 * Loads and validates one registry file.
	 *
	 * @param location resource location
	 * @return validated registry
	 * @throws RegistryLoadingException when the resource is missing or not valid JSON
	 * @throws com.example.synthesiseval.domain.exception.DomainException when a declaration is invalid
	 */
    public FieldRegistry load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RegistryLoadingException(location, null);
        }
        RegistryDocument document;
        try (InputStream input = resource.getInputStream()) {
            document = objectMapper.readValue(input, RegistryDocument.class);
        } catch (IOException ex) {
            throw new RegistryLoadingException(location, ex);
        }
        List<FieldDeclaration> declarations = document.fields() == null ? List.of() : document.fields();
        FieldRegistry registry = new FieldRegistry(
                document.name(),
                declarations.stream().map(FieldDeclaration::toSpec).toList()
        );
        log.debug("Loaded field registry '{}' with {} field(s) from {}", registry.name(), registry.fields().size(), location);
        return registry;
    }

	/**
	 * @param locations resource locations in priority order
	 * @return registries in the same order
	 */
    public List<FieldRegistry> loadAll(List<String> locations) {
        return locations.stream().map(this::load).toList();
    }

    /**
     * On-disk shape of a registry file.
     */
    public record RegistryDocument(String name, List<FieldDeclaration> fields) {
    }
}
