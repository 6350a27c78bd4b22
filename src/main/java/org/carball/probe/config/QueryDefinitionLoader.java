package org.carball.probe.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the query catalog from YAML, either the bundled {@value #DEFAULT_RESOURCE} or a user file.
 */
@Slf4j
public class QueryDefinitionLoader {

    public static final String DEFAULT_RESOURCE = "query-definitions.yml";

    private final ObjectMapper yamlMapper;

    public QueryDefinitionLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public QueryCatalog loadDefault() throws IOException {
        try (InputStream in = QueryDefinitionLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new FileNotFoundException("Classpath resource not found: " + DEFAULT_RESOURCE);
            }
            return sanitize(yamlMapper.readValue(in, QueryCatalog.class), DEFAULT_RESOURCE);
        }
    }

    public QueryCatalog load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Query definition file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return sanitize(yamlMapper.readValue(in, QueryCatalog.class), path.toString());
        }
    }

    // Incomplete entries are dropped here; unknown types are left for the orchestrator to reject.
    private QueryCatalog sanitize(QueryCatalog catalog, String source) {
        List<QueryDefinition> usable = new ArrayList<>();
        for (QueryDefinition definition : catalog.definitions()) {
            if (definition != null && definition.isComplete()) {
                usable.add(definition);
            } else {
                log.warn("Ignoring incomplete query definition in {}: {}", source, definition);
            }
        }
        if (catalog.executionPlanQuery() == null || catalog.executionPlanQuery().isBlank()) {
            log.warn("No execution plan query in {}; plan fetch will be skipped", source);
        }
        log.debug("Loaded {} query definitions from {}", usable.size(), source);
        return new QueryCatalog(usable, catalog.executionPlanQuery());
    }
}
