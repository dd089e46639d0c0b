package com.abhikarta.orchestrator.dag;

import com.abhikarta.orchestrator.graph.Graph;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads DAG definitions from JSON files at startup.
 *
 * Every file is validated by building a Graph from it. A file that fails to
 * parse or validate is logged and skipped; it never prevents the others
 * from loading.
 *
 * Location is {@code abhikarta.dags.location}, a Spring resource pattern.
 */
@Component
public class ClasspathDagRegistry implements DagRegistry {

    private static final Logger log = LoggerFactory.getLogger(ClasspathDagRegistry.class);

    private final Map<String, DagDefinition> dags = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public ClasspathDagRegistry(
            @Value("${abhikarta.dags.location:classpath*:dags/*.json}") String location,
            ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        loadAll(location);
    }

    private void loadAll(String location) {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(location);
        } catch (IOException e) {
            log.error("Cannot resolve DAG location '{}': {}", location, e.getMessage());
            return;
        }
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                register(objectMapper.readValue(in, DagDefinition.class));
            } catch (IOException | DagDefinitionException e) {
                log.error("Skipping DAG file {}: {}", resource.getDescription(), e.getMessage());
            }
        }
        log.info("Loaded {} DAG definition(s) from {}", dags.size(), location);
    }

    /**
     * Add or replace a definition after validating it.
     *
     * @throws DagDefinitionException if the definition does not form a valid DAG
     */
    public void register(DagDefinition dag) {
        dag.toGraph();
        if (dags.put(dag.dagId(), dag) != null) {
            log.warn("DAG '{}' defined more than once; the last definition wins", dag.dagId());
        }
    }

    @Override
    public Optional<DagDefinition> getDagConfig(String dagId) {
        return dagId == null ? Optional.empty() : Optional.ofNullable(dags.get(dagId));
    }

    @Override
    public Optional<Graph> createGraphFromDag(String dagId) {
        return getDagConfig(dagId).map(DagDefinition::toGraph);
    }

    @Override
    public List<DagSummary> listDags() {
        return dags.values().stream()
                .map(DagSummary::from)
                .sorted(Comparator.comparing(DagSummary::dagId))
                .toList();
    }
}
