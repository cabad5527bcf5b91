package com.cashcow.scenario;

import com.cashcow.exception.ScenarioPersistenceException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and writes scenario definitions as YAML files with snake_case keys.
 *
 * <p>Keys the model does not know (for example {@code strategic_changes}) are ignored on read.
 */
@Component
public class ScenarioYamlRepository {

    private static final Logger log = LoggerFactory.getLogger(ScenarioYamlRepository.class);

    private final YAMLMapper mapper;

    public ScenarioYamlRepository() {
        this.mapper = YAMLMapper.builder()
                .addModule(new JavaTimeModule())
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .serializationInclusion(JsonInclude.Include.NON_EMPTY)
                .build();
    }

    /**
     * @throws ScenarioPersistenceException if the file cannot be read or has no scenario name
     */
    public Scenario load(Path path) {
        Scenario scenario;
        try {
            scenario = mapper.readValue(path.toFile(), Scenario.class);
        } catch (IOException e) {
            throw new ScenarioPersistenceException("Failed to read scenario file " + path, e);
        }
        if (scenario == null || scenario.getName() == null || scenario.getName().isBlank()) {
            throw new ScenarioPersistenceException("Scenario file " + path + " has no name", null);
        }
        return scenario;
    }

    /**
     * @throws ScenarioPersistenceException if the file cannot be written
     */
    public void save(Scenario scenario, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(path.toFile(), scenario);
            log.info("Saved scenario '{}' to {}", scenario.getName(), path);
        } catch (IOException e) {
            throw new ScenarioPersistenceException("Failed to write scenario file " + path, e);
        }
    }

    /**
     * Every {@code *.yaml} and {@code *.yml} file of a directory, in file name order. Files that
     * fail to load are logged and skipped. A missing directory yields an empty list.
     */
    public List<Scenario> loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.info("Scenario directory {} does not exist, nothing loaded", directory);
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(ScenarioYamlRepository::isYaml).sorted().toList();
        } catch (IOException e) {
            throw new ScenarioPersistenceException("Failed to list scenario directory " + directory, e);
        }
        List<Scenario> scenarios = new ArrayList<>();
        for (Path file : files) {
            try {
                scenarios.add(load(file));
            } catch (ScenarioPersistenceException e) {
                log.warn("Skipping scenario file {}: {}", file, e.getMessage());
            }
        }
        return scenarios;
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
