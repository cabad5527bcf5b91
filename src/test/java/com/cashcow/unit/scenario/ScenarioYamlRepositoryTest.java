package com.cashcow.unit.scenario;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cashcow.domain.enums.EntityType;
import com.cashcow.exception.ScenarioPersistenceException;
import com.cashcow.scenario.EntityOverride;
import com.cashcow.scenario.Scenario;
import com.cashcow.scenario.ScenarioFilters;
import com.cashcow.scenario.ScenarioYamlRepository;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for ScenarioYamlRepository.
 */
class ScenarioYamlRepositoryTest {

    private final ScenarioYamlRepository repository = new ScenarioYamlRepository();

    private static Path resource(String name) throws Exception {
        return Path.of(ScenarioYamlRepositoryTest.class.getResource("/scenarios/" + name).toURI());
    }

    @Test
    @DisplayName("loads a snake_case scenario file")
    void loadsFile() throws Exception {
        Scenario scenario = repository.load(resource("hiring_freeze.yaml"));

        assertThat(scenario.getName()).isEqualTo("hiring_freeze");
        assertThat(scenario.getEntityFilters().getExcludeTags()).containsExactly("contractor");
        assertThat(scenario.getEntityOverrides()).singleElement().satisfies(override -> {
            assertThat(override.getEntityType()).isEqualTo(EntityType.SOFTWARE);
            assertThat(override.getField()).isEqualTo("monthly_cost");
            assertThat(override.getMultiplier()).isEqualTo(0.5);
        });
        assertThat(scenario.assumptionsOrEmpty())
                .containsEntry(Scenario.HIRING_DELAY_MONTHS, 3)
                .containsEntry(Scenario.OVERHEAD_MULTIPLIER, 1.25);
    }

    @Test
    @DisplayName("a file without a name is rejected")
    void missingName() {
        assertThatThrownBy(() -> repository.load(resource("broken.yaml")))
                .isInstanceOf(ScenarioPersistenceException.class)
                .hasMessageContaining("has no name");
    }

    @Test
    @DisplayName("an unreadable file is rejected")
    void missingFile(@TempDir Path directory) {
        assertThatThrownBy(() -> repository.load(directory.resolve("absent.yaml")))
                .isInstanceOf(ScenarioPersistenceException.class);
    }

    @Test
    @DisplayName("save then load returns an equal scenario")
    void roundTrip(@TempDir Path directory) {
        Scenario scenario = Scenario.builder()
                .name("lean")
                .description("Lean operations")
                .entityFilters(ScenarioFilters.builder()
                        .excludeTags(List.of("non_essential"))
                        .excludeTypes(List.of(EntityType.EQUIPMENT))
                        .build())
                .entityOverrides(List.of(EntityOverride.builder()
                        .entityType(EntityType.FACILITY)
                        .field("monthly_cost")
                        .multiplier(0.75)
                        .build()))
                .assumptions(Map.of(Scenario.HIRING_DELAY_MONTHS, 2, Scenario.OVERHEAD_MULTIPLIER, 1.15))
                .build();
        Path file = directory.resolve("nested/lean.yaml");

        repository.save(scenario, file);

        assertThat(file).exists();
        assertThat(repository.load(file)).isEqualTo(scenario);
    }

    @Test
    @DisplayName("directory load skips broken files")
    void loadDirectory() throws Exception {
        List<Scenario> scenarios = repository.loadDirectory(resource("hiring_freeze.yaml").getParent());

        assertThat(scenarios).extracting(Scenario::getName).containsExactly("hiring_freeze");
    }

    @Test
    @DisplayName("directory load reads .yaml and .yml in file name order and ignores other files")
    void loadDirectoryOrder(@TempDir Path directory) throws Exception {
        repository.save(Scenario.builder().name("zeta").build(), directory.resolve("b.yml"));
        repository.save(Scenario.builder().name("alpha").build(), directory.resolve("a.yaml"));
        Files.writeString(directory.resolve("notes.txt"), "name: ignored");

        assertThat(repository.loadDirectory(directory))
                .extracting(Scenario::getName)
                .containsExactly("alpha", "zeta");
    }

    @Test
    @DisplayName("missing directory yields no scenarios")
    void missingDirectory(@TempDir Path directory) {
        assertThat(repository.loadDirectory(directory.resolve("nope"))).isEmpty();
    }
}
