package com.cashcow.unit.scenario;

import static org.assertj.core.api.Assertions.assertThat;

import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Employee;
import com.cashcow.domain.model.Facility;
import com.cashcow.domain.model.Software;
import com.cashcow.scenario.EntityOverride;
import com.cashcow.scenario.ScenarioFilters;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for ScenarioFilters and EntityOverride matching.
 */
class ScenarioFiltersTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private final Employee contractor = Employee.builder()
            .name("Dana Contractor").salary(90_000).startDate(START)
            .tags(Set.of("contractor", "engineering")).build();
    private final Employee engineer = Employee.builder()
            .name("Eli").salary(120_000).startDate(START)
            .tags(Set.of("engineering", "core")).build();
    private final Facility office = Facility.builder()
            .name("HQ Office").monthlyCost(5_000).startDate(START).build();
    private final Software stipend = Software.builder()
            .name("Learning Stipend").monthlyCost(100.0).startDate(START)
            .tags(Set.of("non_essential")).build();

    @Nested
    @DisplayName("Filters")
    class Filters {

        @Test
        @DisplayName("empty filters include everything")
        void emptyFilters() {
            ScenarioFilters filters = new ScenarioFilters();

            assertThat(List.of(contractor, engineer, office, stipend)).allMatch(filters::matches);
        }

        @Test
        @DisplayName("excluded tag removes the entity")
        void excludeTags() {
            ScenarioFilters filters = ScenarioFilters.builder().excludeTags(List.of("contractor")).build();

            assertThat(filters.matches(contractor)).isFalse();
            assertThat(filters.matches(engineer)).isTrue();
            assertThat(filters.matches(office)).isTrue();
        }

        @Test
        @DisplayName("required tags must all be present")
        void requireTags() {
            ScenarioFilters filters = ScenarioFilters.builder()
                    .requireTags(List.of("engineering", "core")).build();

            assertThat(filters.matches(engineer)).isTrue();
            assertThat(filters.matches(contractor)).isFalse();
            assertThat(filters.matches(office)).isFalse();
        }

        @Test
        @DisplayName("a tag both required and excluded excludes")
        void requiredAndExcluded() {
            ScenarioFilters filters = ScenarioFilters.builder()
                    .requireTags(List.of("core"))
                    .excludeTags(List.of("core"))
                    .build();

            assertThat(filters.matches(engineer)).isFalse();
        }

        @Test
        @DisplayName("type lists restrict by entity type")
        void types() {
            ScenarioFilters onlyEmployees = ScenarioFilters.builder()
                    .includeTypes(List.of(EntityType.EMPLOYEE)).build();
            ScenarioFilters noSoftware = ScenarioFilters.builder()
                    .excludeTypes(List.of(EntityType.SOFTWARE)).build();
            ScenarioFilters emptyInclude = ScenarioFilters.builder().includeTypes(List.of()).build();

            assertThat(onlyEmployees.matches(engineer)).isTrue();
            assertThat(onlyEmployees.matches(office)).isFalse();
            assertThat(noSoftware.matches(stipend)).isFalse();
            assertThat(noSoftware.matches(office)).isTrue();
            assertThat(emptyInclude.matches(office)).isTrue();
        }

        @Test
        @DisplayName("name patterns are case-insensitive searches")
        void patterns() {
            ScenarioFilters exclude = ScenarioFilters.builder()
                    .excludePatterns(List.of("bonus", "stipend")).build();
            ScenarioFilters include = ScenarioFilters.builder()
                    .includePatterns(List.of("^hq")).build();

            assertThat(exclude.matches(stipend)).isFalse();
            assertThat(exclude.matches(office)).isTrue();
            assertThat(include.matches(office)).isTrue();
            assertThat(include.matches(engineer)).isFalse();
        }
    }

    @Nested
    @DisplayName("Override matching")
    class OverrideMatching {

        @Test
        @DisplayName("override without criteria matches nothing")
        void noCriteria() {
            EntityOverride override = EntityOverride.builder().field("salary").value(1.0).build();

            assertThat(override.matches(engineer)).isFalse();
        }

        @Test
        @DisplayName("every set criterion must match")
        void allCriteria() {
            EntityOverride override = EntityOverride.builder()
                    .entityType(EntityType.EMPLOYEE)
                    .namePattern("contractor")
                    .field("salary").multiplier(0.5)
                    .build();

            assertThat(override.matches(contractor)).isTrue();
            assertThat(override.matches(engineer)).isFalse();
        }

        @Test
        @DisplayName("exact name match")
        void exactName() {
            EntityOverride override = EntityOverride.builder().entity("Eli").field("salary").value(1.0).build();

            assertThat(override.matches(engineer)).isTrue();
            assertThat(override.matches(contractor)).isFalse();
        }

        @Test
        @DisplayName("tags match when any one is present")
        void anyTag() {
            EntityOverride override = EntityOverride.builder()
                    .tags(List.of("core", "non_essential"))
                    .field("monthly_cost").multiplier(0.0)
                    .build();

            assertThat(override.matches(engineer)).isTrue();
            assertThat(override.matches(stipend)).isTrue();
            assertThat(override.matches(contractor)).isFalse();
        }
    }
}
