package com.cashcow.scenario;

import com.cashcow.domain.model.Entity;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named, declarative transformation of the entity set: filters decide which entities
 * take part, overrides change matching entities, and assumptions adjust employees and are
 * handed to every calculator as context parameters.
 *
 * <p>Applying a scenario never mutates an entity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Scenario {

    public static final String OVERHEAD_MULTIPLIER = "overhead_multiplier";
    public static final String HIRING_DELAY_MONTHS = "hiring_delay_months";

    private String name;
    private String description;
    private ScenarioFilters entityFilters;
    private List<EntityOverride> entityOverrides;
    private Map<String, Object> assumptions;
    private List<String> tags;
    private String notes;

    public boolean shouldIncludeEntity(Entity entity) {
        return entityFilters == null || entityFilters.matches(entity);
    }

    /** A copy of {@code entity} with this scenario's overrides and assumptions applied. */
    public Entity applyToEntity(Entity entity) {
        return EntityTransformer.standard().apply(this, entity);
    }

    public Map<String, Object> assumptionsOrEmpty() {
        return assumptions == null ? Map.of() : assumptions;
    }

    public List<EntityOverride> overridesOrEmpty() {
        return entityOverrides == null ? List.of() : entityOverrides;
    }
}
