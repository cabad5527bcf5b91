package com.cashcow.scenario;

import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Entity;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds modified copies of entities through a snake_case field map.
 *
 * <p>The entity is converted to a map, overrides and assumptions edit the map, and the map is
 * converted back into a new instance of the same variant. Unknown keys land in the copy's
 * extra attributes. Entities no override or assumption touches are returned as they are.
 */
public final class EntityTransformer {

    private static final EntityTransformer STANDARD = new EntityTransformer();
    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP = new TypeReference<>() {};

    private final JsonMapper mapper;

    public EntityTransformer() {
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }

    public static EntityTransformer standard() {
        return STANDARD;
    }

    public Entity apply(Scenario scenario, Entity entity) {
        List<EntityOverride> matching = scenario.overridesOrEmpty().stream()
                .filter(override -> override.matches(entity))
                .toList();
        Map<String, Object> assumptions = scenario.assumptionsOrEmpty();
        boolean employeeAssumptions = entity.getType() == EntityType.EMPLOYEE
                && (assumptions.containsKey(Scenario.OVERHEAD_MULTIPLIER)
                        || assumptions.containsKey(Scenario.HIRING_DELAY_MONTHS));
        if (matching.isEmpty() && !employeeAssumptions) {
            return entity;
        }

        Map<String, Object> fields = toFields(entity);
        for (EntityOverride override : matching) {
            override.applyTo(fields);
        }
        if (employeeAssumptions) {
            applyEmployeeAssumptions(fields, assumptions);
        }
        return fromFields(fields, entity.getClass());
    }

    public Map<String, Object> toFields(Entity entity) {
        return mapper.convertValue(entity, FIELD_MAP);
    }

    public <E extends Entity> E fromFields(Map<String, Object> fields, Class<E> type) {
        return mapper.convertValue(fields, type);
    }

    public <E extends Entity> E copy(E entity) {
        @SuppressWarnings("unchecked")
        Class<E> type = (Class<E>) entity.getClass();
        return fromFields(toFields(entity), type);
    }

    /**
     * {@code overhead_multiplier} fills in employees without an explicit multiplier;
     * {@code hiring_delay_months} shifts the start date by whole months (negative hires early).
     */
    private static void applyEmployeeAssumptions(Map<String, Object> fields, Map<String, Object> assumptions) {
        Object overhead = assumptions.get(Scenario.OVERHEAD_MULTIPLIER);
        if (overhead instanceof Number && fields.get(Scenario.OVERHEAD_MULTIPLIER) == null) {
            fields.put(Scenario.OVERHEAD_MULTIPLIER, ((Number) overhead).doubleValue());
        }
        Object delay = assumptions.get(Scenario.HIRING_DELAY_MONTHS);
        Object start = fields.get("start_date");
        if (delay instanceof Number months && months.intValue() != 0 && start != null) {
            LocalDate shifted = LocalDate.parse(start.toString()).plusMonths(months.intValue());
            fields.put("start_date", shifted.toString());
        }
    }
}
