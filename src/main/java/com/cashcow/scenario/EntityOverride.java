package com.cashcow.scenario;

import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Entity;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A targeted change to matching entities.
 *
 * <p>Match criteria: {@code entity} (exact name), {@code entityType}, {@code namePattern}
 * (case-insensitive regex) and {@code tags} (any one of them). Every criterion that is set
 * must match; an override without criteria matches nothing.
 *
 * <p>Change, first applicable wins: {@code field} + {@code value} sets the field,
 * {@code field} + {@code multiplier} scales a numeric field, {@code changes} sets several
 * fields at once. Field names are snake_case.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityOverride {

    private String entity;
    private EntityType entityType;
    private String namePattern;
    private List<String> tags;

    private String field;
    private Object value;
    private Double multiplier;
    private Map<String, Object> changes;

    public boolean matches(Entity target) {
        boolean anyCriterion = false;
        if (entity != null) {
            anyCriterion = true;
            if (!entity.equals(target.getName())) {
                return false;
            }
        }
        if (entityType != null) {
            anyCriterion = true;
            if (entityType != target.getType()) {
                return false;
            }
        }
        if (namePattern != null) {
            anyCriterion = true;
            if (target.getName() == null || !ScenarioFilters.find(namePattern, target.getName())) {
                return false;
            }
        }
        if (tags != null && !tags.isEmpty()) {
            anyCriterion = true;
            if (tags.stream().noneMatch(target::hasTag)) {
                return false;
            }
        }
        return anyCriterion;
    }

    /** Applies the change to a snake_case field map of an entity. */
    void applyTo(Map<String, Object> fields) {
        if (field != null && value != null) {
            fields.put(field, value);
        } else if (field != null && multiplier != null) {
            Object current = fields.get(field);
            if (current instanceof Number number) {
                fields.put(field, number.doubleValue() * multiplier);
            }
        } else if (changes != null) {
            fields.putAll(changes);
        }
    }
}
