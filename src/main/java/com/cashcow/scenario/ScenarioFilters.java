package com.cashcow.scenario;

import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Entity;
import java.util.List;
import java.util.regex.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which entities take part in a scenario.
 *
 * <p>An entity is included when it has every required tag, none of the excluded tags, a type
 * in {@code includeTypes} (when non-empty) and not in {@code excludeTypes}, a name matching at
 * least one include pattern (when any) and no exclude pattern. Patterns are case-insensitive
 * regular expressions searched anywhere in the name. A tag both required and excluded
 * excludes the entity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioFilters {

    private List<String> requireTags;
    private List<String> excludeTags;
    private List<EntityType> includeTypes;
    private List<EntityType> excludeTypes;
    private List<String> includePatterns;
    private List<String> excludePatterns;

    public boolean matches(Entity entity) {
        if (notEmpty(includeTypes) && !includeTypes.contains(entity.getType())) {
            return false;
        }
        if (notEmpty(excludeTypes) && excludeTypes.contains(entity.getType())) {
            return false;
        }
        String name = entity.getName() == null ? "" : entity.getName();
        if (notEmpty(includePatterns) && includePatterns.stream().noneMatch(p -> find(p, name))) {
            return false;
        }
        if (notEmpty(excludePatterns) && excludePatterns.stream().anyMatch(p -> find(p, name))) {
            return false;
        }
        if (notEmpty(requireTags) && !entity.getTags().containsAll(requireTags)) {
            return false;
        }
        return !notEmpty(excludeTags) || excludeTags.stream().noneMatch(entity::hasTag);
    }

    static boolean find(String regex, String text) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE).matcher(text).find();
    }

    private static boolean notEmpty(List<?> values) {
        return values != null && !values.isEmpty();
    }
}
