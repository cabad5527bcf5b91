package com.cashcow.store;

import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Entity;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Criteria for {@link EntityStore#query}. Every non-null criterion must match; an empty
 * filter matches everything.
 */
@Value
@Builder
public class EntityFilter {

    EntityType type;

    /** Entity must carry all of these tags. */
    Set<String> tags;

    LocalDate activeOn;

    /** Case-insensitive substring of the entity name. */
    String nameContains;

    public static EntityFilter all() {
        return EntityFilter.builder().build();
    }

    public static EntityFilter activeOn(LocalDate date) {
        return EntityFilter.builder().activeOn(date).build();
    }

    public boolean matches(Entity entity) {
        if (type != null && entity.getType() != type) {
            return false;
        }
        if (tags != null && !entity.getTags().containsAll(tags)) {
            return false;
        }
        if (activeOn != null && !entity.isActive(activeOn)) {
            return false;
        }
        if (nameContains != null) {
            String name = entity.getName() == null ? "" : entity.getName().toLowerCase(Locale.ROOT);
            return name.contains(nameContains.toLowerCase(Locale.ROOT));
        }
        return true;
    }
}
