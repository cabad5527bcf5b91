package com.cashcow.domain.model;

import com.cashcow.domain.enums.EntityType;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.BeanWrapperImpl;

/**
 * Base of every forecastable record: people, money in, money out and cap-table positions.
 *
 * <p>Entities are read-only inputs to the engine. Scenario overrides never mutate an
 * entity; they build a modified copy through {@code EntityTransformer}.
 *
 * <p>Attributes not covered by a typed field are kept in {@link #getAttributes()} and
 * survive serialization as top-level keys, so a YAML entry like {@code security_monthly: 500}
 * on a facility is readable via {@link #getField(String, Object)}.
 */
@Data
@SuperBuilder
@NoArgsConstructor
public abstract class Entity {

    private String name;
    private LocalDate startDate;

    /** Null for open-ended entities. */
    private LocalDate endDate;

    private Set<String> tags;
    private String notes;
    private Map<String, Object> attributes;

    @JsonIgnore
    public abstract EntityType getType();

    /**
     * Inclusive on both ends: active from startDate through endDate.
     * An entity without a start date is never active.
     */
    public boolean isActive(LocalDate date) {
        if (startDate == null || date.isBefore(startDate)) {
            return false;
        }
        return endDate == null || !date.isAfter(endDate);
    }

    public Set<String> getTags() {
        return tags == null ? Set.of() : tags;
    }

    public boolean hasTag(String tag) {
        return getTags().contains(tag);
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes == null ? Map.of() : attributes;
    }

    @JsonAnySetter
    public void setAttribute(String key, Object value) {
        if (attributes == null) {
            attributes = new LinkedHashMap<>();
        }
        attributes.put(key, value);
    }


    /**
     * Uniform accessor for optional data. Extra attributes win over typed fields;
     * snake_case names are mapped onto camelCase bean properties.
     *
     * @return the value, or {@code defaultValue} when absent or null
     */
    public Object getField(String fieldName, Object defaultValue) {
        Map<String, Object> extra = getAttributes();
        if (extra.containsKey(fieldName) && extra.get(fieldName) != null) {
            return extra.get(fieldName);
        }
        BeanWrapper wrapper = new BeanWrapperImpl(this);
        String property = toCamelCase(fieldName);
        if (wrapper.isReadableProperty(property)) {
            Object value = wrapper.getPropertyValue(property);
            if (value != null) {
                return value;
            }
        }
        return defaultValue;
    }

    /**
     * Numeric view of {@link #getField(String, Object)}. Non-numeric values yield the default.
     */
    public double getNumber(String fieldName, double defaultValue) {
        Object value = getField(fieldName, null);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && isNumeric(text)) {
            return Double.parseDouble(text.trim());
        }
        return defaultValue;
    }

    private static boolean isNumeric(String text) {
        return text.trim().matches("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    }

    static String toCamelCase(String name) {
        if (name.indexOf('_') < 0) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length());
        boolean upper = false;
        for (char c : name.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                sb.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return sb.toString();
    }
}
