package com.purchasingpower.thesugraph.model.graph;

import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for statements that carry a {@code key="value"} attribute list.
 * Insertion order is kept so the serialized text is stable.
 */
public abstract class AttributedStatement<S extends AttributedStatement<S>> implements GraphStatement {

    private final LinkedHashMap<String, String> attributes = new LinkedHashMap<>();

    /** Id of the element whose lowering emitted this statement. Not serialized. */
    @Getter
    @Setter
    private String owner;

    /**
     * Sets an attribute; {@code null} values are ignored so optional attributes can be chained.
     */
    public S put(String key, String value) {
        if (value != null) {
            attributes.put(key, value);
        }
        return self();
    }

    protected abstract S self();

    public String get(String key) {
        return attributes.get(key);
    }

    public boolean has(String key) {
        return attributes.containsKey(key);
    }

    public boolean hasValue(String key, String value) {
        return value.equals(attributes.get(key));
    }

    public void remove(String key) {
        attributes.remove(key);
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }
}
