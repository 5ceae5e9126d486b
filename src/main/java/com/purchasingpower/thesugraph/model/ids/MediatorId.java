package com.purchasingpower.thesugraph.model.ids;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * Identifier of a synthetic mediator node. Only {@code MediatorIdGenerator} creates these,
 * so a mediator id is always a plain token and never a composite value.
 */
@Value
public class MediatorId {

    RelationRole role;
    String value;

    public MediatorId(RelationRole role, String value) {
        Preconditions.checkNotNull(role, "Role cannot be null");
        Preconditions.checkArgument(value != null && !value.isBlank(), "Mediator id cannot be blank");
        Preconditions.checkArgument(value.chars().noneMatch(c -> c == '(' || c == ')' || c == '{' || c == '}'
                        || c == '[' || c == ']' || c == '\'' || c == '"' || c == ','),
                "Mediator id must be a plain token: %s", value);
        this.role = role;
        this.value = value;
    }

    @Override
    public String toString() {
        return value;
    }
}
