package com.purchasingpower.graphrag.search;

import com.purchasingpower.graphrag.core.Entity;
import com.purchasingpower.graphrag.core.Relationship;
import lombok.Value;

/**
 * An entity that can stand in for another, with the strongest edge linking them.
 *
 * @since 1.0.0
 */
@Value
public class Alternative {
    Entity entity;
    Relationship via;

    public String getId() {
        return entity.getId();
    }

    public double getStrength() {
        return via.getStrength();
    }
}
