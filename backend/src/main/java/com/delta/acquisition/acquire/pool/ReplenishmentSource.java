package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.model.ResourceKind;

import java.util.List;
import java.util.Optional;

/**
 * Supplies the initial items of each pool and replacements for retired ones.
 */
public interface ReplenishmentSource {
    List<String> initialItems(ResourceKind kind);

    Optional<String> replacement(ResourceKind kind, String retiredValue);
}
