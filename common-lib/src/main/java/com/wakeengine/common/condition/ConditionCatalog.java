package com.wakeengine.common.condition;

import com.wakeengine.common.exception.NotFoundException;
import com.wakeengine.common.exception.ValidationException;
import com.wakeengine.common.model.ConditionDefinition;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Registry of the condition definitions attached to one alarm.
 *
 * <p>All reads return immutable snapshots and all writes go through this class,
 * guarded by a single lock, so a feedback update and an in-flight adaptation
 * tick never interleave on the same definition. Insertion order is preserved.
 */
public final class ConditionCatalog {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ConditionDefinition> definitions = new LinkedHashMap<>();

    public ConditionCatalog() {}

    /**
     * @throws ValidationException when any definition is invalid; nothing is stored in that case
     */
    public ConditionCatalog(Collection<ConditionDefinition> initial) {
        for (ConditionDefinition def : initial) {
            ConditionValidator.validate(def);
        }
        for (ConditionDefinition def : initial) {
            definitions.put(def.id(), def);
        }
    }

    public List<ConditionDefinition> list(boolean enabledOnly) {
        lock.lock();
        try {
            List<ConditionDefinition> out = new ArrayList<>(definitions.size());
            for (ConditionDefinition def : definitions.values()) {
                if (!enabledOnly || def.enabled()) out.add(def);
            }
            return List.copyOf(out);
        } finally {
            lock.unlock();
        }
    }

    /** Definitions ordered by descending priority, for display. */
    public List<ConditionDefinition> listByPriority() {
        List<ConditionDefinition> all = new ArrayList<>(list(false));
        all.sort(Comparator.comparingInt(ConditionDefinition::priority).reversed());
        return all;
    }

    /**
     * @throws NotFoundException when no definition has this id
     */
    public ConditionDefinition get(String id) {
        lock.lock();
        try {
            ConditionDefinition def = definitions.get(id);
            if (def == null) throw NotFoundException.condition(id);
            return def;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts or replaces a definition by id.
     *
     * @throws ValidationException when the definition is invalid
     */
    public ConditionDefinition upsert(ConditionDefinition def) {
        ConditionValidator.validate(def);
        lock.lock();
        try {
            definitions.put(def.id(), def);
            return def;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws ValidationException when {@code score} is outside [0, 1]
     * @throws NotFoundException   when no definition has this id
     */
    public ConditionDefinition updateEffectiveness(String id, double score) {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new ValidationException("effectivenessScore must be within [0, 1], was " + score);
        }
        return update(id, def -> def.withEffectivenessScore(score));
    }

    /**
     * Stamps {@code lastTriggered} on every listed definition that still exists.
     *
     * @return the updated definitions
     */
    public List<ConditionDefinition> markTriggered(Collection<String> ids, LocalDateTime at) {
        lock.lock();
        try {
            List<ConditionDefinition> updated = new ArrayList<>();
            for (String id : ids) {
                ConditionDefinition def = definitions.get(id);
                if (def != null) {
                    ConditionDefinition next = def.withLastTriggered(at);
                    definitions.put(id, next);
                    updated.add(next);
                }
            }
            return List.copyOf(updated);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically replaces every definition with {@code transform(definition)}.
     * Used to apply a learning step as a single read-modify-write.
     *
     * @return only the definitions whose value changed
     */
    public List<ConditionDefinition> transformAll(UnaryOperator<List<ConditionDefinition>> transform) {
        lock.lock();
        try {
            List<ConditionDefinition> before = List.copyOf(definitions.values());
            List<ConditionDefinition> after  = transform.apply(before);
            for (ConditionDefinition def : after) {
                ConditionValidator.validate(def);
            }
            List<ConditionDefinition> changed = new ArrayList<>();
            for (ConditionDefinition def : after) {
                ConditionDefinition previous = definitions.put(def.id(), def);
                if (!def.equals(previous)) changed.add(def);
            }
            return List.copyOf(changed);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return definitions.size();
        } finally {
            lock.unlock();
        }
    }

    private ConditionDefinition update(String id, UnaryOperator<ConditionDefinition> change) {
        lock.lock();
        try {
            ConditionDefinition def = definitions.get(id);
            if (def == null) throw NotFoundException.condition(id);
            ConditionDefinition next = change.apply(def);
            definitions.put(id, next);
            return next;
        } finally {
            lock.unlock();
        }
    }
}
