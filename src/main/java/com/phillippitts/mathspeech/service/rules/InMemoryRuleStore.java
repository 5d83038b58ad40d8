package com.phillippitts.mathspeech.service.rules;

import com.phillippitts.mathspeech.domain.MathDomain;
import com.phillippitts.mathspeech.domain.rule.Rule;
import com.phillippitts.mathspeech.exception.DuplicateRuleException;
import com.phillippitts.mathspeech.exception.RuleNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Copy-on-write {@link RuleStore}.
 *
 * <p>Readers dereference a volatile, unmodifiable snapshot and never take a lock. Writers
 * serialize on a lock, copy the snapshot, apply the change and publish the new map in one
 * volatile write, so a reader sees either the old or the new state, never a mix.
 */
public class InMemoryRuleStore implements RuleStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryRuleStore.class);

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Map<String, Rule> snapshot = Map.of();

    public InMemoryRuleStore() {
    }

    public InMemoryRuleStore(List<Rule> initialRules) {
        addAll(initialRules);
    }

    @Override
    public void add(Rule rule) {
        Objects.requireNonNull(rule, "rule");
        RuleValidator.validate(rule);
        writeLock.lock();
        try {
            if (snapshot.containsKey(rule.id())) {
                throw new DuplicateRuleException(rule.id());
            }
            Map<String, Rule> next = new LinkedHashMap<>(snapshot);
            next.put(rule.id(), rule);
            publish(next);
        } finally {
            writeLock.unlock();
        }
        LOG.debug("Added rule id={} priority={} domain={}", rule.id(), rule.priority(), rule.domain().tag());
    }

    @Override
    public void addAll(List<Rule> rules) {
        Objects.requireNonNull(rules, "rules");
        Set<String> batchIds = new HashSet<>();
        for (Rule rule : rules) {
            RuleValidator.validate(rule);
            if (!batchIds.add(rule.id())) {
                throw new DuplicateRuleException(rule.id());
            }
        }
        writeLock.lock();
        try {
            Map<String, Rule> next = new LinkedHashMap<>(snapshot);
            for (Rule rule : rules) {
                if (next.containsKey(rule.id())) {
                    throw new DuplicateRuleException(rule.id());
                }
                next.put(rule.id(), rule);
            }
            publish(next);
        } finally {
            writeLock.unlock();
        }
        LOG.debug("Added {} rules", rules.size());
    }

    @Override
    public Optional<Rule> getById(String id) {
        return Optional.ofNullable(snapshot.get(id));
    }

    @Override
    public List<Rule> getAll() {
        return List.copyOf(snapshot.values());
    }

    @Override
    public List<Rule> findByDomain(MathDomain domain) {
        return select(rule -> rule.domain() == domain);
    }

    @Override
    public List<Rule> findByPriorityRange(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("min must be <= max, got: " + min + " > " + max);
        }
        return select(rule -> rule.priority() >= min && rule.priority() <= max);
    }

    @Override
    public List<Rule> findByContext(String context) {
        return select(rule -> rule.matchesContext(context));
    }

    @Override
    public List<Rule> findByFilters(RuleFilter filter) {
        Objects.requireNonNull(filter, "filter");
        return select(filter::test);
    }

    @Override
    public void update(Rule rule) {
        Objects.requireNonNull(rule, "rule");
        RuleValidator.validate(rule);
        writeLock.lock();
        try {
            if (!snapshot.containsKey(rule.id())) {
                throw new RuleNotFoundException(rule.id());
            }
            Map<String, Rule> next = new LinkedHashMap<>(snapshot);
            next.put(rule.id(), rule);
            publish(next);
        } finally {
            writeLock.unlock();
        }
        LOG.debug("Updated rule id={}", rule.id());
    }

    @Override
    public void delete(String id) {
        writeLock.lock();
        try {
            if (!snapshot.containsKey(id)) {
                throw new RuleNotFoundException(id);
            }
            Map<String, Rule> next = new LinkedHashMap<>(snapshot);
            next.remove(id);
            publish(next);
        } finally {
            writeLock.unlock();
        }
        LOG.debug("Deleted rule id={}", id);
    }

    @Override
    public int count() {
        return snapshot.size();
    }

    @Override
    public RuleStoreStatistics getStatistics() {
        return RuleStoreStatistics.of(snapshot.values());
    }

    @Override
    public void clear() {
        writeLock.lock();
        try {
            publish(new LinkedHashMap<>());
        } finally {
            writeLock.unlock();
        }
        LOG.info("Rule store cleared");
    }

    private List<Rule> select(Predicate<Rule> predicate) {
        return snapshot.values().stream().filter(predicate).toList();
    }

    private void publish(Map<String, Rule> next) {
        snapshot = Collections.unmodifiableMap(next);
    }
}
