package com.phillippitts.mathspeech.service.rules;

import com.phillippitts.mathspeech.domain.MathDomain;
import com.phillippitts.mathspeech.domain.rule.Rule;
import com.phillippitts.mathspeech.exception.DuplicateRuleException;
import com.phillippitts.mathspeech.exception.InvalidRuleException;
import com.phillippitts.mathspeech.exception.RuleNotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Authoritative collection of validated rewrite rules.
 *
 * <p><b>Contract:</b>
 * <ul>
 *   <li>Rule ids are unique; every stored rule has passed {@link RuleValidator}</li>
 *   <li>Read operations never block and never observe a partially applied mutation</li>
 *   <li>Mutations are serialized against each other</li>
 *   <li>Lists are returned in insertion order and are unmodifiable</li>
 * </ul>
 *
 * <p>A store is an explicit instance handed to the transformer; there is no process-wide
 * registry. After startup loading the store is normally read-only.
 */
public interface RuleStore {

    /**
     * Adds a new rule.
     *
     * @throws DuplicateRuleException if a rule with the same id exists
     * @throws InvalidRuleException if the rule violates a structural constraint
     */
    void add(Rule rule);

    /**
     * Adds every rule or none of them.
     *
     * @throws DuplicateRuleException if any id collides with a stored rule or another rule in the batch
     * @throws InvalidRuleException if any rule is invalid
     */
    void addAll(List<Rule> rules);

    Optional<Rule> getById(String id);

    List<Rule> getAll();

    List<Rule> findByDomain(MathDomain domain);

    /** Rules whose priority lies in {@code [min, max]}. */
    List<Rule> findByPriorityRange(int min, int max);

    /** Rules listing the context, or the wildcard context. */
    List<Rule> findByContext(String context);

    /** Rules satisfying every criterion set on the filter. */
    List<Rule> findByFilters(RuleFilter filter);

    /**
     * Replaces the stored rule with the same id.
     *
     * @throws RuleNotFoundException if no rule has this id
     * @throws InvalidRuleException if the replacement is invalid
     */
    void update(Rule rule);

    /**
     * @throws RuleNotFoundException if no rule has this id
     */
    void delete(String id);

    int count();

    RuleStoreStatistics getStatistics();

    void clear();
}
