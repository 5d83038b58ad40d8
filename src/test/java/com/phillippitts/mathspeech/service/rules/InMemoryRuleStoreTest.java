package com.phillippitts.mathspeech.service.rules;

import com.phillippitts.mathspeech.domain.MathDomain;
import com.phillippitts.mathspeech.domain.rule.Rule;
import com.phillippitts.mathspeech.exception.DuplicateRuleException;
import com.phillippitts.mathspeech.exception.InvalidRuleException;
import com.phillippitts.mathspeech.exception.RuleNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryRuleStoreTest {

    private InMemoryRuleStore store;

    private static Rule rule(String id, int priority, MathDomain domain, String... contexts) {
        Rule.Builder builder = Rule.builder(id).regex(id).template(id).priority(priority).domain(domain);
        for (String c : contexts) {
            builder.context(c);
        }
        return builder.build();
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryRuleStore();
    }

    @Test
    void shouldAddAndLookUpById() {
        Rule r = rule("alpha", 700, MathDomain.GENERAL);
        store.add(r);

        assertThat(store.getById("alpha")).contains(r);
        assertThat(store.getById("beta")).isEmpty();
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void shouldRejectDuplicateIds() {
        store.add(rule("alpha", 700, MathDomain.GENERAL));

        assertThatThrownBy(() -> store.add(rule("alpha", 100, MathDomain.CALCULUS)))
                .isInstanceOf(DuplicateRuleException.class)
                .hasMessageContaining("alpha");
        assertThat(store.getById("alpha").orElseThrow().priority()).isEqualTo(700);
    }

    @Test
    void shouldRejectInvalidRules() {
        Rule tooHigh = Rule.builder("loud").regex("x").template("y").priority(2001).build();

        assertThatThrownBy(() -> store.add(tooHigh))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("Priority");
        assertThat(store.count()).isZero();
    }

    @Test
    void addAllShouldBeAtomic() {
        store.add(rule("existing", 500, MathDomain.GENERAL));
        List<Rule> batch = List.of(rule("a", 1, MathDomain.GENERAL), rule("existing", 2, MathDomain.GENERAL));

        assertThatThrownBy(() -> store.addAll(batch)).isInstanceOf(DuplicateRuleException.class);
        assertThat(store.getById("a")).isEmpty();
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void addAllShouldRejectDuplicatesWithinBatch() {
        List<Rule> batch = List.of(rule("a", 1, MathDomain.GENERAL), rule("a", 2, MathDomain.GENERAL));

        assertThatThrownBy(() -> store.addAll(batch)).isInstanceOf(DuplicateRuleException.class);
        assertThat(store.count()).isZero();
    }

    @Test
    void shouldFindByDomainPriorityAndContext() {
        store.addAll(List.of(
                rule("calc_high", 1500, MathDomain.CALCULUS),
                rule("calc_low", 100, MathDomain.CALCULUS, "physics"),
                rule("general_mid", 800, MathDomain.GENERAL, "finance")));

        assertThat(store.findByDomain(MathDomain.CALCULUS)).extracting(Rule::id)
                .containsExactly("calc_high", "calc_low");
        assertThat(store.findByPriorityRange(500, 1500)).extracting(Rule::id)
                .containsExactly("calc_high", "general_mid");
        assertThat(store.findByContext("physics")).extracting(Rule::id)
                .containsExactly("calc_high", "calc_low");
        assertThatThrownBy(() -> store.findByPriorityRange(10, 5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFindByCompoundFilter() {
        store.addAll(List.of(
                rule("calc_high", 1500, MathDomain.CALCULUS),
                rule("calc_low", 100, MathDomain.CALCULUS, "physics"),
                rule("general_mid", 800, MathDomain.GENERAL, "finance")));
        store.update(store.getById("calc_high").orElseThrow().withActive(false));

        RuleFilter filter = RuleFilter.builder()
                .domains(MathDomain.CALCULUS, MathDomain.GENERAL)
                .contexts("Physics")
                .minPriority(50)
                .active(true)
                .build();

        assertThat(store.findByFilters(filter)).extracting(Rule::id).containsExactly("calc_low");
        assertThat(store.findByFilters(RuleFilter.ALL)).hasSize(3);
    }

    @Test
    void updateAndDeleteShouldRequireExistingRule() {
        assertThatThrownBy(() -> store.update(rule("ghost", 1, MathDomain.GENERAL)))
                .isInstanceOf(RuleNotFoundException.class);
        assertThatThrownBy(() -> store.delete("ghost"))
                .isInstanceOf(RuleNotFoundException.class);

        store.add(rule("alpha", 700, MathDomain.GENERAL));
        store.update(rule("alpha", 900, MathDomain.GENERAL));
        assertThat(store.getById("alpha").orElseThrow().priority()).isEqualTo(900);

        store.delete("alpha");
        assertThat(store.count()).isZero();
    }

    @Test
    void getAllShouldPreserveInsertionOrderAndBeUnmodifiable() {
        store.add(rule("b", 1, MathDomain.GENERAL));
        store.add(rule("a", 2, MathDomain.GENERAL));

        List<Rule> all = store.getAll();
        assertThat(all).extracting(Rule::id).containsExactly("b", "a");
        assertThatThrownBy(() -> all.add(rule("c", 3, MathDomain.GENERAL)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void statisticsShouldCountEveryBand() {
        store.addAll(List.of(
                rule("critical", 1800, MathDomain.CALCULUS),
                rule("high", 1000, MathDomain.CALCULUS, "physics"),
                rule("low", 10, MathDomain.GENERAL)));
        store.update(store.getById("low").orElseThrow().withActive(false));

        RuleStoreStatistics stats = store.getStatistics();

        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.active()).isEqualTo(2);
        assertThat(stats.byDomain()).containsEntry(MathDomain.CALCULUS, 2).containsEntry(MathDomain.GENERAL, 1);
        assertThat(stats.byBand())
                .containsEntry(RuleStoreStatistics.PriorityBand.CRITICAL, 1)
                .containsEntry(RuleStoreStatistics.PriorityBand.HIGH, 1)
                .containsEntry(RuleStoreStatistics.PriorityBand.MEDIUM, 0)
                .containsEntry(RuleStoreStatistics.PriorityBand.LOW, 1);
        assertThat(stats.byContext()).containsEntry("any", 2).containsEntry("physics", 1);
    }

    @Test
    void clearShouldEmptyTheStore() {
        store.add(rule("alpha", 1, MathDomain.GENERAL));
        store.clear();

        assertThat(store.count()).isZero();
        assertThat(store.getStatistics().total()).isZero();
    }

    @Test
    void readersShouldNeverSeePartialBatches() throws InterruptedException {
        List<List<Rule>> batches = new ArrayList<>();
        for (int b = 0; b < 50; b++) {
            List<Rule> batch = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                batch.add(rule("r_" + b + "_" + i, 500, MathDomain.GENERAL));
            }
            batches.add(batch);
        }
        AtomicBoolean torn = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(1);
        ExecutorService readers = Executors.newFixedThreadPool(2);
        for (int t = 0; t < 2; t++) {
            readers.execute(() -> {
                while (done.getCount() > 0) {
                    if (store.count() % 10 != 0 || store.getAll().size() % 10 != 0) {
                        torn.set(true);
                    }
                }
            });
        }

        batches.forEach(store::addAll);
        done.countDown();
        readers.shutdown();

        assertThat(readers.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(torn).isFalse();
        assertThat(store.count()).isEqualTo(500);
    }
}
