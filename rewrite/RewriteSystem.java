/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.rewrite;

import com.google.common.collect.ImmutableList;
import com.vaticle.requirement.common.collection.Pair;
import com.vaticle.requirement.common.exception.RequirementMachineException;
import com.vaticle.requirement.common.parameters.DebugFlag;
import com.vaticle.requirement.common.parameters.Options;
import com.vaticle.requirement.common.perfcounter.PerfCounters;
import com.vaticle.requirement.rewrite.property.PropertyMap;
import com.vaticle.requirement.term.MutableTerm;
import com.vaticle.requirement.term.ProtocolGraph;
import com.vaticle.requirement.term.RewriteContext;
import com.vaticle.requirement.term.Symbol;
import com.vaticle.requirement.term.Term;
import com.vaticle.requirement.term.Trie;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.vaticle.requirement.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.vaticle.requirement.common.exception.ErrorMessage.Rewrite.INVALID_COMPLETION_LIMIT;
import static com.vaticle.requirement.common.exception.ErrorMessage.Rewrite.SYSTEM_ALREADY_INITIALISED;
import static com.vaticle.requirement.common.exception.ErrorMessage.Rewrite.SYSTEM_NOT_INITIALISED;
import static com.vaticle.requirement.common.exception.ErrorMessage.Rewrite.UNKNOWN_RULE_ID;
import static com.vaticle.requirement.common.exception.ErrorMessage.RuleWrite.DUPLICATE_RULE;
import static com.vaticle.requirement.common.exception.ErrorMessage.RuleWrite.RULE_TABLE_OVERFLOW;
import static com.vaticle.requirement.common.exception.ErrorMessage.Term.EMPTY_TERM;
import static com.vaticle.requirement.common.exception.ErrorMessage.Verification.HOMOTOPY_GENERATOR_NOT_A_LOOP;
import static com.vaticle.requirement.common.exception.ErrorMessage.Verification.RULE_DOMAIN_MISMATCH;
import static com.vaticle.requirement.common.exception.ErrorMessage.Verification.RULE_NOT_DECREASING;
import static com.vaticle.requirement.common.exception.ErrorMessage.Verification.RULE_NOT_INDEXED;
import static com.vaticle.requirement.common.exception.ErrorMessage.Verification.RULE_SYMBOL_MISPLACED;

/**
 * A string rewrite system over symbol terms, built from the requirements of a generic
 * signature and completed into a confluent system with the Knuth-Bendix procedure. Once
 * complete, two terms are equivalent exactly when they simplify to the same term.
 *
 * Rules are never removed from the rule table. A deleted rule keeps its id, so that every
 * rewrite path recorded against the table stays replayable.
 *
 * A rewrite system is owned by a single thread.
 */
public class RewriteSystem {

    private static final Logger LOG = LoggerFactory.getLogger(RewriteSystem.class);

    private final RewriteContext context;
    private final Options.Machine options;
    private final List<Rule> rules;
    private final Trie<Integer> trie;
    private final Map<Integer, RewritePath> derivations;
    private final List<MergedAssociatedType> mergedAssociatedTypes;
    private final Set<Pair<Integer, Integer>> checkedOverlaps;
    private final List<HomotopyGenerator> homotopyGenerators;
    private final PerfCounters perfCounters;
    private final PerfCounters.Counter rulesAdded;
    private final PerfCounters.Counter rulesDeleted;
    private final PerfCounters.Counter simplifySteps;
    private final PerfCounters.Counter completionRounds;
    private final PerfCounters.Counter overlapsChecked;
    private final PerfCounters.Counter criticalPairs;
    private final PerfCounters.Counter generatorsRecorded;
    private ProtocolGraph protocols;

    public RewriteSystem(RewriteContext context) {
        this(context, new Options.Machine());
    }

    public RewriteSystem(RewriteContext context, Options.Machine options) {
        this.context = checkNotNull(context);
        this.options = checkNotNull(options);
        this.rules = new ArrayList<>();
        this.trie = new Trie<>();
        this.derivations = new HashMap<>();
        this.mergedAssociatedTypes = new ArrayList<>();
        this.checkedOverlaps = new HashSet<>();
        this.homotopyGenerators = new ArrayList<>();
        this.perfCounters = new PerfCounters();
        this.rulesAdded = perfCounters.register("rules.added");
        this.rulesDeleted = perfCounters.register("rules.deleted");
        this.simplifySteps = perfCounters.register("simplify.steps");
        this.completionRounds = perfCounters.register("completion.rounds");
        this.overlapsChecked = perfCounters.register("completion.overlaps");
        this.criticalPairs = perfCounters.register("completion.critical_pairs");
        this.generatorsRecorded = perfCounters.register("completion.homotopy_generators");
        this.protocols = null;
    }

    /**
     * Adds the initial rules. Each pair is oriented and simplified on the way in, so the input
     * need not be ordered. May only be called once.
     */
    public void initialize(List<Pair<MutableTerm, MutableTerm>> requirements, ProtocolGraph protocols) {
        if (this.protocols != null) throw RequirementMachineException.of(SYSTEM_ALREADY_INITIALISED);
        this.protocols = checkNotNull(protocols);
        for (Pair<MutableTerm, MutableTerm> requirement : requirements) {
            addRule(requirement.first(), requirement.second());
        }
        LOG.debug("Initialised rewrite system with {} rules from {} requirements", rules.size(), requirements.size());
    }

    public RewriteContext context() {
        return context;
    }

    public Options.Machine options() {
        return options;
    }

    public ProtocolGraph protocols() {
        if (protocols == null) throw RequirementMachineException.of(SYSTEM_NOT_INITIALISED);
        return protocols;
    }

    public Rule rule(int ruleID) {
        if (ruleID < 0 || ruleID >= rules.size()) throw RequirementMachineException.of(UNKNOWN_RULE_ID, ruleID);
        return rules.get(ruleID);
    }

    public int ruleID(Rule rule) {
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i) == rule) return i;
        }
        throw RequirementMachineException.of(UNKNOWN_RULE_ID, rule);
    }

    public List<Rule> rules() {
        return Collections.unmodifiableList(rules);
    }

    public List<HomotopyGenerator> homotopyGenerators() {
        return Collections.unmodifiableList(homotopyGenerators);
    }

    /**
     * The path from the left hand side of a rule added during completion to its right hand
     * side, through rules that existed before it.
     */
    public Optional<RewritePath> derivation(int ruleID) {
        return Optional.ofNullable(derivations.get(ruleID));
    }

    public PerfCounters perfCounters() {
        return perfCounters;
    }

    public boolean addRule(MutableTerm lhs, MutableTerm rhs) {
        return addRule(lhs, rhs, null);
    }

    /**
     * Simplifies both sides, orients them and adds the result as a new rule. Returns false if
     * both sides simplify to the same term; in that case, if {@code path} takes {@code lhs} to
     * {@code rhs}, the loop it closes is recorded as a homotopy generator. The arguments are
     * left untouched.
     */
    public boolean addRule(MutableTerm originalLHS, MutableTerm originalRHS, @Nullable RewritePath path) {
        ProtocolGraph protocols = protocols();
        if (originalLHS.isEmpty() || originalRHS.isEmpty()) throw RequirementMachineException.of(EMPTY_TERM);

        MutableTerm lhs = new MutableTerm(originalLHS);
        MutableTerm rhs = new MutableTerm(originalRHS);
        RewritePath lhsPath = new RewritePath();
        RewritePath rhsPath = new RewritePath();
        simplify(lhs, lhsPath);
        simplify(rhs, rhsPath);

        int order = lhs.compare(rhs, protocols);
        if (order == 0) {
            if (path != null) {
                RewritePath loop = new RewritePath(path);
                loop.append(rhsPath);
                loop.append(lhsPath.inverse());
                recordHomotopyGenerator(originalLHS, loop);
            }
            return false;
        }

        RewritePath derivation = null;
        if (path != null) {
            derivation = lhsPath.inverse();
            derivation.append(path);
            derivation.append(rhsPath);
        }
        if (order < 0) {
            MutableTerm swap = lhs;
            lhs = rhs;
            rhs = swap;
            if (derivation != null) derivation.invert();
        }

        int ruleID = rules.size();
        if (ruleID > RewriteStep.MAX_RULE_ID) {
            throw RequirementMachineException.of(RULE_TABLE_OVERFLOW, RewriteStep.MAX_RULE_ID + 1);
        }
        Rule rule = Rule.of(context.term(lhs), context.term(rhs), protocols);
        Optional<Integer> existing = trie.get(rule.lhs().symbols());
        if (existing.isPresent() && isLive(existing.get())) {
            throw RequirementMachineException.of(DUPLICATE_RULE, rule, rules.get(existing.get()));
        }

        rules.add(rule);
        trie.insert(rule.lhs().symbols(), ruleID);
        if (derivation != null) derivations.put(ruleID, derivation);
        rulesAdded.add(1);
        if (debug(DebugFlag.ADD)) LOG.debug("Added rule {}: {}", ruleID, rule);

        checkMergedAssociatedType(rule.lhs(), rule.rhs());
        return true;
    }

    public boolean simplify(MutableTerm term) {
        return simplify(term, null);
    }

    /**
     * Rewrites {@code term} in place to its normal form under the live rules. At each step the
     * leftmost position with a match is rewritten, using the shortest live left hand side
     * found there. Returns whether the term changed; the steps taken are appended to
     * {@code path} if given.
     */
    public boolean simplify(MutableTerm term, @Nullable RewritePath path) {
        MutableTerm original = debug(DebugFlag.SIMPLIFY) ? new MutableTerm(term) : null;
        RewritePath subpath = new RewritePath();
        boolean tryAgain;
        do {
            tryAgain = false;
            for (int from = 0; from < term.size(); from++) {
                Optional<Integer> ruleID = trie.find(term.symbols(), from, this::isLive);
                if (ruleID.isPresent()) {
                    Rule rule = rules.get(ruleID.get());
                    term.rewriteSubTerm(from, from + rule.depth(), rule.rhs());
                    subpath.add(RewriteStep.forRewriteRule(from, ruleID.get(), false));
                    tryAgain = true;
                    break;
                }
            }
        } while (tryAgain);

        if (subpath.isEmpty()) return false;
        simplifySteps.add(subpath.size());
        if (original != null) LOG.debug("Simplified {} to {} via {}", original, term, subpath.toString(original, this));
        if (path != null) path.append(subpath);
        return true;
    }

    /**
     * Simplifies each substitution of a superclass or concrete type symbol. Any other symbol is
     * returned as is.
     */
    public Symbol simplifySubstitutionsInSuperclassOrConcreteSymbol(Symbol symbol) {
        if (!symbol.hasSubstitutions()) return symbol;
        return symbol.transformSubstitutions(substitution -> {
            MutableTerm term = new MutableTerm(substitution);
            if (!simplify(term)) return substitution;
            return context.term(term);
        }, context);
    }

    public Pair<CompletionResult, Integer> computeConfluentCompletion() {
        return computeConfluentCompletion(options.maxIterations(), options.maxDepth());
    }

    /**
     * Completes with the limits of {@code completion}, falling back to the options of this
     * system for any limit it leaves unset.
     */
    public Pair<CompletionResult, Integer> computeConfluentCompletion(Options.Completion completion) {
        completion.parent(options);
        return computeConfluentCompletion(completion.maxIterations(), completion.maxDepth());
    }

    /**
     * Runs Knuth-Bendix completion. Each round resolves the overlaps of every pair of live
     * rules not yet checked, simplifies the rule set, and adds the unresolved critical pairs
     * as new rules. Completion succeeds once a round adds nothing. Returns the result with the
     * number of rounds run; on failure the system is still usable, but may not be confluent.
     */
    public Pair<CompletionResult, Integer> computeConfluentCompletion(int maxIterations, int maxDepth) {
        if (maxIterations < 1) throw RequirementMachineException.of(INVALID_COMPLETION_LIMIT, "maxIterations", maxIterations);
        if (maxDepth < 1) throw RequirementMachineException.of(INVALID_COMPLETION_LIMIT, "maxDepth", maxDepth);
        protocols();

        processMergedAssociatedTypes();
        int iterations = 0;
        while (true) {
            if (iterations == maxIterations) return finishCompletion(CompletionResult.MAX_ITERATIONS, iterations);
            iterations++;
            completionRounds.add(1);

            List<CriticalPair> resolved = new ArrayList<>();
            for (int i = 0, ruleCount = rules.size(); i < ruleCount; i++) {
                if (!isLive(i)) continue;
                for (Map.Entry<Integer, List<Integer>> overlap : overlaps(i).entrySet()) {
                    if (!checkedOverlaps.add(new Pair<>(i, overlap.getKey()))) continue;
                    overlapsChecked.add(1);
                    for (int from : overlap.getValue()) {
                        computeCriticalPair(from, i, overlap.getKey()).ifPresent(resolved::add);
                    }
                }
            }

            boolean changed = simplifyRewriteSystem();
            for (CriticalPair pair : resolved) {
                if (!addRule(pair.lhs, pair.rhs, pair.path)) continue;
                changed = true;
                if (rules.get(rules.size() - 1).depth() > maxDepth) {
                    return finishCompletion(CompletionResult.MAX_DEPTH, iterations);
                }
            }
            if (processMergedAssociatedTypes()) changed = true;
            if (!changed) return finishCompletion(CompletionResult.SUCCESS, iterations);
        }
    }

    /**
     * For every live rule whose left hand side overlaps that of rule {@code i}, the positions
     * in the left hand side of {@code i} where the overlap starts, keyed by rule id.
     */
    private SortedMap<Integer, List<Integer>> overlaps(int i) {
        Term lhs = rules.get(i).lhs();
        SortedMap<Integer, List<Integer>> overlaps = new TreeMap<>();
        for (int from = 0; from < lhs.size(); from++) {
            int offset = from;
            trie.findAll(lhs.symbols(), from, j -> {
                if ((j == i && offset == 0) || !isLive(j)) return;
                overlaps.computeIfAbsent(j, k -> new ArrayList<>()).add(offset);
            });
        }
        return overlaps;
    }

    private Optional<CriticalPair> computeCriticalPair(int from, int firstID, int secondID) {
        Rule first = rules.get(firstID);
        Rule second = rules.get(secondID);
        Term lhs = first.lhs();
        Term otherLHS = second.lhs();
        MutableTerm t = new MutableTerm(lhs.symbols().subList(0, from));

        MutableTerm x = new MutableTerm(first.rhs());
        MutableTerm y = new MutableTerm(t);
        RewritePath path = new RewritePath();
        path.add(RewriteStep.forRewriteRule(0, firstID, true));
        if (from + otherLHS.size() <= lhs.size()) {
            // T.U.V => X and U => Y overlap in T.U.V, which rewrites to X and to T.Y.V
            y.append(second.rhs());
            y.append(lhs.symbols().subList(from + otherLHS.size(), lhs.size()));
        } else {
            // T.U => X and U.V => Y overlap in T.U.V, which rewrites to X.V and to T.Y
            MutableTerm v = new MutableTerm(otherLHS.symbols().subList(lhs.size() - from, otherLHS.size()));
            if (!t.isEmpty() && v.back().hasSubstitutions()) {
                v.setBack(v.back().prependPrefixToSubstitutions(t, context));
                path.add(RewriteStep.forAdjustment(from, true));
            }
            x.append(v);
            y.append(second.rhs());
        }
        path.add(RewriteStep.forRewriteRule(from, secondID, false));
        criticalPairs.add(1);

        MutableTerm simplifiedX = new MutableTerm(x);
        MutableTerm simplifiedY = new MutableTerm(y);
        RewritePath xPath = new RewritePath();
        RewritePath yPath = new RewritePath();
        simplify(simplifiedX, xPath);
        simplify(simplifiedY, yPath);

        if (simplifiedX.equals(simplifiedY)) {
            RewritePath loop = new RewritePath(path);
            loop.append(yPath);
            loop.append(xPath.inverse());
            recordHomotopyGenerator(x, loop);
            return Optional.empty();
        }

        RewritePath pairPath = xPath.inverse();
        pairPath.append(path);
        pairPath.append(yPath);
        return Optional.of(new CriticalPair(simplifiedX, simplifiedY, pairPath));
    }

    /**
     * Deletes every live rule whose left hand side can be rewritten by another live rule, and
     * replaces every live rule whose right hand side is not in normal form with one whose right
     * hand side is. Returns whether any rule was added.
     */
    public boolean simplifyRewriteSystem() {
        protocols();
        boolean added = false;
        for (int ruleID = 0, ruleCount = rules.size(); ruleID < ruleCount; ruleID++) {
            Rule rule = rules.get(ruleID);
            if (rule.isDeleted()) continue;

            Optional<Integer> reducer = leftReducer(ruleID);
            if (reducer.isPresent()) {
                deleteRule(ruleID, "left hand side reducible by " + rules.get(reducer.get()));
                // the equation survives as a new rule, or as a generator if it is now redundant
                if (addRule(new MutableTerm(rule.lhs()), new MutableTerm(rule.rhs()),
                        RewritePath.of(RewriteStep.forRewriteRule(0, ruleID, false)))) {
                    added = true;
                }
                continue;
            }

            MutableTerm rhs = new MutableTerm(rule.rhs());
            RewritePath rhsPath = new RewritePath();
            if (!simplify(rhs, rhsPath)) continue;

            deleteRule(ruleID, "right hand side reducible to " + rhs);
            RewritePath path = RewritePath.of(RewriteStep.forRewriteRule(0, ruleID, false));
            path.append(rhsPath);
            if (!addRule(new MutableTerm(rule.lhs()), rhs, path)) throw RequirementMachineException.of(ILLEGAL_STATE);
            added = true;
        }
        return added;
    }

    private Optional<Integer> leftReducer(int ruleID) {
        Term lhs = rules.get(ruleID).lhs();
        for (int from = 0; from < lhs.size(); from++) {
            Optional<Integer> other = trie.find(lhs.symbols(), from, otherID -> otherID != ruleID && isLive(otherID));
            if (other.isPresent()) return other;
        }
        return Optional.empty();
    }

    private void deleteRule(int ruleID, String reason) {
        rules.get(ruleID).markDeleted();
        rulesDeleted.add(1);
        if (debug(DebugFlag.ADD)) LOG.debug("Deleted rule {}: {} ({})", ruleID, rules.get(ruleID), reason);
    }

    /**
     * Queues a merge if the rule has the form {@code X.[P2:T] => X.[P1:T]}.
     */
    private void checkMergedAssociatedType(Term lhs, Term rhs) {
        if (lhs.size() != rhs.size()) return;
        int last = lhs.size() - 1;
        if (!lhs.symbols().subList(0, last).equals(rhs.symbols().subList(0, last))) return;

        Symbol lhsSymbol = lhs.back();
        Symbol rhsSymbol = rhs.back();
        if (lhsSymbol.kind() != Symbol.Kind.ASSOCIATED_TYPE || rhsSymbol.kind() != Symbol.Kind.ASSOCIATED_TYPE ||
                !lhsSymbol.name().equals(rhsSymbol.name())) {
            return;
        }

        Symbol mergedSymbol = context.mergeAssociatedTypes(lhsSymbol, rhsSymbol, protocols);
        if (mergedSymbol.equals(rhsSymbol)) return;
        if (debug(DebugFlag.MERGE)) LOG.debug("Queued merge of {} and {} into {}", lhsSymbol, rhsSymbol, mergedSymbol);
        mergedAssociatedTypes.add(new MergedAssociatedType(rhs, lhsSymbol, mergedSymbol));
    }

    /**
     * For each queued merge of {@code X.[P2:T] => X.[P1:T]}, adds {@code X.[P1:T] => X.[P1&P2:T]}
     * and carries the conformances of both merged symbols over to {@code [P1&P2:T]}. Returns
     * whether any rule was added.
     */
    private boolean processMergedAssociatedTypes() {
        if (mergedAssociatedTypes.isEmpty()) return false;
        boolean added = false;
        // adding rules may queue further merges
        for (int i = 0; i < mergedAssociatedTypes.size(); i++) {
            MergedAssociatedType merge = mergedAssociatedTypes.get(i);
            MutableTerm mergedTerm = new MutableTerm(merge.rhs);
            mergedTerm.setBack(merge.mergedSymbol);
            if (addRule(new MutableTerm(merge.rhs), mergedTerm)) added = true;
            if (debug(DebugFlag.MERGE)) LOG.debug("Merged {} into {}", merge.rhs, mergedTerm);

            List<Pair<MutableTerm, MutableTerm>> inducedRules = new ArrayList<>();
            Symbol rhsSymbol = merge.rhs.back();
            Consumer<Integer> visitor = ruleID -> {
                if (!isLive(ruleID)) return;
                Term otherLHS = rules.get(ruleID).lhs();
                if (otherLHS.size() != 2 || otherLHS.get(1).kind() != Symbol.Kind.PROTOCOL) return;
                if (!otherLHS.get(0).equals(rhsSymbol) && !otherLHS.get(0).equals(merge.lhsSymbol)) return;
                inducedRules.add(new Pair<>(MutableTerm.of(merge.mergedSymbol, otherLHS.get(1)), MutableTerm.of(merge.mergedSymbol)));
            };
            trie.findAll(ImmutableList.of(rhsSymbol), 0, visitor);
            trie.findAll(ImmutableList.of(merge.lhsSymbol), 0, visitor);
            for (Pair<MutableTerm, MutableTerm> induced : inducedRules) {
                if (addRule(induced.first(), induced.second())) added = true;
            }
        }
        mergedAssociatedTypes.clear();
        return added;
    }

    /**
     * Iterates completion and property map construction until no property unification induces
     * a new rule. Both phases draw on the same iteration budget.
     */
    public Pair<CompletionResult, Integer> buildPropertyMap(PropertyMap map, int maxIterations, int maxDepth) {
        if (maxIterations < 1) throw RequirementMachineException.of(INVALID_COMPLETION_LIMIT, "maxIterations", maxIterations);
        if (maxDepth < 1) throw RequirementMachineException.of(INVALID_COMPLETION_LIMIT, "maxDepth", maxDepth);
        int iterations = 0;
        while (true) {
            if (iterations >= maxIterations) return new Pair<>(CompletionResult.MAX_ITERATIONS, iterations);
            Pair<CompletionResult, Integer> completion = computeConfluentCompletion(maxIterations - iterations, maxDepth);
            iterations += completion.second();
            if (!completion.first().isSuccess()) return new Pair<>(completion.first(), iterations);

            map.clear();
            List<Pair<MutableTerm, MutableTerm>> inducedRules = new ArrayList<>();
            for (Rule rule : rules) {
                if (rule.isDeleted()) continue;
                Term lhs = rule.lhs();
                if (lhs.size() < 2 || !lhs.back().isProperty()) continue;
                if (!lhs.symbols().subList(0, lhs.size() - 1).equals(rule.rhs().symbols())) continue;
                map.addProperty(rule.rhs(), simplifySubstitutionsInSuperclassOrConcreteSymbol(lhs.back()), inducedRules);
            }
            if (debug(DebugFlag.PROPERTY_MAP)) LOG.debug("Property map:\n{}", map);

            boolean added = false;
            for (Pair<MutableTerm, MutableTerm> induced : inducedRules) {
                if (addRule(induced.first(), induced.second())) added = true;
            }
            if (!added) return new Pair<>(CompletionResult.SUCCESS, iterations);
        }
    }

    /**
     * Checks the structural invariants of every live rule, throwing on the first violation.
     */
    public void verifyRewriteRules() {
        ProtocolGraph protocols = protocols();
        for (int ruleID = 0; ruleID < rules.size(); ruleID++) {
            Rule rule = rules.get(ruleID);
            if (rule.isDeleted()) continue;
            Term lhs = rule.lhs();
            Term rhs = rule.rhs();

            if (lhs.compare(rhs, protocols) <= 0) throw RequirementMachineException.of(RULE_NOT_DECREASING, rule);

            for (int i = 0; i < lhs.size(); i++) {
                Symbol symbol = lhs.get(i);
                boolean last = i == lhs.size() - 1;
                if ((!last && (symbol.kind() == Symbol.Kind.LAYOUT || symbol.hasSubstitutions())) ||
                        (i != 0 && symbol.kind() == Symbol.Kind.GENERIC_PARAM) ||
                        (i != 0 && !last && symbol.kind() == Symbol.Kind.PROTOCOL)) {
                    throw RequirementMachineException.of(RULE_SYMBOL_MISPLACED, rule, symbol, i);
                }
            }
            for (int i = 0; i < rhs.size(); i++) {
                Symbol symbol = rhs.get(i);
                if (symbol.kind() == Symbol.Kind.LAYOUT || symbol.hasSubstitutions() ||
                        (i != 0 && (symbol.kind() == Symbol.Kind.GENERIC_PARAM || symbol.kind() == Symbol.Kind.PROTOCOL))) {
                    throw RequirementMachineException.of(RULE_SYMBOL_MISPLACED, rule, symbol, i);
                }
            }

            if (!lhs.rootProtocols().equals(rhs.rootProtocols())) {
                throw RequirementMachineException.of(RULE_DOMAIN_MISMATCH, rule, lhs.rootProtocols(), rhs.rootProtocols());
            }

            Optional<Integer> indexed = trie.get(lhs.symbols());
            if (!indexed.isPresent() || indexed.get() != ruleID) {
                throw RequirementMachineException.of(RULE_NOT_INDEXED, rule, ruleID);
            }
        }
    }

    /**
     * Replays every homotopy generator, throwing if one does not end on its basepoint.
     */
    public void verifyHomotopyGenerators() {
        for (HomotopyGenerator generator : homotopyGenerators) {
            MutableTerm result = generator.replay(this);
            if (!result.equals(new MutableTerm(generator.basepoint()))) {
                throw RequirementMachineException.of(HOMOTOPY_GENERATOR_NOT_A_LOOP, generator.basepoint(), result);
            }
        }
    }

    private Pair<CompletionResult, Integer> finishCompletion(CompletionResult result, int iterations) {
        if (result.isSuccess()) LOG.debug("Completion succeeded after {} rounds", iterations);
        else LOG.warn("Completion stopped with {} after {} rounds; the rewrite system may not be confluent", result, iterations);
        LOG.debug("Completion counters:\n{}", perfCounters);
        if (debug(DebugFlag.COMPLETION)) LOG.debug("{}", this);
        if (options.verify()) {
            verifyRewriteRules();
            verifyHomotopyGenerators();
        }
        return new Pair<>(result, iterations);
    }

    private void recordHomotopyGenerator(MutableTerm basepoint, RewritePath loop) {
        HomotopyGenerator generator = new HomotopyGenerator(context.term(basepoint), loop);
        homotopyGenerators.add(generator);
        generatorsRecorded.add(1);
        if (debug(DebugFlag.COMPLETION)) LOG.debug("Recorded homotopy generator {}", generator.toString(this));
    }

    private boolean isLive(int ruleID) {
        return !rules.get(ruleID).isDeleted();
    }

    private boolean debug(DebugFlag flag) {
        return options.debug(flag) && LOG.isDebugEnabled();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("Rewrite system: {\n");
        for (int i = 0; i < rules.size(); i++) {
            builder.append("- [").append(i).append("] ").append(rules.get(i)).append("\n");
        }
        builder.append("}\nHomotopy generators: {\n");
        homotopyGenerators.forEach(generator -> builder.append("- ").append(generator.toString(this)).append("\n"));
        return builder.append("}\n").toString();
    }

    private static class CriticalPair {

        private final MutableTerm lhs;
        private final MutableTerm rhs;
        private final RewritePath path;

        private CriticalPair(MutableTerm lhs, MutableTerm rhs, RewritePath path) {
            this.lhs = lhs;
            this.rhs = rhs;
            this.path = path;
        }
    }

    private static class MergedAssociatedType {

        private final Term rhs;
        private final Symbol lhsSymbol;
        private final Symbol mergedSymbol;

        private MergedAssociatedType(Term rhs, Symbol lhsSymbol, Symbol mergedSymbol) {
            this.rhs = rhs;
            this.lhsSymbol = lhsSymbol;
            this.mergedSymbol = mergedSymbol;
        }
    }
}
