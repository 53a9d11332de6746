/*
 * This file is part of JModal.
 * Copyright (c) 2026 The JModal authors.
 *
 * JModal is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JModal is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JModal. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jmodal;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Random generator of modal CNF formulas following the 3CNF<sub>□m</sub> method of Giunchiglia et
 * al. (2000).
 *
 * <p>A clause at remaining depth {@code d} consists of {@code K} literals, {@code P} of which are
 * propositional and the remaining ones are boxes {@code [i]c} over a clause {@code c} at depth {@code
 * d - 1}. Every literal is negated with probability one half. Clauses repeating an atom are redrawn
 * and duplicate clauses are rejected, both a bounded number of times. Generation is deterministic for a
 * given seed.</p>
 */
public final class ModalCnfGenerator {
    private static final Logger logger = Logger.getLogger(ModalCnfGenerator.class.getName());
    private static final int MAX_CLAUSE_ATTEMPTS = 100;
    private static final int DEFAULT_CLAUSE_LENGTH = 3;
    private static final int CNF_ATTEMPTS_PER_CLAUSE = 10;
    private static final Comparator<Formula> LITERAL_ORDER = Comparator.comparing(Formula::toString);

    private final ModalCnfParameters parameters;
    private final List<List<Integer>> clauseLengths;
    private final List<List<List<Integer>>> propositionalRates;
    private final Random random;

    public ModalCnfGenerator(ModalCnfParameters parameters) {
        this.parameters = parameters;
        this.clauseLengths = parameters.effectiveClauseLengths();
        this.propositionalRates = parameters.effectivePropositionalRates();
        this.random = new Random(parameters.seed());
    }

    /**
     * Generates the next formula, a conjunction of distinct clauses.
     */
    public Formula generate() {
        logger.log(Level.FINE, "Generating modal CNF: depth {0}, {1} modalities, {2} clauses, {3} atoms",
                new Object[] {parameters.depth(), parameters.modalities(), parameters.clauses(), parameters.atoms()});

        List<Formula> clauses = new ArrayList<>(parameters.clauses());
        int maxAttempts = CNF_ATTEMPTS_PER_CLAUSE * parameters.clauses();
        for (int attempt = 0; clauses.size() < parameters.clauses() && attempt < maxAttempts; attempt++) {
            Formula clause = clause(parameters.depth());
            if (!clauses.contains(clause)) {
                clauses.add(clause);
            }
        }
        if (clauses.size() < parameters.clauses()) {
            logger.log(Level.FINE, "Only found {0} distinct clauses", clauses.size());
        }
        return fold(clauses, true);
    }

    public List<Formula> generate(int count) {
        ImmutableList.Builder<Formula> formulas = ImmutableList.builderWithExpectedSize(count);
        for (int i = 0; i < count; i++) {
            formulas.add(generate());
        }
        return formulas.build();
    }

    private static Formula fold(List<Formula> operands, boolean conjunction) {
        Formula formula = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            formula = conjunction ? new And(formula, operands.get(i)) : new Or(formula, operands.get(i));
        }
        return formula;
    }

    private Formula clause(int depth) {
        List<Formula> literals = new ArrayList<>();
        for (int attempt = 0; attempt < MAX_CLAUSE_ATTEMPTS; attempt++) {
            int length = clauseLength(depth);
            int propositional = Math.min(propositionalCount(depth, length), length);

            literals.clear();
            for (int i = 0; i < propositional; i++) {
                literals.add(literal(propositionalAtom()));
            }
            for (int i = propositional; i < length; i++) {
                literals.add(literal(modalAtom(depth)));
            }
            if (hasDistinctAtoms(literals)) {
                break;
            }
        }
        literals.sort(LITERAL_ORDER);
        return fold(literals, false);
    }

    private Formula literal(Formula atom) {
        return random.nextBoolean() ? new Not(atom) : atom;
    }

    private Formula propositionalAtom() {
        return new Atom("A" + (random.nextInt(parameters.atoms()) + 1));
    }

    private Formula modalAtom(int depth) {
        if (depth == 0) {
            return propositionalAtom();
        }
        int modality = random.nextInt(parameters.modalities()) + 1;
        return Box.of(modality, 1, clause(depth - 1), parameters.s5Mode());
    }

    private static boolean hasDistinctAtoms(List<Formula> literals) {
        Set<Formula> atoms = new HashSet<>();
        for (Formula literal : literals) {
            Formula atom = literal instanceof Not ? ((Not) literal).getOperand() : literal;
            if (!atoms.add(atom)) {
                return false;
            }
        }
        return true;
    }

    private int clauseLength(int depth) {
        if (depth >= clauseLengths.size()) {
            return DEFAULT_CLAUSE_LENGTH;
        }
        List<Integer> weights = clauseLengths.get(depth);
        int index = pick(weights);
        return index < 0 ? Math.max(weights.size(), 1) : index + 1;
    }

    private int propositionalCount(int depth, int length) {
        if (depth >= propositionalRates.size()) {
            return 0;
        }
        List<List<Integer>> byLength = propositionalRates.get(depth);
        if (length - 1 >= byLength.size()) {
            return 0;
        }
        return Math.max(pick(byLength.get(length - 1)), 0);
    }

    /**
     * Draws an index with probability proportional to its weight, or {@code -1} if all weights are zero.
     */
    private int pick(List<Integer> weights) {
        long total = 0;
        for (int weight : weights) {
            total += weight;
        }
        if (total == 0) {
            return -1;
        }
        double threshold = random.nextDouble() * total;
        long cumulative = 0;
        for (int i = 0; i < weights.size(); i++) {
            cumulative += weights.get(i);
            if (threshold < cumulative) {
                return i;
            }
        }
        return weights.size() - 1;
    }
}
