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

import java.util.Set;
import java.util.TreeSet;
import org.immutables.value.Value;

/**
 * Size measures of a formula, as used to classify benchmark instances.
 */
@Value.Immutable
public abstract class ModalMetrics {
    /**
     * The maximal number of modal operators on a path from the root to a leaf. An operator with power
     * {@code p} counts {@code p} times.
     */
    public abstract int modalDepth();

    /**
     * The number of modal operators in the formula, each counted with its power.
     */
    public abstract int modalOperatorCount();

    /**
     * The number of top-level conjuncts.
     */
    public abstract int clauseCount();

    public abstract Set<String> atoms();

    public abstract Set<Integer> modalities();

    public static ModalMetrics of(Formula formula) {
        Collector collector = new Collector();
        int depth = formula.accept(collector);
        return ImmutableModalMetrics.builder()
                .modalDepth(depth)
                .modalOperatorCount(collector.operators)
                .clauseCount(countClauses(formula))
                .addAllAtoms(collector.atoms)
                .addAllModalities(collector.modalities)
                .build();
    }

    private static int countClauses(Formula formula) {
        if (formula instanceof And) {
            And and = (And) formula;
            return countClauses(and.getLeft()) + countClauses(and.getRight());
        }
        return 1;
    }

    private static final class Collector implements FormulaVisitor<Integer> {
        private final Set<String> atoms = new TreeSet<>();
        private final Set<Integer> modalities = new TreeSet<>();
        private int operators = 0;

        @Override
        public Integer visitTrue() {
            return 0;
        }

        @Override
        public Integer visitFalse() {
            return 0;
        }

        @Override
        public Integer visitAtom(Atom atom) {
            atoms.add(atom.getName());
            return 0;
        }

        @Override
        public Integer visitNot(Not not) {
            return not.getOperand().accept(this);
        }

        @Override
        public Integer visitAnd(And and) {
            return Math.max(and.getLeft().accept(this), and.getRight().accept(this));
        }

        @Override
        public Integer visitOr(Or or) {
            return Math.max(or.getLeft().accept(this), or.getRight().accept(this));
        }

        @Override
        public Integer visitBox(Box box) {
            return visitModal(box);
        }

        @Override
        public Integer visitDiamond(Diamond diamond) {
            return visitModal(diamond);
        }

        private int visitModal(ModalFormula formula) {
            operators += formula.getPower();
            modalities.add(formula.getModality());
            return formula.getPower() + formula.getSubformula().accept(this);
        }
    }
}
