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

import java.util.List;

/**
 * An immutable multi-modal formula.
 *
 * <p>The set of variants is closed: {@link Constant} (true and false), {@link Atom}, {@link Not},
 * {@link And}, {@link Or}, {@link Box} and {@link Diamond}. Instances are only obtained through the
 * static factories, which keep modal operators in canonical form: a {@link ModalFormula} always has
 * a power of at least one and its immediate child is never an operator of the same kind and
 * modality index.</p>
 *
 * <p>Formulas are persistent. Each transformation returns a (possibly new) formula and shares all
 * unchanged sub-trees with its argument, so formulas can be freely shared between owners and
 * threads. Recursion depth of all passes is bounded by the nesting depth of the formula.</p>
 *
 * <p>Each node carries a structural hash computed once on construction. Equal formulas have equal
 * hashes, the converse does not hold.</p>
 */
@SuppressWarnings("PMD.TooManyMethods")
public abstract class Formula {
    private final int hash;

    Formula(int hash) {
        this.hash = hash;
    }

    public static Formula constant(boolean value) {
        return value ? Constant.TRUE : Constant.FALSE;
    }

    public static Formula top() {
        return Constant.TRUE;
    }

    public static Formula bottom() {
        return Constant.FALSE;
    }

    public static Formula atom(String name) {
        return new Atom(name);
    }

    public static Formula not(Formula operand) {
        return new Not(operand);
    }

    public static Formula and(Formula left, Formula right) {
        return new And(left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return new Or(left, right);
    }

    public static Formula box(int modality, int power, Formula subformula) {
        return Box.of(modality, power, subformula);
    }

    public static Formula box(int modality, int power, Formula subformula, boolean s5Mode) {
        return Box.of(modality, power, subformula, s5Mode);
    }

    public static Formula box(List<Integer> modalities, Formula subformula) {
        return Box.of(modalities, subformula);
    }

    public static Formula box(List<Integer> modalities, Formula subformula, boolean s5Mode) {
        return Box.of(modalities, subformula, s5Mode);
    }

    public static Formula diamond(int modality, int power, Formula subformula) {
        return Diamond.of(modality, power, subformula);
    }

    public static Formula diamond(int modality, int power, Formula subformula, boolean s5Mode) {
        return Diamond.of(modality, power, subformula, s5Mode);
    }

    public static Formula diamond(List<Integer> modalities, Formula subformula) {
        return Diamond.of(modalities, subformula);
    }

    public static Formula diamond(List<Integer> modalities, Formula subformula, boolean s5Mode) {
        return Diamond.of(modalities, subformula, s5Mode);
    }

    public abstract FormulaType getType();

    public abstract <R> R accept(FormulaVisitor<R> visitor);

    /**
     * Pushes all negations down to the atoms, dualizing boxes and diamonds on the way.
     *
     * @return An equivalent formula in which {@link Not} only occurs directly above an {@link Atom}.
     */
    public Formula negatedNormalForm() {
        return accept(NegatedNormalForm.POSITIVE);
    }

    /**
     * Computes the tail normal form. This is only defined for modal-free formulas, where it
     * coincides with the {@link #negatedNormalForm() negated normal form}.
     *
     * @throws UnsupportedFormulaOperationException If the formula contains a modal operator.
     */
    public Formula tailNormalForm() {
        return accept(NegatedNormalForm.TAIL_POSITIVE);
    }

    /**
     * Returns the negation of this formula. The negation is pushed through connectives and modal
     * operators, i.e. the negation of {@code [m]f} is {@code <m>negate(f)}, while the negation of
     * {@code ~f} is {@code f}.
     */
    public Formula negate() {
        return accept(Negation.INSTANCE);
    }

    /**
     * Simplifies this formula bottom-up with the {@link RewriteConfiguration#defaults() default
     * configuration}.
     */
    public Formula simplify() {
        return Simplifier.DEFAULT.apply(this);
    }

    public Formula simplify(RewriteConfiguration configuration) {
        return new Simplifier(configuration).apply(this);
    }

    /**
     * Merges directly nested modal operators of the same kind and modality across the whole tree,
     * without any logical simplification.
     */
    public Formula modalFlatten() {
        return accept(ModalFlattener.INSTANCE);
    }

    /**
     * Rewrites nested modal operators as licensed by the given axiom schema.
     *
     * @param axiom The axiom schema in force.
     * @param depth The number of modal operators this formula is nested in.
     * @see ModalAxiom
     */
    public Formula axiomSimplify(ModalAxiom axiom, int depth) {
        return new AxiomSimplifier(axiom, depth).apply(this);
    }

    /**
     * Returns a structurally equal copy of this formula which shares no node with it.
     */
    public Formula deepCopy() {
        return accept(DeepCopy.INSTANCE);
    }

    @Override
    public final int hashCode() {
        return hash;
    }

    @Override
    public abstract boolean equals(Object object);

    @Override
    public abstract String toString();
}
