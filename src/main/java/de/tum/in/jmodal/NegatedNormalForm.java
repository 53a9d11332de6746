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

/**
 * Pushes negations to the atoms. One instance handles sub-formulas in positive position, the other
 * sub-formulas below an odd number of negations, so that each node is visited once.
 */
final class NegatedNormalForm implements FormulaVisitor<Formula> {
    static final NegatedNormalForm POSITIVE = new NegatedNormalForm(false, true);
    static final NegatedNormalForm NEGATIVE = new NegatedNormalForm(true, true);
    static final NegatedNormalForm TAIL_POSITIVE = new NegatedNormalForm(false, false);
    static final NegatedNormalForm TAIL_NEGATIVE = new NegatedNormalForm(true, false);

    private final boolean negated;
    private final boolean modalAllowed;

    private NegatedNormalForm(boolean negated, boolean modalAllowed) {
        this.negated = negated;
        this.modalAllowed = modalAllowed;
    }

    private NegatedNormalForm same() {
        if (modalAllowed) {
            return negated ? NEGATIVE : POSITIVE;
        }
        return negated ? TAIL_NEGATIVE : TAIL_POSITIVE;
    }

    private NegatedNormalForm flipped() {
        if (modalAllowed) {
            return negated ? POSITIVE : NEGATIVE;
        }
        return negated ? TAIL_POSITIVE : TAIL_NEGATIVE;
    }

    private void checkModalAllowed(FormulaType type) {
        if (!modalAllowed) {
            throw new UnsupportedFormulaOperationException("tailNormalForm", type);
        }
    }

    @Override
    public Formula visitTrue() {
        return negated ? Constant.FALSE : Constant.TRUE;
    }

    @Override
    public Formula visitFalse() {
        return negated ? Constant.TRUE : Constant.FALSE;
    }

    @Override
    public Formula visitAtom(Atom atom) {
        return negated ? new Not(atom) : atom;
    }

    @Override
    public Formula visitNot(Not not) {
        if (!negated && not.getOperand() instanceof Atom) {
            return not;
        }
        return not.getOperand().accept(flipped());
    }

    @Override
    public Formula visitAnd(And and) {
        Formula left = and.getLeft().accept(same());
        Formula right = and.getRight().accept(same());
        return negated ? new Or(left, right) : and.withOperands(left, right);
    }

    @Override
    public Formula visitOr(Or or) {
        Formula left = or.getLeft().accept(same());
        Formula right = or.getRight().accept(same());
        return negated ? new And(left, right) : or.withOperands(left, right);
    }

    @Override
    public Formula visitBox(Box box) {
        checkModalAllowed(FormulaType.BOX);
        Formula subformula = box.getSubformula().accept(same());
        return negated
                ? Diamond.of(box.getModality(), box.getPower(), subformula, box.isS5Mode())
                : box.withSubformula(subformula);
    }

    @Override
    public Formula visitDiamond(Diamond diamond) {
        checkModalAllowed(FormulaType.DIAMOND);
        Formula subformula = diamond.getSubformula().accept(same());
        return negated
                ? Box.of(diamond.getModality(), diamond.getPower(), subformula, diamond.isS5Mode())
                : diamond.withSubformula(subformula);
    }
}
