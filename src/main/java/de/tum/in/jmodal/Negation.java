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

final class Negation implements FormulaVisitor<Formula> {
    static final Negation INSTANCE = new Negation();

    private Negation() {}

    @Override
    public Formula visitTrue() {
        return Constant.FALSE;
    }

    @Override
    public Formula visitFalse() {
        return Constant.TRUE;
    }

    @Override
    public Formula visitAtom(Atom atom) {
        return new Not(atom);
    }

    @Override
    public Formula visitNot(Not not) {
        return not.getOperand();
    }

    @Override
    public Formula visitAnd(And and) {
        return new Or(and.getLeft().accept(this), and.getRight().accept(this));
    }

    @Override
    public Formula visitOr(Or or) {
        return new And(or.getLeft().accept(this), or.getRight().accept(this));
    }

    @Override
    public Formula visitBox(Box box) {
        return Diamond.of(box.getModality(), box.getPower(), box.getSubformula().accept(this), box.isS5Mode());
    }

    @Override
    public Formula visitDiamond(Diamond diamond) {
        return Box.of(diamond.getModality(), diamond.getPower(), diamond.getSubformula().accept(this),
                diamond.isS5Mode());
    }
}
