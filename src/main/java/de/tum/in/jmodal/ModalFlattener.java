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

final class ModalFlattener implements FormulaVisitor<Formula> {
    static final ModalFlattener INSTANCE = new ModalFlattener();

    private ModalFlattener() {}

    @Override
    public Formula visitTrue() {
        return Constant.TRUE;
    }

    @Override
    public Formula visitFalse() {
        return Constant.FALSE;
    }

    @Override
    public Formula visitAtom(Atom atom) {
        return atom;
    }

    @Override
    public Formula visitNot(Not not) {
        return not.withOperand(not.getOperand().accept(this));
    }

    @Override
    public Formula visitAnd(And and) {
        return and.withOperands(and.getLeft().accept(this), and.getRight().accept(this));
    }

    @Override
    public Formula visitOr(Or or) {
        return or.withOperands(or.getLeft().accept(this), or.getRight().accept(this));
    }

    @Override
    public Formula visitBox(Box box) {
        return box.withSubformula(box.getSubformula().accept(this));
    }

    @Override
    public Formula visitDiamond(Diamond diamond) {
        return diamond.withSubformula(diamond.getSubformula().accept(this));
    }
}
