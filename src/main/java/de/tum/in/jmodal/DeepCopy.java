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
 * Rebuilds a formula node by node. The constants are singletons and hence shared.
 */
final class DeepCopy implements FormulaVisitor<Formula> {
    static final DeepCopy INSTANCE = new DeepCopy();

    private DeepCopy() {}

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
        return new Atom(atom.getName());
    }

    @Override
    public Formula visitNot(Not not) {
        return new Not(not.getOperand().accept(this));
    }

    @Override
    public Formula visitAnd(And and) {
        return new And(and.getLeft().accept(this), and.getRight().accept(this));
    }

    @Override
    public Formula visitOr(Or or) {
        return new Or(or.getLeft().accept(this), or.getRight().accept(this));
    }

    @Override
    public Formula visitBox(Box box) {
        return new Box(box.getModality(), box.getPower(), box.getSubformula().accept(this), box.isS5Mode());
    }

    @Override
    public Formula visitDiamond(Diamond diamond) {
        return new Diamond(diamond.getModality(), diamond.getPower(), diamond.getSubformula().accept(this),
                diamond.isS5Mode());
    }
}
