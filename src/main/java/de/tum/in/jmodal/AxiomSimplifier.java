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

import static de.tum.in.jmodal.Util.checkArgument;
import static de.tum.in.jmodal.Util.checkNotNull;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites modal operators as licensed by an {@link ModalAxiom axiom schema}, tracking the number of
 * modal operators seen above the current node.
 */
final class AxiomSimplifier implements FormulaVisitor<Formula> {
    private static final Logger logger = Logger.getLogger(AxiomSimplifier.class.getName());

    private final ModalAxiom axiom;
    private final int depth;

    AxiomSimplifier(ModalAxiom axiom, int depth) {
        checkArgument(depth >= 0, "Negative depth %d", depth);
        this.axiom = checkNotNull(axiom, "axiom");
        this.depth = depth;
    }

    Formula apply(Formula formula) {
        return formula.accept(this);
    }

    private AxiomSimplifier below(ModalFormula formula) {
        return new AxiomSimplifier(axiom, Math.addExact(depth, formula.getPower()));
    }

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
        Formula subformula = box.getSubformula().accept(below(box));
        return Box.of(box.getModality(), axiom.boundPower(box.getPower(), depth), subformula, box.isS5Mode());
    }

    @Override
    public Formula visitDiamond(Diamond diamond) {
        if (depth >= 1 && axiom.erasesNestedDiamondOfBox()) {
            Formula subformula = diamond.getSubformula();
            if (!(subformula instanceof Box)) {
                return diamond;
            }
            if (logger.isLoggable(Level.FINEST)) {
                logger.log(Level.FINEST, "Erasing {0} at depth {1} by axiom {2}",
                        new Object[] {diamond, depth, axiom});
            }
            return ((Box) subformula).getSubformula().accept(this);
        }

        Formula subformula = diamond.getSubformula().accept(below(diamond));
        return Diamond.of(diamond.getModality(), axiom.boundPower(diamond.getPower(), depth), subformula,
                diamond.isS5Mode());
    }
}
