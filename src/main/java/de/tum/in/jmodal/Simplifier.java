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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bottom-up simplification.
 *
 * <p>Besides the shortcut rules of the connectives, a diamond above false collapses to false and
 * directly nested operators of the same kind and modality are merged (again, since a sub-formula may
 * only become mergeable through its own simplification). Operators in S5 mode are additionally
 * collapsed with</p>
 *
 * <ul>
 *   <li>{@code <m>^p [n]^q f -> [n]^(p+q) f}, simplified again,</li>
 *   <li>{@code <m>^p <m>^q f -> <m>^(p+q) f}, simplified again,</li>
 *   <li>{@code [m]^p <n>^q f -> <n>^q f},</li>
 *   <li>{@code [m]^p [m]^q f -> [m]^(p+q) f}, simplified again.</li>
 * </ul>
 *
 * <p>Diamonds use these rules if their S5 flag is set, boxes as determined by the {@link
 * BoxS5Policy} of the configuration. Note that a box above false is left alone.</p>
 */
final class Simplifier implements FormulaVisitor<Formula> {
    static final Simplifier DEFAULT = new Simplifier(RewriteConfiguration.defaults());

    private static final Logger logger = Logger.getLogger(Simplifier.class.getName());

    private final RewriteConfiguration configuration;

    Simplifier(RewriteConfiguration configuration) {
        this.configuration = configuration;
    }

    Formula apply(Formula formula) {
        return formula.accept(this);
    }

    private static boolean complementary(Formula first, Formula second) {
        return (first instanceof Not && ((Not) first).getOperand().equals(second))
                || (second instanceof Not && ((Not) second).getOperand().equals(first));
    }

    private static void logCollapse(String rule, Formula from, Formula to) {
        if (logger.isLoggable(Level.FINEST)) {
            logger.log(Level.FINEST, "Applying {0} to {1}, yielding {2}", new Object[] {rule, from, to});
        }
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
        Formula operand = not.getOperand().accept(this);
        if (!configuration.simplifyConnectives()) {
            return not.withOperand(operand);
        }
        switch (operand.getType()) {
            case TRUE:
                return Constant.FALSE;
            case FALSE:
                return Constant.TRUE;
            case NOT:
                return ((Not) operand).getOperand();
            default:
                return not.withOperand(operand);
        }
    }

    @Override
    public Formula visitAnd(And and) {
        Formula left = and.getLeft().accept(this);
        Formula right = and.getRight().accept(this);
        if (!configuration.simplifyConnectives()) {
            return and.withOperands(left, right);
        }
        if (left == Constant.FALSE || right == Constant.FALSE) {
            return Constant.FALSE;
        }
        if (left == Constant.TRUE) {
            return right;
        }
        if (right == Constant.TRUE || left.equals(right)) {
            return left;
        }
        if (complementary(left, right)) {
            return Constant.FALSE;
        }
        return and.withOperands(left, right);
    }

    @Override
    public Formula visitOr(Or or) {
        Formula left = or.getLeft().accept(this);
        Formula right = or.getRight().accept(this);
        if (!configuration.simplifyConnectives()) {
            return or.withOperands(left, right);
        }
        if (left == Constant.TRUE || right == Constant.TRUE) {
            return Constant.TRUE;
        }
        if (left == Constant.FALSE) {
            return right;
        }
        if (right == Constant.FALSE || left.equals(right)) {
            return left;
        }
        if (complementary(left, right)) {
            return Constant.TRUE;
        }
        return or.withOperands(left, right);
    }

    @Override
    public Formula visitBox(Box box) {
        Formula subformula = box.getSubformula().accept(this);
        if (!configuration.boxS5Policy().appliesTo(box)) {
            return box.withSubformula(subformula);
        }

        if (subformula instanceof Diamond) {
            logCollapse("[]<> -> <>", box, subformula);
            return subformula;
        }
        if (subformula instanceof Box) {
            Box inner = (Box) subformula;
            if (inner.getModality() == box.getModality()) {
                Formula merged = Box.of(box.getModality(), Math.addExact(box.getPower(), inner.getPower()),
                        inner.getSubformula(), box.isS5Mode());
                logCollapse("[][] -> []", box, merged);
                return merged.accept(this);
            }
        }
        return box.withSubformula(subformula);
    }

    @Override
    public Formula visitDiamond(Diamond diamond) {
        Formula subformula = diamond.getSubformula().accept(this);
        if (subformula == Constant.FALSE && configuration.collapseDiamondOfFalse()) {
            return Constant.FALSE;
        }
        if (!diamond.isS5Mode()) {
            return diamond.withSubformula(subformula);
        }

        if (subformula instanceof Box) {
            Box box = (Box) subformula;
            Formula collapsed = Box.of(box.getModality(), Math.addExact(diamond.getPower(), box.getPower()),
                    box.getSubformula(), diamond.isS5Mode());
            logCollapse("<>[] -> []", diamond, collapsed);
            return collapsed.accept(this);
        }
        if (subformula instanceof Diamond) {
            Diamond inner = (Diamond) subformula;
            if (inner.getModality() == diamond.getModality()) {
                Formula merged = Diamond.of(diamond.getModality(),
                        Math.addExact(diamond.getPower(), inner.getPower()), inner.getSubformula(),
                        diamond.isS5Mode());
                logCollapse("<><> -> <>", diamond, merged);
                return merged.accept(this);
            }
        }
        return diamond.withSubformula(subformula);
    }
}
