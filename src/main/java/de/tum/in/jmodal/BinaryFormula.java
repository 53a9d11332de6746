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

import static de.tum.in.jmodal.Util.checkNotNull;

/**
 * Common base of the binary connectives {@link And} and {@link Or}.
 */
public abstract class BinaryFormula extends Formula {
    private final Formula left;
    private final Formula right;

    BinaryFormula(FormulaType type, Formula left, Formula right) {
        super(HashUtil.hash(type, checkNotNull(left, "left").hashCode(),
                checkNotNull(right, "right").hashCode()));
        this.left = left;
        this.right = right;
    }

    public Formula getLeft() {
        return left;
    }

    public Formula getRight() {
        return right;
    }

    /**
     * Returns this node if both operands are the current ones, a new node of the same connective
     * otherwise.
     */
    Formula withOperands(Formula left, Formula right) {
        if (left == this.left && right == this.right) {
            return this;
        }
        return create(left, right);
    }

    abstract Formula create(Formula left, Formula right);

    abstract String symbol();

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof BinaryFormula)) {
            return false;
        }
        BinaryFormula that = (BinaryFormula) object;
        return getType() == that.getType()
                && hashCode() == that.hashCode()
                && left.equals(that.left)
                && right.equals(that.right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + symbol() + " " + right + ")";
    }
}
