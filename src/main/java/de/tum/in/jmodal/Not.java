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

public final class Not extends Formula {
    private final Formula operand;

    Not(Formula operand) {
        super(HashUtil.hash(FormulaType.NOT, checkNotNull(operand, "operand").hashCode()));
        this.operand = operand;
    }

    public Formula getOperand() {
        return operand;
    }

    /**
     * Returns this node if {@code operand} is the current operand, a new negation otherwise.
     */
    Formula withOperand(Formula operand) {
        return operand == this.operand ? this : new Not(operand);
    }

    @Override
    public FormulaType getType() {
        return FormulaType.NOT;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Not)) {
            return false;
        }
        Not that = (Not) object;
        return hashCode() == that.hashCode() && operand.equals(that.operand);
    }

    @Override
    public String toString() {
        return "~" + operand;
    }
}
