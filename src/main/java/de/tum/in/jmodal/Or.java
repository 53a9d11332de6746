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

public final class Or extends BinaryFormula {
    Or(Formula left, Formula right) {
        super(FormulaType.OR, left, right);
    }

    @Override
    Formula create(Formula left, Formula right) {
        return new Or(left, right);
    }

    @Override
    String symbol() {
        return "|";
    }

    @Override
    public FormulaType getType() {
        return FormulaType.OR;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
