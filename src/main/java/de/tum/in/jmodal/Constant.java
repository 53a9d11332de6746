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
 * The logical constants. Exactly two instances exist.
 */
public final class Constant extends Formula {
    static final Constant TRUE = new Constant(true);
    static final Constant FALSE = new Constant(false);

    private final boolean value;

    private Constant(boolean value) {
        super(HashUtil.hash(value ? FormulaType.TRUE : FormulaType.FALSE));
        this.value = value;
    }

    public boolean value() {
        return value;
    }

    @Override
    public FormulaType getType() {
        return value ? FormulaType.TRUE : FormulaType.FALSE;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return value ? visitor.visitTrue() : visitor.visitFalse();
    }

    @Override
    public boolean equals(Object object) {
        return this == object;
    }

    @Override
    public String toString() {
        return value ? "true" : "false";
    }
}
