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
 * Signals that a transformation is not defined for some variant of a formula.
 */
public class UnsupportedFormulaOperationException extends UnsupportedOperationException {
    private static final long serialVersionUID = 1L;

    private final String operation;
    private final FormulaType formulaType;

    public UnsupportedFormulaOperationException(String operation, FormulaType formulaType) {
        super(String.format("Operation %s is not supported on %s", operation, formulaType));
        this.operation = operation;
        this.formulaType = formulaType;
    }

    public String operation() {
        return operation;
    }

    public FormulaType formulaType() {
        return formulaType;
    }
}
