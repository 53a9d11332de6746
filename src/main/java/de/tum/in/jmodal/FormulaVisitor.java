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
 * Dispatch over the closed set of formula variants. Every pass over a formula tree implements this
 * interface, so adding a variant forces each pass to handle it.
 *
 * @param <R> The result type of the pass.
 */
public interface FormulaVisitor<R> {
    R visitTrue();

    R visitFalse();

    R visitAtom(Atom atom);

    R visitNot(Not not);

    R visitAnd(And and);

    R visitOr(Or or);

    R visitBox(Box box);

    R visitDiamond(Diamond diamond);
}
