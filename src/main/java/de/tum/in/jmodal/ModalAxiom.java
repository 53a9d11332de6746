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
 * The axiom schemas understood by {@link Formula#axiomSimplify(ModalAxiom, int)}.
 *
 * <p>All schemas bound the power of nested operators: an operator at the top level keeps at most
 * two applications, an operator nested below another one keeps exactly one. {@link #B} additionally
 * erases a nested diamond directly above a box, together with that box.</p>
 */
public enum ModalAxiom {
    /** Distribution, {@code [](p -> q) -> ([]p -> []q)}. */
    K(0),
    /** Reflexivity, {@code []p -> p}. */
    T(1),
    /** Symmetry (Brouwer), {@code <>[]p -> p}. */
    B(2),
    /** Transitivity, {@code []p -> [][]p}. */
    FOUR(3),
    /** Euclideanness, {@code <>p -> []<>p}. */
    FIVE(4);

    private static final int TOP_LEVEL_POWER_BOUND = 2;
    private static final int NESTED_POWER_BOUND = 1;

    private final int id;

    ModalAxiom(int id) {
        this.id = id;
    }

    /**
     * Returns the schema with the given numeric identifier.
     *
     * @throws IllegalArgumentException If no schema has this identifier.
     */
    public static ModalAxiom fromId(int id) {
        for (ModalAxiom axiom : values()) {
            if (axiom.id == id) {
                return axiom;
            }
        }
        throw new IllegalArgumentException("Unknown axiom " + id);
    }

    public int id() {
        return id;
    }

    /**
     * Whether a diamond nested in at least one modal operator may be erased together with a box
     * directly below it.
     */
    boolean erasesNestedDiamondOfBox() {
        return this == B;
    }

    int boundPower(int power, int depth) {
        return depth > 0 ? NESTED_POWER_BOUND : Math.min(power, TOP_LEVEL_POWER_BOUND);
    }
}
