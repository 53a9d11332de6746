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
 * Determines when {@link Box} nodes are simplified with the S5 collapse laws.
 */
public enum BoxS5Policy {
    /**
     * Only boxes constructed in S5 mode are collapsed, just like diamonds.
     */
    GATED,
    /**
     * Every box is collapsed, regardless of its S5 flag. This is only sound if all modalities are
     * interpreted over equivalence relations.
     */
    UNCONDITIONAL;

    boolean appliesTo(Box box) {
        return this == UNCONDITIONAL || box.isS5Mode();
    }
}
