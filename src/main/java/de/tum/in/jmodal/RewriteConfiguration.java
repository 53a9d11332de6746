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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class RewriteConfiguration {
    public static final BoxS5Policy DEFAULT_BOX_S5_POLICY = BoxS5Policy.GATED;

    public static RewriteConfiguration defaults() {
        return ImmutableRewriteConfiguration.builder().build();
    }

    /**
     * Whether the S5 collapses on boxes depend on the S5 flag of the box.
     */
    @Value.Default
    public BoxS5Policy boxS5Policy() {
        return DEFAULT_BOX_S5_POLICY;
    }

    /**
     * Whether a diamond above false is replaced by false.
     */
    @Value.Default
    public boolean collapseDiamondOfFalse() {
        return true;
    }

    /**
     * Whether the shortcut rules of the boolean connectives are applied.
     */
    @Value.Default
    public boolean simplifyConnectives() {
        return true;
    }
}
