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

final class Util {
    private Util() {}

    public static void checkArgument(boolean argument, String formatString, Object... format) {
        if (!argument) {
            throw new IllegalArgumentException(String.format(formatString, format));
        }
    }

    public static <T> T checkNotNull(T reference, String name) {
        if (reference == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return reference;
    }
}
