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

final class HashUtil {
    // Note: Plain sums on purpose. The hash is only a pre-filter in front of structural equality,
    // collisions are resolved there.

    static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(FormulaType type) {
        return PRIME * (type.ordinal() + 1);
    }

    static int hash(FormulaType type, String name) {
        return hash(type) + name.hashCode();
    }

    static int hash(FormulaType type, int childHash) {
        return hash(type) + childHash;
    }

    static int hash(FormulaType type, int firstKey, int secondKey) {
        return hash(type) + firstKey + secondKey;
    }

    static int hash(FormulaType type, int modality, int power, int childHash) {
        return hash(type) + modality + power + childHash;
    }
}
