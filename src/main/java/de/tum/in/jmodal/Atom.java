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

import static de.tum.in.jmodal.Util.checkArgument;
import static de.tum.in.jmodal.Util.checkNotNull;

/**
 * An atomic proposition, identified by its name.
 */
public final class Atom extends Formula {
    private final String name;

    Atom(String name) {
        super(HashUtil.hash(FormulaType.ATOM, checkNotNull(name, "name")));
        checkArgument(!name.isEmpty(), "Atom name must not be empty");
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public FormulaType getType() {
        return FormulaType.ATOM;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitAtom(this);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Atom)) {
            return false;
        }
        Atom that = (Atom) object;
        return hashCode() == that.hashCode() && name.equals(that.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
