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

import static de.tum.in.jmodal.Util.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * "Possibly", applied {@code power} times under the accessibility relation of the modality.
 */
public final class Diamond extends ModalFormula {
    Diamond(int modality, int power, Formula subformula, boolean s5Mode) {
        super(FormulaType.DIAMOND, modality, power, subformula, s5Mode);
    }

    public static Formula of(int modality, int power, Formula subformula) {
        return of(modality, power, subformula, false);
    }

    public static Formula of(int modality, int power, Formula subformula, boolean s5Mode) {
        return make(FormulaType.DIAMOND, modality, power, subformula, s5Mode);
    }

    public static Formula of(List<Integer> modalities, Formula subformula) {
        return of(modalities, subformula, false);
    }

    public static Formula of(List<Integer> modalities, Formula subformula, boolean s5Mode) {
        return makeChain(FormulaType.DIAMOND, ImmutableList.copyOf(checkNotNull(modalities, "modalities")),
                subformula, s5Mode);
    }

    @Override
    String openBracket() {
        return "<";
    }

    @Override
    String closeBracket() {
        return ">";
    }

    @Override
    public FormulaType getType() {
        return FormulaType.DIAMOND;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitDiamond(this);
    }
}
