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

import java.util.List;
import javax.annotation.Nullable;

/**
 * A run of {@code power} modal operators of one kind with the same modality index, i.e. {@code
 * [m][m][m]f} is represented as a single {@link Box} with power three.
 *
 * <p>{@link Box} and {@link Diamond} are dual to each other and share all of their structure
 * here. In particular, {@link #make(FormulaType, int, int, Formula, boolean)} is the single merge
 * primitive used by the constructors and all rewriting passes.</p>
 */
public abstract class ModalFormula extends Formula {
    private final int modality;
    private final int power;
    private final Formula subformula;
    private final boolean s5Mode;

    ModalFormula(FormulaType type, int modality, int power, Formula subformula, boolean s5Mode) {
        super(HashUtil.hash(type, modality, power, subformula.hashCode()));
        assert power >= 1;
        this.modality = modality;
        this.power = power;
        this.subformula = subformula;
        this.s5Mode = s5Mode;
    }

    /**
     * Builds {@code power} operators of the given {@code kind} above {@code subformula}. A power of
     * zero yields {@code subformula} itself. If {@code subformula} is an operator of the same kind
     * and modality, the two are merged into one node with the summed power.
     */
    static Formula make(FormulaType kind, int modality, int power, Formula subformula, boolean s5Mode) {
        assert kind.isModal();
        checkNotNull(subformula, "subformula");
        checkArgument(modality >= 0, "Negative modality %d", modality);
        checkArgument(power >= 0, "Negative power %d", power);

        if (power == 0) {
            return subformula;
        }
        ModalFormula mergeable = mergeableChild(kind, modality, subformula);
        if (mergeable == null) {
            return construct(kind, modality, power, subformula, s5Mode);
        }
        return construct(kind, modality, Math.addExact(power, mergeable.power), mergeable.subformula, s5Mode);
    }

    /**
     * Builds a right-to-left chain of single-power operators, so that {@code [1, 2, 3]} over {@code
     * f} yields the operator with modality 1 outermost.
     */
    static Formula makeChain(FormulaType kind, List<Integer> modalities, Formula subformula, boolean s5Mode) {
        Formula formula = subformula;
        for (int i = modalities.size() - 1; i >= 0; i--) {
            formula = make(kind, modalities.get(i), 1, formula, s5Mode);
        }
        return formula;
    }

    @Nullable
    private static ModalFormula mergeableChild(FormulaType kind, int modality, Formula subformula) {
        if (subformula.getType() != kind) {
            return null;
        }
        ModalFormula child = (ModalFormula) subformula;
        return child.modality == modality ? child : null;
    }

    private static ModalFormula construct(
            FormulaType kind, int modality, int power, Formula subformula, boolean s5Mode) {
        return kind == FormulaType.BOX
                ? new Box(modality, power, subformula, s5Mode)
                : new Diamond(modality, power, subformula, s5Mode);
    }

    public int getModality() {
        return modality;
    }

    public int getPower() {
        return power;
    }

    public Formula getSubformula() {
        return subformula;
    }

    public boolean isS5Mode() {
        return s5Mode;
    }

    /**
     * Returns this operator with the given power, keeping kind, modality and S5 flag.
     */
    public Formula withPower(int power) {
        return power == this.power ? this : make(getType(), modality, power, subformula, s5Mode);
    }

    /**
     * Returns this operator above the given sub-formula. The result is this node if nothing changes
     * and is merged with {@code subformula} where possible.
     */
    public Formula withSubformula(Formula subformula) {
        return subformula == this.subformula ? this : make(getType(), modality, power, subformula, s5Mode);
    }

    /**
     * Returns this operator with one more application. Note that this never needs a merge, as
     * canonical nodes do not have a mergeable child.
     */
    public ModalFormula incrementPower() {
        return construct(getType(), modality, Math.addExact(power, 1), subformula, s5Mode);
    }

    /**
     * Peels off one application of this operator. For a power of one, this is the sub-formula.
     */
    public Formula reduced() {
        return make(getType(), modality, power - 1, subformula, s5Mode);
    }

    abstract String openBracket();

    abstract String closeBracket();

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof ModalFormula)) {
            return false;
        }
        ModalFormula that = (ModalFormula) object;
        return getType() == that.getType()
                && hashCode() == that.hashCode()
                && modality == that.modality
                && power == that.power
                && s5Mode == that.s5Mode
                && subformula.equals(that.subformula);
    }

    @Override
    public String toString() {
        String token = openBracket() + modality + closeBracket();
        StringBuilder builder = new StringBuilder(token.length() * power + 16);
        for (int i = 0; i < power; i++) {
            builder.append(token);
        }
        return builder.append(subformula).toString();
    }
}
