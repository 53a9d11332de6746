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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders formulas in the input syntax of the InToHyLo family of provers. Atoms {@code A<n>} are
 * renamed to {@code p<n>}, binary connectives are always parenthesised. Modality indices can be
 * shifted, e.g. by {@code -1} for provers numbering their relations from zero.
 *
 * <p>The {@link Dialect dialects} cover the variants accepted by the provers run on the generated
 * benchmarks.</p>
 */
public final class IntohyloPrinter implements FormulaVisitor<String> {
    private static final Pattern NUMBERED_ATOM = Pattern.compile("A(\\d+)");
    private static final IntohyloPrinter INSTANCE = new IntohyloPrinter(Dialect.INTOHYLO, 0);

    /** Prover-specific variants of the syntax. */
    public enum Dialect {
        /** Plain InToHyLo, {@code [i]} and {@code <i>}. */
        INTOHYLO("", 0, true, false),
        /** Relations numbered from zero. */
        LCKS5("", -1, true, false),
        /** Boxes written {@code [ri]}, the formula enclosed in {@code begin} and {@code end} lines. */
        S52SAT("r", 0, true, true),
        /** Mono-modal, {@code []} and {@code <>} without index. */
        CEGAR("", 0, false, false);

        private final String boxPrefix;
        private final int modalityOffset;
        private final boolean indexed;
        private final boolean enclosed;

        Dialect(String boxPrefix, int modalityOffset, boolean indexed, boolean enclosed) {
            this.boxPrefix = boxPrefix;
            this.modalityOffset = modalityOffset;
            this.indexed = indexed;
            this.enclosed = enclosed;
        }

        public IntohyloPrinter printer() {
            return this == INTOHYLO ? INSTANCE : new IntohyloPrinter(this, 0);
        }
    }

    private final Dialect dialect;
    private final int modalityOffset;

    private IntohyloPrinter(Dialect dialect, int modalityOffset) {
        this.dialect = dialect;
        this.modalityOffset = modalityOffset;
    }

    public static IntohyloPrinter withModalityOffset(int modalityOffset) {
        return modalityOffset == 0 ? INSTANCE : new IntohyloPrinter(Dialect.INTOHYLO, modalityOffset);
    }

    public static String print(Formula formula) {
        return INSTANCE.render(formula);
    }

    public static String print(Formula formula, Dialect dialect) {
        return dialect.printer().render(formula);
    }

    public String render(Formula formula) {
        String rendered = formula.accept(this);
        return dialect.enclosed ? "begin\n" + rendered + "\nend" : rendered;
    }

    @Override
    public String visitTrue() {
        return "true";
    }

    @Override
    public String visitFalse() {
        return "false";
    }

    @Override
    public String visitAtom(Atom atom) {
        Matcher matcher = NUMBERED_ATOM.matcher(atom.getName());
        return matcher.matches() ? "p" + matcher.group(1) : atom.getName();
    }

    @Override
    public String visitNot(Not not) {
        return "~" + not.getOperand().accept(this);
    }

    @Override
    public String visitAnd(And and) {
        return "(" + and.getLeft().accept(this) + " & " + and.getRight().accept(this) + ")";
    }

    @Override
    public String visitOr(Or or) {
        return "(" + or.getLeft().accept(this) + " | " + or.getRight().accept(this) + ")";
    }

    @Override
    public String visitBox(Box box) {
        return modal('[', ']', dialect.boxPrefix, box);
    }

    @Override
    public String visitDiamond(Diamond diamond) {
        return modal('<', '>', "", diamond);
    }

    private String modal(char open, char close, String prefix, ModalFormula formula) {
        StringBuilder label = new StringBuilder().append(open);
        if (dialect.indexed) {
            label.append(prefix).append(formula.getModality() + dialect.modalityOffset + modalityOffset);
        }
        label.append(close).append(' ');

        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < formula.getPower(); i++) {
            builder.append(label);
        }
        return builder.append(formula.getSubformula().accept(this)).toString();
    }
}
