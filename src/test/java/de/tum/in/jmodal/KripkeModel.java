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

import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

/**
 * A finite Kripke model used to check that rewrites preserve the semantics of formulas.
 */
final class KripkeModel {
    private final int worlds;
    private final Map<Integer, boolean[][]> relations;
    private final Map<String, BitSet> valuation;

    private KripkeModel(int worlds, Map<Integer, boolean[][]> relations, Map<String, BitSet> valuation) {
        this.worlds = worlds;
        this.relations = relations;
        this.valuation = valuation;
    }

    /**
     * A model where each modality is an arbitrary relation.
     */
    static KripkeModel random(Random random, int worlds, Collection<Integer> modalities,
            Collection<String> atoms) {
        Map<Integer, boolean[][]> relations = new HashMap<>();
        for (int modality : modalities) {
            boolean[][] relation = new boolean[worlds][worlds];
            for (int from = 0; from < worlds; from++) {
                for (int to = 0; to < worlds; to++) {
                    relation[from][to] = random.nextInt(3) == 0;
                }
            }
            relations.put(modality, relation);
        }
        return new KripkeModel(worlds, relations, randomValuation(random, worlds, atoms));
    }

    /**
     * A model where each modality is an equivalence relation, i.e. an S5 model.
     */
    static KripkeModel randomEquivalence(Random random, int worlds, Collection<Integer> modalities,
            Collection<String> atoms) {
        Map<Integer, boolean[][]> relations = new HashMap<>();
        for (int modality : modalities) {
            int[] partition = new int[worlds];
            for (int world = 0; world < worlds; world++) {
                partition[world] = random.nextInt(Math.max(1, worlds / 2));
            }
            boolean[][] relation = new boolean[worlds][worlds];
            for (int from = 0; from < worlds; from++) {
                for (int to = 0; to < worlds; to++) {
                    relation[from][to] = partition[from] == partition[to];
                }
            }
            relations.put(modality, relation);
        }
        return new KripkeModel(worlds, relations, randomValuation(random, worlds, atoms));
    }

    private static Map<String, BitSet> randomValuation(Random random, int worlds, Collection<String> atoms) {
        Map<String, BitSet> valuation = new HashMap<>();
        for (String atom : atoms) {
            BitSet set = new BitSet(worlds);
            for (int world = 0; world < worlds; world++) {
                if (random.nextBoolean()) {
                    set.set(world);
                }
            }
            valuation.put(atom, set);
        }
        return valuation;
    }

    int worlds() {
        return worlds;
    }

    /**
     * Returns the set of worlds in which the formula holds.
     */
    BitSet evaluate(Formula formula) {
        return formula.accept(new Evaluator());
    }

    private boolean[][] relation(int modality) {
        return relations.computeIfAbsent(modality, m -> new boolean[worlds][worlds]);
    }

    private final class Evaluator implements FormulaVisitor<BitSet> {
        @Override
        public BitSet visitTrue() {
            BitSet set = new BitSet(worlds);
            set.set(0, worlds);
            return set;
        }

        @Override
        public BitSet visitFalse() {
            return new BitSet(worlds);
        }

        @Override
        public BitSet visitAtom(Atom atom) {
            BitSet set = valuation.get(atom.getName());
            return set == null ? new BitSet(worlds) : (BitSet) set.clone();
        }

        @Override
        public BitSet visitNot(Not not) {
            BitSet set = not.getOperand().accept(this);
            set.flip(0, worlds);
            return set;
        }

        @Override
        public BitSet visitAnd(And and) {
            BitSet set = and.getLeft().accept(this);
            set.and(and.getRight().accept(this));
            return set;
        }

        @Override
        public BitSet visitOr(Or or) {
            BitSet set = or.getLeft().accept(this);
            set.or(or.getRight().accept(this));
            return set;
        }

        @Override
        public BitSet visitBox(Box box) {
            boolean[][] relation = relation(box.getModality());
            BitSet set = box.getSubformula().accept(this);
            for (int i = 0; i < box.getPower(); i++) {
                BitSet next = new BitSet(worlds);
                for (int from = 0; from < worlds; from++) {
                    boolean all = true;
                    for (int to = 0; to < worlds && all; to++) {
                        all = !relation[from][to] || set.get(to);
                    }
                    next.set(from, all);
                }
                set = next;
            }
            return set;
        }

        @Override
        public BitSet visitDiamond(Diamond diamond) {
            boolean[][] relation = relation(diamond.getModality());
            BitSet set = diamond.getSubformula().accept(this);
            for (int i = 0; i < diamond.getPower(); i++) {
                BitSet next = new BitSet(worlds);
                for (int from = 0; from < worlds; from++) {
                    boolean any = false;
                    for (int to = 0; to < worlds && !any; to++) {
                        any = relation[from][to] && set.get(to);
                    }
                    next.set(from, any);
                }
                set = next;
            }
            return set;
        }
    }
}
