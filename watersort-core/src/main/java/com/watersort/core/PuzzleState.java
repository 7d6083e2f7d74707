package com.watersort.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable arrangement of all tubes of a water-sort puzzle.
 * The number of tubes and their shared capacity never change; every move yields a new state.
 */
public final class PuzzleState {

    private final List<Tube> tubes;
    private final int capacity;
    private final String canonicalKey;

    /**
     * Creates a state from tubes that all share the same capacity.
     */
    public PuzzleState(List<Tube> tubes) {
        Objects.requireNonNull(tubes, "tubes");
        if (tubes.size() < 2) {
            throw new IllegalArgumentException("A puzzle needs at least 2 tubes, got " + tubes.size());
        }
        int sharedCapacity = tubes.get(0).capacity();
        for (Tube tube : tubes) {
            Objects.requireNonNull(tube, "tube");
            if (tube.capacity() != sharedCapacity) {
                throw new IllegalArgumentException("All tubes must share capacity " + sharedCapacity);
            }
        }
        this.tubes = Collections.unmodifiableList(new ArrayList<>(tubes));
        this.capacity = sharedCapacity;
        this.canonicalKey = buildKey(this.tubes);
    }

    /**
     * Creates a state from raw color ids, bottom first for every tube.
     */
    public static PuzzleState of(int capacity, int[]... contents) {
        List<Tube> tubes = new ArrayList<>(contents.length);
        for (int[] units : contents) {
            tubes.add(new Tube(units, capacity));
        }
        return new PuzzleState(tubes);
    }

    private PuzzleState(List<Tube> tubes, int capacity) {
        this.tubes = tubes;
        this.capacity = capacity;
        this.canonicalKey = buildKey(tubes);
    }

    public int tubeCount() {
        return tubes.size();
    }

    public int capacity() {
        return capacity;
    }

    public Tube tube(int index) {
        checkIndex(index);
        return tubes.get(index);
    }

    public List<Tube> tubes() {
        return tubes;
    }

    /**
     * Returns the structural key used to deduplicate states during a search. Tube order is kept,
     * so two states share a key only when every tube index holds the same units.
     */
    public String canonicalKey() {
        return canonicalKey;
    }

    /**
     * Returns {@code true} when every tube is empty or holds a single color.
     */
    public boolean isSolved() {
        for (Tube tube : tubes) {
            if (!tube.isSettled()) {
                return false;
            }
        }
        return true;
    }

    public int emptyTubeCount() {
        int count = 0;
        for (Tube tube : tubes) {
            if (tube.isEmpty()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the number of units per color id, in ascending id order.
     */
    public Map<Integer, Integer> colorCounts() {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (Tube tube : tubes) {
            for (int i = 0; i < tube.size(); i++) {
                counts.merge(tube.colorAt(i), 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * Returns how many units a pour from {@code from} to {@code to} would move, or {@code 0} if the
     * pour is illegal under the provided policy.
     */
    public int transferAmount(int from, int to, PourPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        if (from == to || from < 0 || to < 0 || from >= tubes.size() || to >= tubes.size()) {
            return 0;
        }
        Tube source = tubes.get(from);
        Tube target = tubes.get(to);
        int block = source.blockSize();
        if (block == 0 || target.isFull()) {
            return 0;
        }
        if (!target.isEmpty() && target.topColor() != source.topColor()) {
            return 0;
        }
        int amount = Math.min(block, target.freeSpace());
        if (amount < block && policy == PourPolicy.ALL_OR_NOTHING) {
            return 0;
        }
        return amount;
    }

    public boolean canPour(int from, int to, PourPolicy policy) {
        return transferAmount(from, to, policy) > 0;
    }

    /**
     * Returns {@code false} for pours that only relocate an already settled tube into an empty one.
     */
    public boolean isUsefulMove(int from, int to) {
        checkIndex(from);
        checkIndex(to);
        return !(tubes.get(to).isEmpty() && tubes.get(from).isSettled());
    }

    /**
     * Lists the legal and useful moves, sources in index order and destinations in index order.
     */
    public List<Move> legalMoves(PourPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        List<Move> moves = new ArrayList<>();
        for (int from = 0; from < tubes.size(); from++) {
            if (tubes.get(from).blockSize() == 0) {
                continue;
            }
            for (int to = 0; to < tubes.size(); to++) {
                if (from == to) {
                    continue;
                }
                if (canPour(from, to, policy) && isUsefulMove(from, to)) {
                    moves.add(new Move(from, to));
                }
            }
        }
        return moves;
    }

    /**
     * Applies the move and returns the resulting state.
     */
    public PuzzleState applyMove(Move move, PourPolicy policy) {
        Objects.requireNonNull(move, "move");
        int amount = transferAmount(move.from(), move.to(), policy);
        if (amount == 0) {
            throw new IllegalArgumentException("Illegal move " + move + " in state " + this);
        }
        Tube source = tubes.get(move.from());
        Tube target = tubes.get(move.to());
        List<Tube> updated = new ArrayList<>(tubes);
        updated.set(move.from(), source.withoutTop(amount));
        updated.set(move.to(), target.withAdded(source.topColor(), amount));
        return new PuzzleState(Collections.unmodifiableList(updated), capacity);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= tubes.size()) {
            throw new IllegalArgumentException("Tube index out of range: " + index);
        }
    }

    private static String buildKey(List<Tube> tubes) {
        StringBuilder builder = new StringBuilder(tubes.size() * 8);
        for (int i = 0; i < tubes.size(); i++) {
            if (i > 0) {
                builder.append('|');
            }
            tubes.get(i).appendKey(builder);
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PuzzleState state)) {
            return false;
        }
        return capacity == state.capacity && canonicalKey.equals(state.canonicalKey);
    }

    @Override
    public int hashCode() {
        return canonicalKey.hashCode();
    }

    @Override
    public String toString() {
        return "PuzzleState[" + canonicalKey + "]";
    }
}
