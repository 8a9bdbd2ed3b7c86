package org.tensorlatex.compiler.frontend.semantics;

import org.tensorlatex.compiler.diagnostics.TensorException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Index symmetries of a tensor, written as in {@code sym01}, {@code anti12} or {@code sym01_anti23}.
 * Each group lists index slots that may be permuted freely (symmetric) or with a sign
 * change per transposition (antisymmetric).
 */
public final class Symmetry {

    public static final Symmetry NONE = new Symmetry(List.of());

    private static final Pattern GROUP = Pattern.compile("(sym|anti)([0-9]+)");

    /**
     * One group of interchangeable index slots.
     *
     * @param antisymmetric Whether a transposition flips the sign.
     * @param positions     The slots, in ascending order.
     */
    public record Group(boolean antisymmetric, List<Integer> positions) {
        public Group {
            positions = List.copyOf(positions);
        }

        @Override
        public String toString() {
            return (antisymmetric ? "anti" : "sym") + positions.stream().map(String::valueOf).collect(Collectors.joining());
        }
    }

    /**
     * A component index in canonical order together with its relation to the original.
     *
     * @param indices The canonical index values.
     * @param sign    +1 or -1 relating the original component to the canonical one, 0 if it vanishes.
     */
    public record Canonical(int[] indices, int sign) {

        /**
         * @return The canonical indices as a hashable key.
         */
        public List<Integer> key() {
            return keyOf(indices);
        }

        public static List<Integer> keyOf(int[] indices) {
            return Arrays.stream(indices).boxed().toList();
        }
    }

    private final List<Group> groups;

    private Symmetry(List<Group> groups) {
        this.groups = List.copyOf(groups);
    }

    /**
     * Parses a symmetry keyword.
     * @param keyword {@code nosym} or groups such as {@code sym01_anti23}.
     * @return The symmetry.
     */
    public static Symmetry parse(String keyword) {
        if (keyword == null || keyword.equals("nosym")) {
            return NONE;
        }
        List<Group> groups = new ArrayList<>();
        for (String part : keyword.split("_")) {
            Matcher matcher = GROUP.matcher(part);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Not a symmetry: " + keyword);
            }
            List<Integer> positions = matcher.group(2).chars().map(c -> c - '0').sorted().boxed().toList();
            groups.add(new Group(matcher.group(1).equals("anti"), positions));
        }
        return new Symmetry(groups);
    }

    public static Symmetry symmetric(Integer... positions) {
        return new Symmetry(List.of(new Group(false, List.of(positions))));
    }

    /**
     * Returns a symmetry with one more group.
     * @param group The additional group.
     * @return The combined symmetry.
     */
    public Symmetry with(Group group) {
        List<Group> combined = new ArrayList<>(groups);
        combined.add(group);
        return new Symmetry(combined);
    }

    public List<Group> groups() {
        return groups;
    }

    public boolean isNone() {
        return groups.isEmpty();
    }

    /**
     * Checks that the groups fit a tensor of the given rank.
     * @param name The tensor name, for the error message.
     * @param rank The tensor rank.
     * @throws TensorException if a slot is out of range, a group has fewer than two slots,
     *                         or two groups share a slot.
     */
    public void validate(String name, int rank) {
        Set<Integer> seen = new HashSet<>();
        for (Group group : groups) {
            if (group.positions().size() < 2) {
                throw new TensorException(String.format("symmetry %s of '%s' needs at least two indices", group, name));
            }
            for (int position : group.positions()) {
                if (position >= rank) {
                    throw new TensorException(String.format("symmetry %s exceeds rank %d of '%s'", group, rank, name));
                }
                if (!seen.add(position)) {
                    throw new TensorException(String.format("index %d of '%s' appears in two symmetry groups", position, name));
                }
            }
        }
    }

    /**
     * Sorts the values inside every group.
     * @param indices Component index values.
     * @return The canonical component and the sign relating it to {@code indices}.
     */
    public Canonical canonicalize(int[] indices) {
        int[] canonical = indices.clone();
        int sign = 1;
        for (Group group : groups) {
            int[] values = new int[group.positions().size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = canonical[group.positions().get(i)];
            }
            int inversions = 0;
            for (int i = 0; i < values.length; i++) {
                for (int j = i + 1; j < values.length; j++) {
                    if (values[i] > values[j]) {
                        inversions++;
                    } else if (values[i] == values[j] && group.antisymmetric()) {
                        return new Canonical(canonical, 0);
                    }
                }
            }
            if (group.antisymmetric() && inversions % 2 == 1) {
                sign = -sign;
            }
            Arrays.sort(values);
            for (int i = 0; i < values.length; i++) {
                canonical[group.positions().get(i)] = values[i];
            }
        }
        return new Canonical(canonical, sign);
    }

    /**
     * Lists every component that shares its value with a canonical component.
     * @param canonical Canonical index values as returned by {@link #canonicalize(int[])}.
     * @return The distinct images, each with the sign relating it to the canonical component.
     */
    public List<Canonical> images(int[] canonical) {
        List<Canonical> images = new ArrayList<>();
        images.add(new Canonical(canonical.clone(), 1));
        for (Group group : groups) {
            List<Canonical> next = new ArrayList<>();
            for (Canonical image : images) {
                permute(group, image.indices(), 0, image.sign(), next);
            }
            images = next;
        }
        List<Canonical> distinct = new ArrayList<>();
        Set<List<Integer>> seen = new HashSet<>();
        for (Canonical image : images) {
            if (seen.add(image.key())) {
                distinct.add(image);
            }
        }
        return distinct;
    }

    private static void permute(Group group, int[] indices, int from, int sign, List<Canonical> out) {
        List<Integer> positions = group.positions();
        if (from == positions.size() - 1) {
            out.add(new Canonical(indices.clone(), sign));
            return;
        }
        for (int i = from; i < positions.size(); i++) {
            int[] swapped = indices.clone();
            int a = positions.get(from);
            int b = positions.get(i);
            int tmp = swapped[a];
            swapped[a] = swapped[b];
            swapped[b] = tmp;
            int nextSign = i != from && group.antisymmetric() ? -sign : sign;
            permute(group, swapped, from + 1, nextSign, out);
        }
    }

    @Override
    public String toString() {
        return groups.isEmpty() ? "nosym" : groups.stream().map(Group::toString).collect(Collectors.joining("_"));
    }
}
