package org.tensorlatex.compiler.frontend.semantics;

import org.tensorlatex.symbolic.IndexPosition;

import java.util.ArrayList;
import java.util.List;

/**
 * Naming conventions of the namespace.
 * <p>
 * A tensor name is a base symbol followed by one {@code U} or {@code D} per index, e.g. {@code hUD}.
 * Derivative tensors append segments: {@code vU_dD} for a partial and {@code vU_cdhatD} for a
 * covariant derivative against the {@code hat} connection. Components append their index
 * values, {@code hUD01}.
 */
public final class TensorNames {

    private static final List<String> DIACRITICS = List.of("hat", "bar", "tilde");

    private TensorNames() {
    }

    /**
     * Returns the index positions encoded in a name.
     * @param name A tensor name such as {@code gDD} or {@code vU_cdD}.
     * @return The positions, empty for a scalar.
     */
    public static List<IndexPosition> positions(String name) {
        List<IndexPosition> positions = new ArrayList<>();
        String[] segments = name.split("_");
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            int start = i == 0 ? suffixStart(segment) : trailingSuffixStart(segment);
            for (int c = start; c < segment.length(); c++) {
                positions.add(IndexPosition.fromSuffix(segment.charAt(c)));
            }
        }
        return positions;
    }

    /**
     * Returns the base symbol of a name, {@code g} for {@code gDD} and {@code ghat} for {@code ghatUU}.
     * @param name A tensor name.
     * @return The name without index suffixes and derivative segments.
     */
    public static String baseSymbol(String name) {
        String head = name.split("_")[0];
        return head.substring(0, suffixStart(head));
    }

    /**
     * Returns the diacritic a base symbol ends in.
     * @param base A base symbol such as {@code ghat}.
     * @return {@code hat}, {@code bar}, {@code tilde} or the empty string.
     */
    public static String diacritic(String base) {
        for (String diacritic : DIACRITICS) {
            if (base.endsWith(diacritic) && base.length() > diacritic.length()) {
                return diacritic;
            }
        }
        return "";
    }

    /**
     * Spells a base symbol in LaTeX, so that parsing the result yields the same base again.
     * @param base A base symbol such as {@code ghat} or {@code Gamma}.
     * @return E.g. {@code \hat{g}} or {@code \Gamma}.
     */
    public static String latex(String base) {
        String diacritic = diacritic(base);
        if (!diacritic.isEmpty()) {
            return "\\" + diacritic + "{" + latex(base.substring(0, base.length() - diacritic.length())) + "}";
        }
        if (base.length() == 1) {
            return base;
        }
        return "\\" + base;
    }

    public static String christoffel(String diacritic) {
        return "Gamma" + diacritic + "UDD";
    }

    /**
     * Builds the name of a tensor with the given index positions.
     * @param base      The base symbol.
     * @param positions The index positions.
     * @return E.g. {@code hUD}.
     */
    public static String of(String base, List<IndexPosition> positions) {
        return base + suffix(positions);
    }

    public static String suffix(List<IndexPosition> positions) {
        StringBuilder builder = new StringBuilder();
        for (IndexPosition position : positions) {
            builder.append(position.suffix());
        }
        return builder.toString();
    }

    /**
     * Name of one component, e.g. {@code hUD01}.
     * @param name   The tensor name.
     * @param values The index values.
     * @return The name followed by the index values.
     */
    public static String component(String name, int[] values) {
        StringBuilder builder = new StringBuilder(name);
        for (int value : values) {
            builder.append(value);
        }
        return builder.toString();
    }

    /**
     * Name of the partial-derivative tensor of an operand.
     * @param operand The differentiated tensor, possibly already a partial-derivative tensor.
     * @param order   The number of additional derivative indices.
     * @return E.g. {@code vU_dD} for {@code vU}, or {@code vU_dDD} for {@code vU_dD}.
     */
    public static String partial(String operand, int order) {
        String suffix = "D".repeat(order);
        return operand.contains("_d") ? operand + suffix : operand + "_d" + suffix;
    }

    private static int suffixStart(String head) {
        return Math.max(trailingSuffixStart(head), Math.min(1, head.length()));
    }

    private static int trailingSuffixStart(String segment) {
        int start = segment.length();
        while (start > 0 && isSuffix(segment.charAt(start - 1))) {
            start--;
        }
        return start;
    }

    private static boolean isSuffix(char c) {
        return c == 'U' || c == 'D';
    }
}
