package org.tensorlatex.symbolic;

/**
 * One index slot of a tensor reference: either a label such as {@code mu} that takes part in
 * the summation convention, or a concrete component number.
 *
 * @param position Upper or lower.
 * @param label    The label, or {@code null} for a concrete index.
 * @param value    The component number; only meaningful when {@code label} is null.
 */
public record Index(IndexPosition position, String label, int value) {

    public static Index labelled(IndexPosition position, String label) {
        return new Index(position, label, -1);
    }

    public static Index concrete(IndexPosition position, int value) {
        return new Index(position, null, value);
    }

    public boolean isLabel() {
        return label != null;
    }

    /**
     * Replaces the label by a concrete component number.
     * @param component The value the label takes.
     * @return A concrete index in the same position.
     */
    public Index bind(int component) {
        return concrete(position, component);
    }

    @Override
    public String toString() {
        return isLabel() ? label : Integer.toString(value);
    }
}
