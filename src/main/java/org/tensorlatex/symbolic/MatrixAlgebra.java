package org.tensorlatex.symbolic;

import java.util.ArrayList;
import java.util.List;

/**
 * Symbolic determinant and inverse of small square matrices by cofactor expansion.
 * Intended for metrics of dimension two to four.
 */
public final class MatrixAlgebra {

    private MatrixAlgebra() {
    }

    public static Expr determinant(Expr[][] matrix) {
        int n = matrix.length;
        if (n == 1) {
            return matrix[0][0];
        }
        if (n == 2) {
            return Expressions.subtract(Expressions.multiply(matrix[0][0], matrix[1][1]),
                    Expressions.multiply(matrix[0][1], matrix[1][0]));
        }
        List<Expr> terms = new ArrayList<>(n);
        for (int column = 0; column < n; column++) {
            if (matrix[0][column].isZero()) {
                continue;
            }
            Expr cofactor = Expressions.multiply(sign(column), matrix[0][column], determinant(minor(matrix, 0, column)));
            terms.add(cofactor);
        }
        return Expressions.add(terms);
    }

    /**
     * Inverts a matrix through its adjugate.
     * @param matrix The matrix.
     * @return The inverse.
     * @throws ArithmeticException if the determinant is identically zero.
     */
    public static Expr[][] inverse(Expr[][] matrix) {
        int n = matrix.length;
        Expr det = determinant(matrix);
        if (det.isZero()) {
            throw new ArithmeticException("Matrix is singular");
        }
        Expr reciprocal = Expressions.power(det, Rational.MINUS_ONE);
        Expr[][] inverse = new Expr[n][n];
        if (n == 1) {
            inverse[0][0] = reciprocal;
            return inverse;
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                Expr cofactor = Expressions.multiply(sign(i + j), determinant(minor(matrix, j, i)));
                inverse[i][j] = Expressions.multiply(cofactor, reciprocal);
            }
        }
        return inverse;
    }

    private static Rational sign(int k) {
        return k % 2 == 0 ? Rational.ONE : Rational.MINUS_ONE;
    }

    private static Expr[][] minor(Expr[][] matrix, int row, int column) {
        int n = matrix.length;
        Expr[][] minor = new Expr[n - 1][n - 1];
        for (int i = 0, mi = 0; i < n; i++) {
            if (i == row) continue;
            for (int j = 0, mj = 0; j < n; j++) {
                if (j == column) continue;
                minor[mi][mj++] = matrix[i][j];
            }
            mi++;
        }
        return minor;
    }
}
