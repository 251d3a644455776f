package com.hybridmatrix;

import java.util.function.Predicate;

/**
 * Structural classification. Constants are tested in declaration order and
 * the first match wins, so a zero matrix is reported as {@link #ZERO} even
 * though it is also diagonal and triangular. {@link #SCALAR} therefore never
 * wins over {@link #DIAGONAL}; use {@link Matrix#isScalarMatrix()} directly.
 */
public enum MatrixType {
    ZERO("Zero Matrix", Matrix::isZeroMatrix),
    IDENTITY("Identity Matrix", Matrix::isIdentity),
    DIAGONAL("Diagonal Matrix", Matrix::isDiagonal),
    SCALAR("Scalar Matrix", Matrix::isScalarMatrix),
    HERMITIAN("Hermitian Matrix", Matrix::isHermitian),
    SYMMETRIC("Symmetric Matrix", Matrix::isSymmetric),
    UPPER_TRIANGULAR("Upper Triangular Matrix", Matrix::isUpperTriangular),
    LOWER_TRIANGULAR("Lower Triangular Matrix", Matrix::isLowerTriangular),
    ROW("Row Matrix", Matrix::isRowMatrix),
    COLUMN("Column Matrix", Matrix::isColumnMatrix),
    SQUARE("Square Matrix", Matrix::isSquare),
    GENERAL("Rectangular Matrix (General)", m -> true);

    private final String label;
    private final Predicate<Matrix> test;

    MatrixType(String label, Predicate<Matrix> test) {
        this.label = label;
        this.test = test;
    }

    public String label() { return label; }

    public boolean matches(Matrix m) { return test.test(m); }

    public static MatrixType classify(Matrix m) {
        for (MatrixType t : values()) {
            if (t.matches(m)) return t;
        }
        return GENERAL;
    }
}
