package com.hybridmatrix;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.util.Locale;

/**
 * A named matrix in block form:
 *
 * <pre>
 * example
 * begin
 * 2 2 integer
 * 1 2
 * 3 4
 * end
 * </pre>
 *
 * The header after {@code begin} gives rows, columns and the entry mode
 * ({@code real}, {@code integer} or {@code complex}). Lines starting with
 * {@code *} or {@code #} are comments.
 */
public class MatrixFile {

    private final String name;
    private final NumericMode declaredMode;
    private final Matrix matrix;

    public MatrixFile(String name, NumericMode declaredMode, Matrix matrix) {
        this.name = name;
        this.declaredMode = declaredMode;
        this.matrix = matrix;
    }

    /** Name line before {@code begin}, or null when the block has none. */
    public String getName() { return name; }
    public NumericMode getDeclaredMode() { return declaredMode; }
    public Matrix getMatrix() { return matrix; }

    public static MatrixFile readFromFile(String filename) throws IOException {
        try (Reader r = new FileReader(filename)) {
            return read(r);
        }
    }

    public static MatrixFile read(Reader in) throws IOException {
        BufferedReader br = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        String line;
        String name = null;
        boolean sawBegin = false;

        // ---- optional name line, then 'begin' ----
        while ((line = br.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty() || isComment(line)) continue;
            if (line.equalsIgnoreCase("begin")) { sawBegin = true; break; }
            if (name == null) name = line;
        }
        if (!sawBegin) throw new IOException("No 'begin' line found");

        // ---- header: rows cols mode ----
        line = nextLine(br);
        String[] header = line.split("\\s+");
        if (header.length < 3) {
            throw new IOException("Expected 'rows cols real|integer|complex', got: " + line);
        }
        int m, n;
        try {
            m = Integer.parseInt(header[0]);
            n = Integer.parseInt(header[1]);
        } catch (NumberFormatException e) {
            throw new IOException("Row and column counts must be integers, got: " + line, e);
        }
        if (m <= 0 || n <= 0) throw new IOException("Dimensions must be positive, got: " + line);
        NumericMode mode;
        try {
            mode = NumericMode.fromKeyword(header[2].toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }

        // ---- body ----
        Entry[][] grid = new Entry[m][n];
        for (int i = 0; i < m; i++) {
            line = nextLine(br);
            String[] tokens = line.split("\\s+");
            if (tokens.length != n) {
                throw new IOException("Expected " + n + " columns on row " + (i + 1) + ", got " + tokens.length);
            }
            for (int j = 0; j < n; j++) {
                try {
                    grid[i][j] = parseEntry(tokens[j], mode);
                } catch (NumberFormatException e) {
                    throw new IOException("Bad " + mode.keyword() + " entry '" + tokens[j] + "' on row " + (i + 1), e);
                }
            }
        }

        line = nextLine(br);
        if (!line.equalsIgnoreCase("end")) throw new IOException("Expected 'end', got: " + line);

        return new MatrixFile(name, mode, Matrix.fromArray(grid));
    }

    static Entry parseEntry(String token, NumericMode mode) {
        switch (mode) {
            case BIG_INTEGER: return BigInt.parse(token);
            case COMPLEX: return Complex.parse(token);
            default: return Real.parse(token);
        }
    }

    /** Writes the block using the matrix's resolved mode as the header keyword. */
    public void write(PrintWriter out) {
        if (name != null) out.println(name);
        writeBlock(matrix, out);
    }

    public static void writeBlock(Matrix matrix, PrintWriter out) {
        out.println("begin");
        out.printf("%d %d %s%n", matrix.rows(), matrix.cols(), matrix.mode().keyword());
        String[][] cells = Matrix.display(matrix.toArray(), matrix.mode().ops());
        for (String[] row : cells) {
            out.println(String.join(" ", row));
        }
        out.println("end");
    }

    private static boolean isComment(String line) {
        return line.startsWith("*") || line.startsWith("#");
    }

    private static String nextLine(BufferedReader br) throws IOException {
        String line;
        do {
            line = br.readLine();
            if (line == null) throw new IOException("Unexpected end of file");
            line = line.trim();
        } while (line.isEmpty() || isComment(line));
        return line;
    }
}
