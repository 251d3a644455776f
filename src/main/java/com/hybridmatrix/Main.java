package com.hybridmatrix;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static void usage(PrintStream err) {
        err.println(
                "Usage: hybrid-matrix [options] <input-file>\n" +
                        "Prints dimension, mode and structural type, then:\n" +
                        "  -det          determinant\n" +
                        "  -rank         rank\n" +
                        "  -inverse      inverse (real and complex only)\n" +
                        "  -transpose    transpose\n" +
                        "  -tol X        zero threshold for rank and orthogonality (default 1e-9)\n" +
                        "With no operation flag, -det and -rank are assumed.\n"
        );
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs one report; returns the process exit code. */
    static int run(String[] args, PrintStream stdout, PrintStream stderr) {
        OptionsParser.Parsed parsed;
        try {
            parsed = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage(stderr);
            stderr.println("Argument error: " + e.getMessage());
            return 2;
        }

        ReportOptions opts = parsed.options;
        String filename = parsed.inputPath;
        long t0 = System.nanoTime();

        MatrixFile input;
        try {
            input = MatrixFile.readFromFile(filename);
        } catch (FileNotFoundException e) {
            stderr.println("File not found: " + filename);
            return 1;
        } catch (IOException e) {
            stderr.println("I/O error: " + e.getMessage());
            return 1;
        }

        // name line, or base filename without extension
        String name = input.getName();
        if (name == null) {
            name = Paths.get(filename).getFileName().toString();
            int dot = name.lastIndexOf('.');
            if (dot > 0) name = name.substring(0, dot);
        }

        PrintWriter out = new PrintWriter(stdout, true);
        Matrix m = input.getMatrix();
        out.println(name);
        out.println("*dimension=" + m.dimension());
        out.println("*mode=" + m.mode().keyword());
        out.println("*type=" + m.type());

        if (opts.determinant) {
            try {
                Entry det = m.determinant();
                out.println("*determinant=" + det);
            } catch (MatrixException e) {
                failure(out, "determinant", e);
            }
        }
        if (opts.rank) {
            out.println("*rank=" + m.rank(opts.tolerance));
        }
        if (opts.inverse) {
            try {
                Matrix inv = m.inverse();
                out.println("*inverse:");
                MatrixFile.writeBlock(inv, out);
            } catch (MatrixException e) {
                failure(out, "inverse", e);
            }
        }
        if (opts.transpose) {
            out.println("*transpose:");
            MatrixFile.writeBlock(m.transpose(), out);
        }

        double secs = (System.nanoTime() - t0) / 1_000_000_000.0;
        out.printf("*Time=%.3fs%n", secs);
        out.flush();
        return 0;
    }

    private static void failure(PrintWriter out, String op, MatrixException e) {
        log.debug("{} failed for report", op, e);
        out.println("*" + op + ": " + e.reason() + " " + e.getMessage());
    }
}
