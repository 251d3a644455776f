package com.hybridmatrix;

public final class OptionsParser {

    public static final class Parsed {
        public final ReportOptions options;
        public final String inputPath;
        private Parsed(ReportOptions o, String p){ options=o; inputPath=p; }
    }

    private OptionsParser(){}

    public static Parsed parse(String[] args){
        ReportOptions.Builder b = new ReportOptions.Builder();
        String input = null;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-det": b.determinant(true); break;
                case "-rank": b.rank(true); break;
                case "-inverse": b.inverse(true); break;
                case "-transpose": b.transpose(true); break;
                case "-tol": {
                    if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for -tol");
                    b.tolerance(Double.parseDouble(args[++i]));
                    break;
                }
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (input != null) throw new IllegalArgumentException("Multiple inputs: " + a);
                    input = a;
            }
        }
        if (input == null) throw new IllegalArgumentException("Missing input file");
        return new Parsed(b.build(), input);
    }
}
