package me.christianrobert.pyibackport.cli;

import java.io.PrintStream;

/**
 * Hand-rolled argument parsing for {@link Main}.
 *
 * <pre>
 * pyi-backport [--target VERSION] SOURCE [OUTPUT]
 * </pre>
 */
final class CliArgs {

    static final String STDIO = "-";

    String source;
    String output;
    String target;
    boolean help;
    boolean version;

    private CliArgs() {
    }

    /**
     * @throws IllegalArgumentException on an unknown option, a missing option value or a surplus argument
     */
    static CliArgs parse(String[] args) {
        CliArgs parsed = new CliArgs();
        if (args == null) {
            return parsed;
        }

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h":
                case "--help":
                    parsed.help = true;
                    break;
                case "--version":
                    parsed.version = true;
                    break;
                case "-t":
                case "--target":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for " + arg);
                    }
                    parsed.target = args[++i];
                    break;
                default:
                    if (arg.startsWith("--target=")) {
                        parsed.target = arg.substring("--target=".length());
                    } else if (arg.startsWith("-") && !arg.equals(STDIO)) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    } else if (parsed.source == null) {
                        parsed.source = arg;
                    } else if (parsed.output == null) {
                        parsed.output = arg;
                    } else {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
            }
        }
        return parsed;
    }

    boolean readsStdin() {
        return STDIO.equals(source);
    }

    boolean writesStdout() {
        return output == null || STDIO.equals(output);
    }

    static void printHelp(PrintStream out) {
        out.println("Usage: pyi-backport [--target VERSION] SOURCE [OUTPUT]");
        out.println();
        out.println("Rewrites a Python stub file (.pyi) so that it is valid for an older Python version.");
        out.println();
        out.println("Arguments:");
        out.println("  SOURCE              Stub file to read, or - for stdin");
        out.println("  OUTPUT              File to write, or - for stdout (default: stdout)");
        out.println();
        out.println("Options:");
        out.println("  -t, --target VER    Target Python version: 3.10, 3.11, 3.12 or 3.13 (default: 3.10)");
        out.println("      --version       Print the version and exit");
        out.println("  -h, --help          Show this help");
        out.println();
        out.println("Exit codes: 0 success, 1 usage error, 2 I/O error, 3 stub rejected");
    }
}
