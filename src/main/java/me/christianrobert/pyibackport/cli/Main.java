package me.christianrobert.pyibackport.cli;

import me.christianrobert.pyibackport.transformer.context.StubTransformationException;
import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import me.christianrobert.pyibackport.transformer.parser.AntlrParser;
import me.christianrobert.pyibackport.transformer.service.StubTransformationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point: backports one stub file.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String VERSION = "pyi-backport 1.0.0";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_IO = 2;
    static final int EXIT_REJECTED = 3;

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        return run(args, System.in, System.out, System.err);
    }

    static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            stderr.println("Error: " + ex.getMessage());
            stderr.println();
            CliArgs.printHelp(stderr);
            return EXIT_USAGE;
        }

        if (parsed.help) {
            CliArgs.printHelp(stdout);
            return EXIT_OK;
        }
        if (parsed.version) {
            stdout.println(VERSION);
            return EXIT_OK;
        }

        if (parsed.source == null) {
            stderr.println("Error: SOURCE is required.");
            stderr.println();
            CliArgs.printHelp(stderr);
            return EXIT_USAGE;
        }

        PythonVersion target;
        try {
            target = parsed.target == null ? PythonVersion.DEFAULT_TARGET : PythonVersion.parseTarget(parsed.target);
        } catch (IllegalArgumentException ex) {
            stderr.println("Error: " + ex.getMessage());
            return EXIT_USAGE;
        }

        Path sourcePath = null;
        if (!parsed.readsStdin()) {
            sourcePath = Paths.get(parsed.source);
            Path fileName = sourcePath.getFileName();
            if (fileName == null || !fileName.toString().endsWith(".pyi")) {
                stderr.println("Error: SOURCE must be a .pyi file: " + sourcePath);
                return EXIT_USAGE;
            }
        }

        String source;
        try {
            source = sourcePath == null
                    ? new String(stdin.readAllBytes(), StandardCharsets.UTF_8)
                    : Files.readString(sourcePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            stderr.println("Error: could not read " + (sourcePath == null ? "stdin" : sourcePath.toString()));
            stderr.println(e.getMessage());
            return EXIT_IO;
        }

        String transformed;
        try {
            StubTransformationService service = new StubTransformationService(new AntlrParser());
            transformed = service.transform(source, target);
        } catch (StubTransformationException e) {
            String location = sourcePath == null ? "<stdin>" : sourcePath.toString();
            stderr.println(location + ": " + e.getKind() + ": " + e.getMessage());
            log.debug("Rejected {}", location, e);
            return EXIT_REJECTED;
        }

        if (parsed.writesStdout()) {
            stdout.print(transformed);
            stdout.flush();
            return EXIT_OK;
        }

        Path outputPath = Paths.get(parsed.output);
        try {
            Path parent = outputPath.toAbsolutePath().normalize().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, transformed, StandardCharsets.UTF_8);
        } catch (IOException e) {
            stderr.println("Error: could not write " + outputPath);
            stderr.println(e.getMessage());
            return EXIT_IO;
        }
        return EXIT_OK;
    }
}
