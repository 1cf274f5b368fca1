package com.martian.mro.tools;

import com.martian.mro.Version;
import com.martian.mro.export.AstJsonExporter;
import com.martian.mro.format.MroFormatting;
import com.martian.mro.loader.MroAstBuilder;
import com.martian.mro.loader.MroException;
import com.martian.mro.loader.MroPath;
import com.martian.mro.loader.ast.Ast;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@code mrf}: prints MRO files in canonical form, rewrites them in place, flattens their
 * includes, or dumps their declarations as JSON.
 */
public final class MroFormatCli {
    private static final Logger LOGGER = Logger.getLogger(MroFormatCli.class.getName());

    private static final String USAGE = "Usage: mrf [--rewrite|-w] [--json] [--flatten] <file.mro>...";

    private MroFormatCli() {}

    public static void main(String[] args) {
        if (System.getProperty("mro.debug") != null) {
            enableDebugLogging();
        }
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean rewrite = false;
        boolean json = false;
        boolean flatten = false;
        List<Path> files = new ArrayList<>();
        for (String arg : args) {
            switch (arg) {
                case "--rewrite", "-w" -> rewrite = true;
                case "--json" -> json = true;
                case "--flatten" -> flatten = true;
                case "--version" -> {
                    out.println("mrf " + Version.RUNTIME);
                    return 0;
                }
                default -> {
                    if (arg.startsWith("-")) {
                        err.println("Unknown option: " + arg);
                        err.println(USAGE);
                        return 1;
                    }
                    files.add(Path.of(arg));
                }
            }
        }
        if (files.isEmpty()) {
            err.println(USAGE);
            return 1;
        }
        List<Path> searchPaths = MroPath.fromEnvironment();
        try {
            if (json) {
                out.println(dumpJson(files));
                return 0;
            }
            for (Path file : files) {
                if (flatten) {
                    out.print(MroFormatting.formatFlattened(file, searchPaths));
                } else if (rewrite) {
                    rewriteInPlace(file, searchPaths);
                } else {
                    out.print(MroFormatting.formatFile(file, null, searchPaths));
                }
            }
            return 0;
        } catch (MroException | IOException e) {
            LOGGER.log(Level.WARNING, "mrf failed", e);
            err.println(e.getMessage());
            return 1;
        }
    }

    private static String dumpJson(List<Path> files) throws IOException, MroException {
        MroAstBuilder builder = new MroAstBuilder();
        List<Ast> asts = new ArrayList<>();
        for (Path file : files) {
            asts.add(builder.parse(file.toString(), Files.readString(file, StandardCharsets.UTF_8)));
        }
        return new AstJsonExporter().dump(asts);
    }

    private static void rewriteInPlace(Path file, List<Path> searchPaths) throws IOException, MroException {
        String original = Files.readString(file, StandardCharsets.UTF_8);
        String formatted = MroFormatting.formatFile(file, null, searchPaths);
        if (!formatted.equals(original)) {
            Files.writeString(file, formatted, StandardCharsets.UTF_8);
            LOGGER.log(Level.FINE, "Rewrote {0}", file);
        }
    }

    private static void enableDebugLogging() {
        Logger mroLogger = Logger.getLogger("com.martian.mro");
        mroLogger.setLevel(Level.FINE);
        boolean hasConsole = false;
        for (Handler handler : mroLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler console) {
                console.setLevel(Level.FINE);
                hasConsole = true;
            }
        }
        if (!hasConsole) {
            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.FINE);
            mroLogger.addHandler(handler);
        }
    }
}
