package com.martian.mro.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MroFormatCliTest {

    private static final String MESSY = "stage S( in int a, src py \"x\", )\n";
    private static final String CANONICAL = "stage S(\n    in  int a,\n    src py  \"x\",\n)\n";

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void printsFormattedSource() throws Exception {
        Path file = write("s.mro", MESSY);

        assertEquals(0, run(file.toString()));
        assertEquals(CANONICAL, text(out));
        assertEquals(MESSY, Files.readString(file));
    }

    @Test
    void rewritesFilesInPlace() throws Exception {
        Path file = write("s.mro", MESSY);

        assertEquals(0, run("-w", file.toString()));
        assertEquals(CANONICAL, Files.readString(file));
        assertEquals("", text(out));
    }

    @Test
    void dumpsJson() throws Exception {
        Path file = write("s.mro", MESSY);

        assertEquals(0, run("--json", file.toString()));
        assertTrue(text(out).contains("\"Stages\": {"), text(out));
    }

    @Test
    void flattensIncludes() throws Exception {
        write("types.mro", "filetype json;\n");
        Path file = write("main.mro", "@include \"types.mro\"\n\n" + MESSY);

        assertEquals(0, run("--flatten", file.toString()));
        assertTrue(text(out).startsWith("#\n# @include \"types.mro\"\n#\n\nfiletype json;\n"), text(out));
    }

    @Test
    void parseErrorsExitWithFailure() throws Exception {
        Path file = write("bad.mro", "stage S(\n");

        assertEquals(1, run(file.toString()));
        assertTrue(text(err).contains("bad.mro:"), text(err));
    }

    @Test
    void missingArgumentsPrintUsage() {
        assertEquals(1, run());
        assertTrue(text(err).startsWith("Usage: mrf"), text(err));
        assertEquals(1, run("--bogus"));
    }

    private int run(String... args) {
        return MroFormatCli.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path write(String name, String contents) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, contents);
        return file;
    }

    private static String text(ByteArrayOutputStream stream) {
        return stream.toString(StandardCharsets.UTF_8);
    }
}
