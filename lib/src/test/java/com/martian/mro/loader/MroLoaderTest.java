package com.martian.mro.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.martian.mro.loader.ast.Ast;
import com.martian.mro.loader.ast.SourceFile;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MroLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void diamondIncludeIsLoadedOnce() throws Exception {
        write("common.mro", "filetype json;\n");
        write("left.mro", "@include \"common.mro\"\n\nstage LEFT(\n    src py \"left\",\n)\n");
        write("right.mro", "@include \"common.mro\"\n\nstage RIGHT(\n    src py \"right\",\n)\n");
        Path root =
                write(
                        "main.mro",
                        "@include \"left.mro\"\n@include \"right.mro\"\n\ncall LEFT()\n");

        Ast ast = new MroLoader().load(root, List.of());

        assertEquals(1, ast.getUserTypes().size());
        assertEquals(2, ast.getStages().size());
        assertEquals("LEFT", ast.getStages().get(0).getId());
        assertEquals("RIGHT", ast.getStages().get(1).getId());
        assertEquals(4, ast.getFiles().size());
        assertEquals(2, ast.getIncludes().size());
        assertNotNull(ast.getCall());

        SourceFile common = ast.getUserTypes().get(0).getNode().getLoc().getFile();
        assertEquals("common.mro", common.getFileName());
        assertEquals(2, common.getIncludedFrom().size());
    }

    @Test
    void includeCycleIsRejected() throws Exception {
        write("a.mro", "@include \"b.mro\"\n");
        write("b.mro", "@include \"a.mro\"\n");

        CyclicIncludeException error =
                assertThrows(CyclicIncludeException.class, () -> new MroLoader().load(tempDir.resolve("a.mro"), List.of()));
        assertEquals("b.mro", error.getSourceFilename());
        assertEquals(1, error.getLine());
    }

    @Test
    void includeAfterDeclarationIsRejected() throws Exception {
        Path root = write("main.mro", "filetype json;\n@include \"other.mro\"\n");
        assertThrows(MroParseException.class, () -> new MroLoader().load(root, List.of()));
    }

    @Test
    void missingIncludeNamesTheDirective() throws Exception {
        Path valid = write("valid.mro", "\n@include \"nowhere.mro\"\n");
        IncludeNotFoundException error =
                assertThrows(IncludeNotFoundException.class, () -> new MroLoader().load(valid, List.of()));
        assertEquals("nowhere.mro", error.getIncludePath());
        assertEquals(2, error.getLine());
    }

    @Test
    void includeResolvesAgainstSearchPath() throws Exception {
        Path lib = Files.createDirectories(tempDir.resolve("lib"));
        Files.writeString(lib.resolve("shared.mro"), "stage SHARED(\n    src py \"shared\",\n)\n");
        Path root = write("main.mro", "@include \"shared.mro\"\n");

        Ast ast = new MroLoader().load(root, List.of(lib));

        assertEquals("SHARED", ast.getStages().get(0).getId());
    }

    @Test
    void duplicateCallableAcrossFilesIsRejected() throws Exception {
        write("one.mro", "stage S(\n    src py \"one\",\n)\n");
        Path root = write("main.mro", "@include \"one.mro\"\n\nstage S(\n    src py \"two\",\n)\n");

        DuplicateIdentifierException error =
                assertThrows(DuplicateIdentifierException.class, () -> new MroLoader().load(root, List.of()));
        assertEquals("S", error.getIdentifier());
        assertEquals(3, error.getLine());
        assertTrue(error.getSourceFilename().endsWith("main.mro"));
    }

    @Test
    void includedFileMayNotHaveTopLevelCall() throws Exception {
        write("called.mro", "stage S(\n    src py \"s\",\n)\n\ncall S()\n");
        Path root = write("main.mro", "@include \"called.mro\"\n");

        MroParseException error = assertThrows(MroParseException.class, () -> new MroLoader().load(root, List.of()));
        assertEquals("called.mro", error.getSourceFilename());
        assertEquals(5, error.getLine());
    }

    @Test
    void searchPathParsesSeparatedEntries() {
        List<Path> paths = MroPath.parse("a" + File.pathSeparator + " " + File.pathSeparator + "b");
        assertEquals(List.of(Path.of("a"), Path.of("b")), paths);
        assertTrue(MroPath.parse(null).isEmpty());
    }

    private Path write(String name, String contents) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, contents);
        return file;
    }
}
