package com.martian.mro.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.martian.mro.loader.ast.Ast;
import com.martian.mro.loader.ast.BindStm;
import com.martian.mro.loader.ast.CallStm;
import com.martian.mro.loader.ast.CommentBlock;
import com.martian.mro.loader.ast.InParam;
import com.martian.mro.loader.ast.OutParam;
import com.martian.mro.loader.ast.Param;
import com.martian.mro.loader.ast.Pipeline;
import com.martian.mro.loader.ast.RefExp;
import com.martian.mro.loader.ast.Stage;
import com.martian.mro.loader.ast.ValExp;
import java.util.List;
import org.junit.jupiter.api.Test;

class MroAstBuilderTest {

    private static final String STAGES =
            String.join(
                    "\n",
                    "filetype json;",
                    "",
                    "stage SUM(",
                    "    in  int[]  values,",
                    "    in  string label \"A label\",",
                    "    out int    sum    \"The total\" \"sum.txt\",",
                    "    src py     \"stages/sum --fast\",",
                    ") split (",
                    "    in  int    value,",
                    ") using (",
                    "    threads = 2,",
                    "    mem_gb  = 4,",
                    ") retain (",
                    "    sum,",
                    ")",
                    "",
                    "pipeline TOTAL(",
                    "    in  int[] values,",
                    "    out int   total,",
                    ")",
                    "{",
                    "    call local SUM as FIRST(",
                    "        values = self.values,",
                    "        label  = sweep(\"a\", \"b\"),",
                    "    ) using (",
                    "        disabled = false,",
                    "    )",
                    "",
                    "    return (",
                    "        total = FIRST.sum,",
                    "    )",
                    "",
                    "    retain (",
                    "        FIRST.sum,",
                    "    )",
                    "}",
                    "");

    @Test
    void buildsStageWithAllClauses() throws Exception {
        Ast ast = new MroAstBuilder().parse("test.mro", STAGES);

        assertEquals("json", ast.getUserTypes().get(0).getId());
        Stage stage = ast.getStages().get(0);
        assertEquals("SUM", stage.getId());
        assertEquals(3, stage.getNode().getLoc().getLine());

        InParam values = stage.getInParams().get(0);
        assertEquals("int", values.getTname());
        assertEquals(1, values.getArrayDim());
        assertEquals("values", values.getId());
        assertEquals("", values.getHelp());
        assertEquals("A label", stage.getInParams().get(1).getHelp());

        OutParam sum = stage.getOutParams().get(0);
        assertEquals("The total", sum.getHelp());
        assertEquals("sum.txt", sum.getOutName());

        assertEquals("py", stage.getSrc().getLang());
        assertEquals("stages/sum", stage.getSrc().getPath());
        assertEquals(List.of("--fast"), stage.getSrc().getArgs());

        assertTrue(stage.isSplit());
        assertEquals("value", stage.getChunkIns().get(0).getId());
        assertEquals(2, stage.getResources().getThreads());
        assertEquals(4, stage.getResources().getMemGb());
        assertNull(stage.getResources().getSpecialNode());
        assertFalse(stage.getResources().isStrictVolatile());
        assertEquals("sum", stage.getRetain().getParams().get(0).id());
    }

    @Test
    void buildsPipelineCallsAndReferences() throws Exception {
        Ast ast = new MroAstBuilder().parse("test.mro", STAGES);
        Pipeline pipeline = ast.getPipelines().get(0);

        CallStm call = pipeline.getCalls().get(0);
        assertEquals("FIRST", call.getId());
        assertEquals("SUM", call.getDecId());
        assertTrue(call.getModifiers().isLocal());
        assertFalse(call.getModifiers().isPreflight());
        assertEquals("disabled", call.getModifiers().getBindings().getList().get(0).getId());

        RefExp self = assertInstanceOf(RefExp.class, call.getBindings().get("values").getExp());
        assertEquals(RefExp.Kind.SELF, self.getKind());
        assertEquals("values", self.getId());
        assertNull(self.getOutputId());

        BindStm label = call.getBindings().get("label");
        assertTrue(label.isSweep());
        ValExp alternatives = assertInstanceOf(ValExp.class, label.getExp());
        assertEquals(2, alternatives.asArray().size());

        RefExp total = assertInstanceOf(RefExp.class, pipeline.getRet().getBindings().get("total").getExp());
        assertEquals("FIRST", total.getId());
        assertEquals("sum", total.getOutputId());
        assertEquals("FIRST", pipeline.getRetain().getRefs().get(0).getId());
    }

    @Test
    void referenceWithoutOutputUsesDefault() throws Exception {
        Ast ast =
                new MroAstBuilder()
                        .parse(
                                "test.mro",
                                "pipeline P(out int x,)\n{\n    call S(a = S2,)\n    return (x = S,)\n}\n");
        RefExp ref = (RefExp) ast.getPipelines().get(0).getCalls().get(0).getBindings().get("a").getExp();
        assertEquals(Param.DEFAULT_ID, ref.getOutputId());
    }

    @Test
    void unnamedParameterGetsDefaultId() throws Exception {
        Ast ast = new MroAstBuilder().parse("test.mro", "stage S(\n    out json,\n    src py \"s\",\n)\n");
        OutParam out = ast.getStages().get(0).getOutParams().get(0);
        assertTrue(out.isDefault());
        assertEquals(Param.DEFAULT_ID, out.getId());
    }

    @Test
    void softKeywordsAreUsableAsIdentifiers() throws Exception {
        Ast ast =
                new MroAstBuilder()
                        .parse("test.mro", "stage S(\n    in int threads,\n    in int split,\n    src py \"s\",\n)\n");
        List<InParam> params = ast.getStages().get(0).getInParams();
        assertEquals("threads", params.get(0).getId());
        assertEquals("split", params.get(1).getId());
    }

    @Test
    void literalsKeepTheirKinds() throws Exception {
        Ast ast =
                new MroAstBuilder()
                        .parse(
                                "test.mro",
                                "call P(\n    i = 3,\n    f = 2.5,\n    s = \"x\",\n    b = true,\n"
                                        + "    n = null,\n    m = {\"k\": [1, 2]},\n)\n");
        CallStm call = ast.getCall();
        assertEquals(3L, ((ValExp) call.getBindings().get("i").getExp()).asInt());
        assertEquals(2.5, ((ValExp) call.getBindings().get("f").getExp()).asFloat());
        assertEquals("x", ((ValExp) call.getBindings().get("s").getExp()).asString());
        assertTrue(((ValExp) call.getBindings().get("b").getExp()).asBool());
        assertEquals(ValExp.Kind.NULL, ((ValExp) call.getBindings().get("n").getExp()).getKind());
        ValExp map = (ValExp) call.getBindings().get("m").getExp();
        assertEquals(2, ((ValExp) map.asMap().get("k")).asArray().size());
    }

    @Test
    void commentsSplitIntoAttachedAndScopeBlocks() throws Exception {
        String source =
                String.join(
                        "\n",
                        "# file header",
                        "",
                        "# about json",
                        "# second line",
                        "filetype json;",
                        "# dangling at end",
                        "");
        Ast ast = new MroAstBuilder().parse("test.mro", source);

        var node = ast.getUserTypes().get(0).getNode();
        assertEquals(List.of("# about json", "# second line"), node.getComments());
        List<CommentBlock> scope = node.getScopeComments();
        assertEquals(1, scope.size());
        assertEquals("# file header", scope.get(0).getValue());
        assertEquals(1, scope.get(0).getLoc().getLine());

        assertEquals(1, ast.getComments().size());
        assertEquals("# dangling at end", ast.getComments().get(0).getValue());
        assertEquals(6, ast.getComments().get(0).getLoc().getLine());
    }

    @Test
    void identifiersAreInterned() throws Exception {
        Ast ast =
                new MroAstBuilder()
                        .parse(
                                "test.mro",
                                "stage S(\n    in json input,\n    out json result,\n    src py \"s\",\n)\n"
                                        + "stage T(\n    in json input,\n    src py \"t\",\n)\n");
        Stage s = ast.getStages().get(0);
        Stage t = ast.getStages().get(1);
        assertSame(s.getInParams().get(0).getId(), t.getInParams().get(0).getId());
        assertSame(s.getInParams().get(0).getTname(), s.getOutParams().get(0).getTname());
    }

    @Test
    void syntaxErrorReportsExpectedAndFound() {
        MroParseException error =
                assertThrows(
                        MroParseException.class,
                        () -> new MroAstBuilder().parse("broken.mro", "filetype json;\nstage S(\n    in int x\n)\n"));
        assertEquals(4, error.getLine());
        assertEquals("broken.mro", error.getSourceFilename());
        assertEquals(")", error.getFound());
        assertNotNull(error.getExpected());
        assertTrue(error.getMessage().startsWith("broken.mro:4: "), error.getMessage());
    }

    @Test
    void lexicalErrorReportsLine() {
        MroLexException error =
                assertThrows(
                        MroLexException.class,
                        () -> new MroAstBuilder().parse("bad.mro", "filetype json;\n\nfiletype $x;\n"));
        assertEquals(3, error.getLine());
    }

    @Test
    void duplicateParameterIsRejected() {
        DuplicateIdentifierException error =
                assertThrows(
                        DuplicateIdentifierException.class,
                        () ->
                                new MroAstBuilder()
                                        .parse("dup.mro", "stage S(\n    in int x,\n    in int x,\n    src py \"s\",\n)\n"));
        assertEquals("x", error.getIdentifier());
        assertEquals(3, error.getLine());
    }

    @Test
    void duplicateCallableIsRejected() {
        String source = "stage S(\n    src py \"s\",\n)\nstage S(\n    src py \"t\",\n)\n";
        DuplicateIdentifierException error =
                assertThrows(DuplicateIdentifierException.class, () -> new MroAstBuilder().parse("dup.mro", source));
        assertEquals("S", error.getIdentifier());
        assertEquals(4, error.getLine());
    }

    @Test
    void duplicateBindingIsRejected() {
        assertThrows(
                DuplicateIdentifierException.class,
                () -> new MroAstBuilder().parse("dup.mro", "call P(\n    a = 1,\n    a = 2,\n)\n"));
    }

    @Test
    void duplicateMapKeyIsRejected() {
        assertThrows(
                DuplicateIdentifierException.class,
                () -> new MroAstBuilder().parse("dup.mro", "call P(\n    a = {\"k\": 1, \"k\": 2},\n)\n"));
    }

    @Test
    void repeatedResourceFieldIsRejected() {
        String source = "stage S(\n    src py \"s\",\n) using (\n    mem_gb = 1,\n    mem_gb = 2,\n)\n";
        MroParseException error =
                assertThrows(MroParseException.class, () -> new MroAstBuilder().parse("res.mro", source));
        assertEquals(5, error.getLine());
    }

    @Test
    void floatOverflowIsRejected() {
        MroParseException error =
                assertThrows(
                        MroParseException.class,
                        () -> new MroAstBuilder().parse("big.mro", "call P(\n    x = 1e999,\n)\n"));
        assertEquals(2, error.getLine());
        assertEquals("1e999", error.getFound());
    }

    @Test
    void commentsInFrontOfClosingTokensMoveToTheNextNode() throws Exception {
        String source =
                String.join(
                        "\n",
                        "stage S(",
                        "    src py \"s\",",
                        "    # about the chunk",
                        ") split (",
                        "    in int c,",
                        "    # before using",
                        ") using (",
                        "    threads = 2,",
                        ")",
                        "call S(",
                        "    # before close",
                        ") using (",
                        "    local = true,",
                        ")",
                        "");
        Ast ast = new MroAstBuilder().parse("test.mro", source);

        Stage stage = ast.getStages().get(0);
        assertEquals(List.of("# about the chunk"), stage.getChunkIns().get(0).getNode().getComments());
        assertEquals(List.of("# before using"), stage.getResources().getNode().getComments());
        CallStm call = ast.getCall();
        assertEquals(List.of("# before close"), call.getModifiers().getBindings().getNode().getComments());
        assertTrue(ast.getComments().isEmpty());
    }
}
