package com.martian.mro.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.martian.mro.loader.ast.Ast;
import com.martian.mro.loader.ast.Pipeline;
import com.martian.mro.loader.semantic.SemanticAnalyzer;
import org.junit.jupiter.api.Test;

class SemanticAnalyzerTest {

    private static final String STAGES =
            String.join(
                    "\n",
                    "stage PRODUCE(",
                    "    in  int  seed,",
                    "    out json result,",
                    "    src py   \"produce\",",
                    ")",
                    "",
                    "stage CONSUME(",
                    "    in  json input,",
                    "    out json result,",
                    "    src py   \"consume\",",
                    ")",
                    "");

    @Test
    void resolvesCallsAndFillsCallableTable() throws Exception {
        Ast ast =
                parse(
                        STAGES
                                + "pipeline RUN(\n    in int seed,\n    out json result,\n)\n{\n"
                                + "    call PRODUCE(seed = self.seed,)\n"
                                + "    call CONSUME(input = PRODUCE.result,)\n"
                                + "    return (result = CONSUME.result,)\n"
                                + "    retain (PRODUCE,)\n}\n"
                                + "call RUN(seed = 1,)\n");

        new SemanticAnalyzer().check(ast);

        Pipeline pipeline = ast.getPipelines().get(0);
        assertEquals(2, pipeline.getCallables().size());
        assertEquals("PRODUCE", pipeline.getCallables().get("PRODUCE").getId());
    }

    @Test
    void unknownCallableIsReported() throws Exception {
        Ast ast = parse(STAGES + "pipeline RUN(\n)\n{\n    call MISSING()\n    return ()\n}\n");
        UnresolvedReferenceException error =
                assertThrows(UnresolvedReferenceException.class, () -> new SemanticAnalyzer().check(ast));
        assertEquals(15, error.getLine());
        assertTrue(error.getMessage().contains("MISSING"), error.getMessage());
    }

    @Test
    void unknownSelfInputIsReported() throws Exception {
        Ast ast = parse(STAGES + "pipeline RUN(\n)\n{\n    call PRODUCE(seed = self.nope,)\n    return ()\n}\n");
        UnresolvedReferenceException error =
                assertThrows(UnresolvedReferenceException.class, () -> new SemanticAnalyzer().check(ast));
        assertTrue(error.getMessage().contains("nope"), error.getMessage());
    }

    @Test
    void unknownOutputIsReported() throws Exception {
        Ast ast =
                parse(
                        STAGES
                                + "pipeline RUN(\n)\n{\n    call PRODUCE(seed = 1,)\n"
                                + "    call CONSUME(input = [PRODUCE.missing],)\n    return ()\n}\n");
        UnresolvedReferenceException error =
                assertThrows(UnresolvedReferenceException.class, () -> new SemanticAnalyzer().check(ast));
        assertTrue(error.getMessage().contains("missing"), error.getMessage());
    }

    @Test
    void unknownArgumentIsReported() throws Exception {
        Ast ast = parse(STAGES + "call PRODUCE(bogus = 1,)\n");
        assertThrows(UnresolvedReferenceException.class, () -> new SemanticAnalyzer().check(ast));
    }

    @Test
    void topLevelCallRejectsReferences() throws Exception {
        Ast ast = parse(STAGES + "call CONSUME(input = PRODUCE.result,)\n");
        assertThrows(UnresolvedReferenceException.class, () -> new SemanticAnalyzer().check(ast));
    }

    private static Ast parse(String source) throws MroException {
        return new MroAstBuilder().parse("semantic.mro", source);
    }
}
