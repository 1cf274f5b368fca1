package com.martian.mro.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.martian.mro.loader.MroAstBuilder;
import com.martian.mro.loader.ast.Ast;
import java.util.List;
import org.junit.jupiter.api.Test;

class AstJsonExporterTest {

    private static final String SOURCE =
            String.join(
                    "\n",
                    "filetype json;",
                    "",
                    "# Sums things.",
                    "stage SUM(",
                    "    in  int[] values,",
                    "    out int   sum,",
                    "    src py    \"stages/sum\",",
                    ") using (",
                    "    mem_gb = 2,",
                    ")",
                    "",
                    "pipeline TOTAL(",
                    "    in  int[] values,",
                    "    out int   total,",
                    ")",
                    "{",
                    "    call SUM(",
                    "        values = self.values,",
                    "    )",
                    "",
                    "    return (",
                    "        total = SUM.sum,",
                    "    )",
                    "}",
                    "");

    @Test
    void exportsDeclarationsKeyedById() throws Exception {
        Ast ast = new MroAstBuilder().parse("sum.mro", SOURCE);
        JsonObject root = JsonParser.parseString(new AstJsonExporter().dump(List.of(ast))).getAsJsonObject();

        assertTrue(root.getAsJsonObject("UserTypes").has("json"));

        JsonObject stage = root.getAsJsonObject("Stages").getAsJsonObject("SUM");
        assertEquals("SUM", stage.get("Id").getAsString());
        JsonObject node = stage.getAsJsonObject("Node");
        assertEquals(4, node.getAsJsonObject("Loc").get("line").getAsInt());
        assertEquals("sum.mro", node.getAsJsonObject("Loc").get("file").getAsString());
        assertEquals("# Sums things.", node.getAsJsonArray("Comments").get(0).getAsString());

        JsonObject values = stage.getAsJsonArray("InParams").get(0).getAsJsonObject();
        assertEquals("int", values.get("Tname").getAsString());
        assertEquals(1, values.get("ArrayDim").getAsInt());
        assertEquals("stages/sum", stage.getAsJsonObject("Src").get("Path").getAsString());
        assertEquals(2, stage.getAsJsonObject("Resources").get("MemGB").getAsInt());
        assertFalse(stage.getAsJsonObject("Resources").has("Threads"));
        assertTrue(stage.get("Retain").isJsonNull());

        JsonObject pipeline = root.getAsJsonObject("Pipelines").getAsJsonObject("TOTAL");
        JsonArray calls = pipeline.getAsJsonArray("Calls");
        JsonObject binding =
                calls.get(0).getAsJsonObject().getAsJsonObject("Bindings").getAsJsonArray("List").get(0).getAsJsonObject();
        assertEquals("values", binding.get("Id").getAsString());
        assertEquals("self", binding.getAsJsonObject("Exp").get("Kind").getAsString());
        JsonObject ret =
                pipeline.getAsJsonObject("Ret").getAsJsonObject("Bindings").getAsJsonArray("List").get(0).getAsJsonObject();
        assertEquals("sum", ret.getAsJsonObject("Exp").get("OutputId").getAsString());
    }

    @Test
    void laterUnitsReplaceEarlierDeclarations() throws Exception {
        MroAstBuilder builder = new MroAstBuilder();
        Ast first = builder.parse("a.mro", "stage S(\n    src py \"first\",\n)\n");
        Ast second = builder.parse("b.mro", "stage S(\n    src py \"second\",\n)\n");

        JsonObject root =
                JsonParser.parseString(new AstJsonExporter().dump(List.of(first, second))).getAsJsonObject();

        JsonObject stages = root.getAsJsonObject("Stages");
        assertEquals(1, stages.size());
        assertEquals("second", stages.getAsJsonObject("S").getAsJsonObject("Src").get("Path").getAsString());
    }

    @Test
    void outputIsIndentedWithFourSpaces() throws Exception {
        Ast ast = new MroAstBuilder().parse("t.mro", "filetype txt;\n");
        String json = new AstJsonExporter().dump(List.of(ast));
        assertTrue(json.startsWith("{\n    \"UserTypes\": {\n        \"txt\": {"), json);
    }
}
