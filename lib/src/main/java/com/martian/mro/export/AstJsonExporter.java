package com.martian.mro.export;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.stream.JsonWriter;
import com.martian.mro.loader.ast.Ast;
import com.martian.mro.loader.ast.AstNode;
import com.martian.mro.loader.ast.BindStm;
import com.martian.mro.loader.ast.BindStms;
import com.martian.mro.loader.ast.CallStm;
import com.martian.mro.loader.ast.CommentBlock;
import com.martian.mro.loader.ast.Exp;
import com.martian.mro.loader.ast.Modifiers;
import com.martian.mro.loader.ast.OutParam;
import com.martian.mro.loader.ast.Param;
import com.martian.mro.loader.ast.Pipeline;
import com.martian.mro.loader.ast.PipelineRetains;
import com.martian.mro.loader.ast.RefExp;
import com.martian.mro.loader.ast.Resources;
import com.martian.mro.loader.ast.RetainParams;
import com.martian.mro.loader.ast.SourceLoc;
import com.martian.mro.loader.ast.SrcParam;
import com.martian.mro.loader.ast.Stage;
import com.martian.mro.loader.ast.UserType;
import com.martian.mro.loader.ast.ValExp;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Dumps the declarations of one or more parsed units as a JSON object with {@code UserTypes},
 * {@code Stages} and {@code Pipelines}, each keyed by id. A declaration in a later unit replaces
 * one with the same id from an earlier unit.
 */
public final class AstJsonExporter {
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    public String dump(List<Ast> asts) {
        JsonObject userTypes = new JsonObject();
        JsonObject stages = new JsonObject();
        JsonObject pipelines = new JsonObject();
        for (Ast ast : asts) {
            for (UserType userType : ast.getUserTypes()) {
                userTypes.add(userType.getId(), userType(userType));
            }
            for (Stage stage : ast.getStages()) {
                stages.add(stage.getId(), stage(stage));
            }
            for (Pipeline pipeline : ast.getPipelines()) {
                pipelines.add(pipeline.getId(), pipeline(pipeline));
            }
        }
        JsonObject root = new JsonObject();
        root.add("UserTypes", userTypes);
        root.add("Stages", stages);
        root.add("Pipelines", pipelines);

        StringWriter out = new StringWriter();
        try (JsonWriter writer = new JsonWriter(out)) {
            writer.setIndent("    ");
            gson.toJson(root, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    private static JsonObject node(AstNode node) {
        JsonObject json = new JsonObject();
        json.add("Loc", loc(node.getLoc()));
        JsonArray comments = new JsonArray();
        node.getComments().forEach(comments::add);
        json.add("Comments", comments);
        JsonArray scopeComments = new JsonArray();
        for (CommentBlock block : node.getScopeComments()) {
            JsonObject comment = new JsonObject();
            comment.add("Loc", loc(block.getLoc()));
            comment.addProperty("Value", block.getValue());
            scopeComments.add(comment);
        }
        json.add("ScopeComments", scopeComments);
        return json;
    }

    private static JsonObject loc(SourceLoc loc) {
        JsonObject json = new JsonObject();
        json.addProperty("line", loc.getLine());
        json.addProperty("file", loc.getFile().getFileName());
        return json;
    }

    private static JsonObject userType(UserType userType) {
        JsonObject json = new JsonObject();
        json.add("Node", node(userType.getNode()));
        json.addProperty("Id", userType.getId());
        return json;
    }

    private static JsonArray params(List<? extends Param> params) {
        JsonArray array = new JsonArray();
        for (Param param : params) {
            JsonObject json = new JsonObject();
            json.add("Node", node(param.getNode()));
            json.addProperty("Mode", param.getMode());
            json.addProperty("Tname", param.getTname());
            json.addProperty("ArrayDim", param.getArrayDim());
            json.addProperty("Id", param.getId());
            json.addProperty("Help", param.getHelp());
            if (param instanceof OutParam) {
                json.addProperty("OutName", param.getOutName());
            }
            array.add(json);
        }
        return array;
    }

    private static JsonObject stage(Stage stage) {
        JsonObject json = new JsonObject();
        json.add("Node", node(stage.getNode()));
        json.addProperty("Id", stage.getId());
        json.add("InParams", params(stage.getInParams()));
        json.add("OutParams", params(stage.getOutParams()));
        json.add("Src", src(stage.getSrc()));
        json.add("ChunkIns", params(stage.getChunkIns()));
        json.add("ChunkOuts", params(stage.getChunkOuts()));
        json.addProperty("Split", stage.isSplit());
        json.add("Resources", stage.getResources() == null ? JsonNull.INSTANCE : resources(stage.getResources()));
        json.add("Retain", stage.getRetain() == null ? JsonNull.INSTANCE : retain(stage.getRetain()));
        return json;
    }

    private static JsonObject src(SrcParam src) {
        JsonObject json = new JsonObject();
        json.add("Node", node(src.getNode()));
        json.addProperty("Lang", src.getLang());
        json.addProperty("Path", src.getPath());
        JsonArray args = new JsonArray();
        src.getArgs().forEach(args::add);
        json.add("Args", args);
        return json;
    }

    private static JsonObject resources(Resources resources) {
        JsonObject json = new JsonObject();
        json.add("Node", node(resources.getNode()));
        if (resources.getMemNode() != null) {
            json.addProperty("MemGB", resources.getMemGb());
        }
        if (resources.getSpecialNode() != null) {
            json.addProperty("Special", resources.getSpecial());
        }
        if (resources.getThreadNode() != null) {
            json.addProperty("Threads", resources.getThreads());
        }
        json.addProperty("StrictVolatile", resources.isStrictVolatile());
        return json;
    }

    private static JsonObject retain(RetainParams retain) {
        JsonObject json = new JsonObject();
        json.add("Node", node(retain.getNode()));
        JsonArray params = new JsonArray();
        for (RetainParams.RetainParam param : retain.getParams()) {
            JsonObject entry = new JsonObject();
            entry.add("Node", node(param.node()));
            entry.addProperty("Id", param.id());
            params.add(entry);
        }
        json.add("Params", params);
        return json;
    }

    private static JsonObject pipeline(Pipeline pipeline) {
        JsonObject json = new JsonObject();
        json.add("Node", node(pipeline.getNode()));
        json.addProperty("Id", pipeline.getId());
        json.add("InParams", params(pipeline.getInParams()));
        json.add("OutParams", params(pipeline.getOutParams()));
        JsonArray calls = new JsonArray();
        for (CallStm call : pipeline.getCalls()) {
            calls.add(call(call));
        }
        json.add("Calls", calls);
        JsonObject ret = new JsonObject();
        ret.add("Node", node(pipeline.getRet().getNode()));
        ret.add("Bindings", bindings(pipeline.getRet().getBindings()));
        json.add("Ret", ret);
        json.add("Retain", pipeline.getRetain() == null ? JsonNull.INSTANCE : pipelineRetain(pipeline.getRetain()));
        return json;
    }

    private static JsonObject call(CallStm call) {
        JsonObject json = new JsonObject();
        json.add("Node", node(call.getNode()));
        json.addProperty("Id", call.getId());
        json.addProperty("DecId", call.getDecId());
        Modifiers modifiers = call.getModifiers();
        JsonObject mods = new JsonObject();
        mods.addProperty("Local", modifiers.isLocal());
        mods.addProperty("Preflight", modifiers.isPreflight());
        mods.addProperty("Volatile", modifiers.isVolatile());
        mods.add("Bindings", modifiers.getBindings() == null ? JsonNull.INSTANCE : bindings(modifiers.getBindings()));
        json.add("Modifiers", mods);
        json.add("Bindings", bindings(call.getBindings()));
        return json;
    }

    private static JsonObject pipelineRetain(PipelineRetains retain) {
        JsonObject json = new JsonObject();
        json.add("Node", node(retain.getNode()));
        JsonArray refs = new JsonArray();
        for (RefExp ref : retain.getRefs()) {
            refs.add(exp(ref));
        }
        json.add("Refs", refs);
        return json;
    }

    private static JsonObject bindings(BindStms bindings) {
        JsonObject json = new JsonObject();
        json.add("Node", node(bindings.getNode()));
        JsonArray list = new JsonArray();
        for (BindStm binding : bindings.getList()) {
            JsonObject entry = new JsonObject();
            entry.add("Node", node(binding.getNode()));
            entry.addProperty("Id", binding.getId());
            entry.add("Exp", exp(binding.getExp()));
            entry.addProperty("Sweep", binding.isSweep());
            list.add(entry);
        }
        json.add("List", list);
        return json;
    }

    private static JsonElement exp(Exp exp) {
        JsonObject json = new JsonObject();
        json.add("Node", node(exp.getNode()));
        if (exp instanceof RefExp ref) {
            json.addProperty("Kind", ref.getKind() == RefExp.Kind.CALL ? "call" : "self");
            json.addProperty("Id", ref.getId());
            if (ref.getOutputId() != null) {
                json.addProperty("OutputId", ref.getOutputId());
            }
            return json;
        }
        ValExp val = (ValExp) exp;
        json.addProperty("Kind", val.getKind().name().toLowerCase(Locale.ROOT));
        json.add("Value", value(val));
        return json;
    }

    private static JsonElement value(ValExp val) {
        switch (val.getKind()) {
            case INT:
                return new JsonPrimitive(val.asInt());
            case FLOAT:
                return new JsonPrimitive(val.asFloat());
            case STRING:
                return new JsonPrimitive(val.asString());
            case BOOL:
                return new JsonPrimitive(val.asBool());
            case ARRAY:
                JsonArray array = new JsonArray();
                for (Exp element : val.asArray()) {
                    array.add(exp(element));
                }
                return array;
            case MAP:
                JsonObject map = new JsonObject();
                for (Map.Entry<String, Exp> entry : val.asMap().entrySet()) {
                    map.add(entry.getKey(), exp(entry.getValue()));
                }
                return map;
            default:
                return JsonNull.INSTANCE;
        }
    }
}
