package com.martian.mro.loader.semantic;

import com.martian.mro.loader.DuplicateIdentifierException;
import com.martian.mro.loader.MroException;
import com.martian.mro.loader.UnresolvedReferenceException;
import com.martian.mro.loader.ast.Ast;
import com.martian.mro.loader.ast.AstNode;
import com.martian.mro.loader.ast.BindStm;
import com.martian.mro.loader.ast.BindStms;
import com.martian.mro.loader.ast.CallStm;
import com.martian.mro.loader.ast.Callable;
import com.martian.mro.loader.ast.Exp;
import com.martian.mro.loader.ast.Param;
import com.martian.mro.loader.ast.Pipeline;
import com.martian.mro.loader.ast.RefExp;
import com.martian.mro.loader.ast.ValExp;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the names used inside pipelines against a loaded unit.
 *
 * <p>Fills each pipeline's nested callables table and rejects references to unknown callables,
 * calls, call outputs and pipeline inputs.
 */
public final class SemanticAnalyzer {

    public void check(Ast ast) throws MroException {
        Objects.requireNonNull(ast, "ast");
        for (Pipeline pipeline : ast.getPipelines()) {
            checkPipeline(ast, pipeline);
        }
        CallStm call = ast.getCall();
        if (call != null) {
            Callable target = resolveCallable(ast, call);
            checkArguments(call, target);
            for (BindStm binding : call.getBindings().getList()) {
                if (containsReference(binding.getExp())) {
                    throw unresolved("top-level call arguments must be literal values", binding.getNode());
                }
            }
        }
    }

    private void checkPipeline(Ast ast, Pipeline pipeline) throws MroException {
        Map<String, Callable> calls = new HashMap<>();
        for (CallStm call : pipeline.getCalls()) {
            Callable target = resolveCallable(ast, call);
            if (calls.putIfAbsent(call.getId(), target) != null) {
                throw new DuplicateIdentifierException(
                        "call", call.getId(), fileOf(call.getNode()), call.getNode().getLoc().getLine());
            }
            pipeline.getCallables().add(target);
        }
        for (CallStm call : pipeline.getCalls()) {
            checkArguments(call, calls.get(call.getId()));
            checkReferences(pipeline, calls, call.getBindings());
            if (call.getModifiers().getBindings() != null) {
                checkReferences(pipeline, calls, call.getModifiers().getBindings());
            }
        }
        checkReferences(pipeline, calls, pipeline.getRet().getBindings());
        for (BindStm binding : pipeline.getRet().getBindings().getList()) {
            if (!hasParam(pipeline.getOutParams(), binding.getId())) {
                throw unresolved(
                        "pipeline " + pipeline.getId() + " has no output '" + binding.getId() + "'",
                        binding.getNode());
            }
        }
        if (pipeline.getRetain() != null) {
            for (RefExp ref : pipeline.getRetain().getRefs()) {
                checkReference(pipeline, calls, ref);
            }
        }
    }

    private Callable resolveCallable(Ast ast, CallStm call) throws UnresolvedReferenceException {
        Callable target = ast.getCallables().get(call.getDecId());
        if (target == null) {
            throw unresolved("'" + call.getDecId() + "' is not a declared stage or pipeline", call.getNode());
        }
        return target;
    }

    private void checkArguments(CallStm call, Callable target) throws UnresolvedReferenceException {
        for (BindStm binding : call.getBindings().getList()) {
            if (!hasParam(target.getInParams(), binding.getId())) {
                throw unresolved(
                        target.getId() + " has no input '" + binding.getId() + "'", binding.getNode());
            }
        }
    }

    private void checkReferences(Pipeline pipeline, Map<String, Callable> calls, BindStms bindings)
            throws UnresolvedReferenceException {
        for (BindStm binding : bindings.getList()) {
            checkExp(pipeline, calls, binding.getExp());
        }
    }

    private void checkExp(Pipeline pipeline, Map<String, Callable> calls, Exp exp)
            throws UnresolvedReferenceException {
        if (exp instanceof RefExp ref) {
            checkReference(pipeline, calls, ref);
        } else if (exp instanceof ValExp val) {
            if (val.getKind() == ValExp.Kind.ARRAY) {
                for (Exp element : val.asArray()) {
                    checkExp(pipeline, calls, element);
                }
            } else if (val.getKind() == ValExp.Kind.MAP) {
                for (Exp element : val.asMap().values()) {
                    checkExp(pipeline, calls, element);
                }
            }
        }
    }

    private void checkReference(Pipeline pipeline, Map<String, Callable> calls, RefExp ref)
            throws UnresolvedReferenceException {
        switch (ref.getKind()) {
            case SELF -> {
                if (!hasParam(pipeline.getInParams(), ref.getId())) {
                    throw unresolved(
                            "pipeline " + pipeline.getId() + " has no input '" + ref.getId() + "'", ref.getNode());
                }
            }
            case CALL -> {
                Callable target = calls.get(ref.getId());
                if (target == null) {
                    throw unresolved(
                            "pipeline " + pipeline.getId() + " has no call named '" + ref.getId() + "'",
                            ref.getNode());
                }
                if (!Param.DEFAULT_ID.equals(ref.getOutputId()) && !hasParam(target.getOutParams(), ref.getOutputId())) {
                    throw unresolved(
                            target.getId() + " has no output '" + ref.getOutputId() + "'", ref.getNode());
                }
            }
        }
    }

    private static boolean hasParam(List<? extends Param> params, String id) {
        for (Param param : params) {
            if (param.getId().equals(id)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsReference(Exp exp) {
        if (exp instanceof RefExp) {
            return true;
        }
        ValExp val = (ValExp) exp;
        if (val.getKind() == ValExp.Kind.ARRAY) {
            return val.asArray().stream().anyMatch(SemanticAnalyzer::containsReference);
        }
        if (val.getKind() == ValExp.Kind.MAP) {
            return val.asMap().values().stream().anyMatch(SemanticAnalyzer::containsReference);
        }
        return false;
    }

    private static UnresolvedReferenceException unresolved(String detail, AstNode node) {
        return new UnresolvedReferenceException(detail, fileOf(node), node.getLoc().getLine());
    }

    private static String fileOf(AstNode node) {
        return node.getLoc().getFile().getFileName();
    }
}
