package com.martian.mro.loader;

import com.martian.mro.loader.ast.Ast;
import com.martian.mro.loader.ast.AstNode;
import com.martian.mro.loader.ast.BindStm;
import com.martian.mro.loader.ast.BindStms;
import com.martian.mro.loader.ast.CallStm;
import com.martian.mro.loader.ast.Callable;
import com.martian.mro.loader.ast.Exp;
import com.martian.mro.loader.ast.InParam;
import com.martian.mro.loader.ast.Include;
import com.martian.mro.loader.ast.Modifiers;
import com.martian.mro.loader.ast.OutParam;
import com.martian.mro.loader.ast.Param;
import com.martian.mro.loader.ast.Pipeline;
import com.martian.mro.loader.ast.PipelineRetains;
import com.martian.mro.loader.ast.RefExp;
import com.martian.mro.loader.ast.Resources;
import com.martian.mro.loader.ast.RetainParams;
import com.martian.mro.loader.ast.ReturnStm;
import com.martian.mro.loader.ast.SourceFile;
import com.martian.mro.loader.ast.SrcParam;
import com.martian.mro.loader.ast.Stage;
import com.martian.mro.loader.ast.UserType;
import com.martian.mro.loader.ast.ValExp;
import com.martian.mro.loader.grammar.MroBaseVisitor;
import com.martian.mro.loader.grammar.MroLexer;
import com.martian.mro.loader.grammar.MroParser;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

/**
 * Parses one MRO file into an {@link Ast}. Include directives are recorded but not followed;
 * {@link MroLoader} resolves them.
 */
public final class MroAstBuilder {
    private static final Logger LOGGER = Logger.getLogger(MroAstBuilder.class.getName());

    public Ast parse(String fileName, String input) throws MroException {
        Objects.requireNonNull(fileName, "fileName");
        String fullPath = Path.of(fileName).toAbsolutePath().normalize().toString();
        return parse(new SourceFile(fileName, fullPath), input, new StringInterner());
    }

    public Ast parse(SourceFile file, String input, StringInterner interner) throws MroException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(interner, "interner");
        CharStream stream = CharStreams.fromString(input, file.getFileName());

        MroLexer lexer = new MroLexer(stream);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        try {
            tokens.fill();
            if (DebugFlags.isTokenDebugEnabled()) {
                DebugFlags.logTokens(file.getFileName(), tokens, lexer);
            }

            MroParser parser = new MroParser(tokens);
            parser.removeErrorListeners();
            if (DebugFlags.isParserTraceEnabled()) {
                DebugFlags.drainCapturedDiagnostics();
                // Ahead of the throwing listener, which ends the parse at the first error.
                parser.addErrorListener(DebugFlags.parserTraceListener());
            }
            parser.addErrorListener(ThrowingErrorListener.INSTANCE);

            MroParser.MroFileContext context = parser.mroFile();
            AstBuildingVisitor visitor =
                    new AstBuildingVisitor(file, new CommentCollector(file, tokens), interner);
            Ast ast = visitor.build(context);
            LOGGER.log(
                    Level.FINE,
                    "Parsed {0}: {1} callables, {2} includes",
                    new Object[] {file.getFileName(), ast.getCallables().size(), ast.getIncludes().size()});
            return ast;
        } catch (ThrowingErrorListener.SyntaxCancellation ex) {
            if (ex.isLexical()) {
                throw new MroLexException(ex.getMessage(), file.getFileName(), ex.getLine(), ex);
            }
            throw new MroParseException(
                    withDiagnostics(ex.getMessage()),
                    file.getFileName(),
                    ex.getLine(),
                    ex.getExpected(),
                    ex.getFound(),
                    ex);
        } catch (BuildFailure ex) {
            throw ex.failure;
        }
    }

    private static String withDiagnostics(String message) {
        if (!DebugFlags.isParserTraceEnabled()) {
            return message;
        }
        List<String> diagnostics = DebugFlags.drainCapturedDiagnostics();
        if (diagnostics.isEmpty()) {
            return message;
        }
        StringBuilder builder = new StringBuilder(message).append("\nDiagnostics:\n");
        int start = Math.max(0, diagnostics.size() - 10);
        for (int i = start; i < diagnostics.size(); i++) {
            builder.append("  ").append(diagnostics.get(i)).append('\n');
        }
        return builder.toString().trim();
    }

    /** Unchecked carrier for semantic failures raised from inside the visitor. */
    private static final class BuildFailure extends RuntimeException {
        private final MroException failure;

        BuildFailure(MroException failure) {
            super(failure.getMessage(), failure, false, false);
            this.failure = failure;
        }
    }

    private static final class AstBuildingVisitor extends MroBaseVisitor<Void> {
        private final SourceFile file;
        private final CommentCollector comments;
        private final StringInterner interner;
        private final ExpBuildingVisitor expressions = new ExpBuildingVisitor();
        private final Ast ast = new Ast();

        AstBuildingVisitor(SourceFile file, CommentCollector comments, StringInterner interner) {
            this.file = file;
            this.comments = comments;
            this.interner = interner;
        }

        Ast build(MroParser.MroFileContext context) {
            ast.addFile(file);
            visitMroFile(context);
            ast.addComments(comments.unclaimed());
            return ast;
        }

        @Override
        public Void visitMroFile(MroParser.MroFileContext ctx) {
            for (MroParser.IncludeDirectiveContext include : ctx.includeDirective()) {
                visit(include);
            }
            for (MroParser.DecContext dec : ctx.dec()) {
                visit(dec);
            }
            if (ctx.callStm() != null) {
                ast.setCall(buildCall(ctx.callStm()));
            }
            return null;
        }

        @Override
        public Void visitIncludeDirective(MroParser.IncludeDirectiveContext ctx) {
            AstNode node = comments.claim(ctx.INCLUDE().getSymbol());
            ast.addInclude(new Include(node, unquote(ctx.STRING().getText())));
            return null;
        }

        @Override
        public Void visitFileTypeDec(MroParser.FileTypeDecContext ctx) {
            AstNode node = comments.claim(ctx.FILETYPE().getSymbol());
            ast.addUserType(new UserType(node, typeName(ctx.typeId())));
            return null;
        }

        @Override
        public Void visitStageDec(MroParser.StageDecContext ctx) {
            AstNode node = comments.claim(ctx.STAGE().getSymbol());
            List<InParam> inParams = buildInParams(ctx.inParam());
            List<OutParam> outParams = buildOutParams(ctx.outParam());
            SrcParam src = buildSrc(ctx.srcParam());

            boolean split = false;
            List<InParam> chunkIns = List.of();
            List<OutParam> chunkOuts = List.of();
            MroParser.SplitClauseContext splitClause = ctx.splitClause();
            if (splitClause != null) {
                split = true;
                chunkIns = buildInParams(splitClause.inParam());
                chunkOuts = buildOutParams(splitClause.outParam());
            }
            Resources resources = null;
            if (ctx.resourcesClause() != null) {
                resources = buildResources(ctx.resourcesClause());
            }
            RetainParams retain = null;
            if (ctx.retainClause() != null) {
                retain = buildRetain(ctx.retainClause());
            }

            addCallable(
                    new Stage(
                            node,
                            identifier(ctx.id()),
                            inParams,
                            outParams,
                            src,
                            split,
                            chunkIns,
                            chunkOuts,
                            resources,
                            retain));
            return null;
        }

        @Override
        public Void visitPipelineDec(MroParser.PipelineDecContext ctx) {
            AstNode node = comments.claim(ctx.PIPELINE().getSymbol());
            List<InParam> inParams = buildInParams(ctx.inParam());
            List<OutParam> outParams = buildOutParams(ctx.outParam());

            List<CallStm> calls = new ArrayList<>();
            Set<String> callIds = new HashSet<>();
            for (MroParser.CallStmContext callContext : ctx.callStm()) {
                CallStm call = buildCall(callContext);
                if (!callIds.add(call.getId())) {
                    throw duplicate("call", call.getId(), call.getNode());
                }
                calls.add(call);
            }

            MroParser.ReturnStmContext returnContext = ctx.returnStm();
            AstNode returnNode = comments.claim(returnContext.RETURN().getSymbol());
            BindStms returnBindings = buildBindings(returnContext.LPAREN().getSymbol(), returnContext.bindStm());
            ReturnStm ret = new ReturnStm(returnNode, returnBindings);

            PipelineRetains retain = null;
            if (ctx.pipelineRetain() != null) {
                MroParser.PipelineRetainContext retainContext = ctx.pipelineRetain();
                AstNode retainNode = comments.claim(retainContext.RETAIN().getSymbol());
                List<RefExp> refs = new ArrayList<>();
                for (MroParser.RetainRefContext ref : retainContext.retainRef()) {
                    refs.add(buildRef(ref.refExp(), comments.locate(ref.getStart())));
                }
                retain = new PipelineRetains(retainNode, refs);
            }

            addCallable(new Pipeline(node, identifier(ctx.id()), inParams, outParams, calls, ret, retain));
            return null;
        }

        private void addCallable(Callable callable) {
            if (ast.getCallables().add(callable) != null) {
                throw duplicate("callable", callable.getId(), callable.getNode());
            }
        }

        private List<InParam> buildInParams(List<MroParser.InParamContext> contexts) {
            List<InParam> params = new ArrayList<>(contexts.size());
            for (MroParser.InParamContext ctx : contexts) {
                AstNode node = comments.claim(ctx.IN().getSymbol());
                MroParser.TypeRefContext type = ctx.typeRef();
                params.add(
                        new InParam(
                                node,
                                typeName(type.typeId()),
                                type.arrayDim().size(),
                                ctx.id() == null ? null : identifier(ctx.id()),
                                ctx.help == null ? null : unquote(ctx.help.getText())));
            }
            checkParams(params);
            return params;
        }

        private List<OutParam> buildOutParams(List<MroParser.OutParamContext> contexts) {
            List<OutParam> params = new ArrayList<>(contexts.size());
            for (MroParser.OutParamContext ctx : contexts) {
                AstNode node = comments.claim(ctx.OUT().getSymbol());
                MroParser.TypeRefContext type = ctx.typeRef();
                params.add(
                        new OutParam(
                                node,
                                typeName(type.typeId()),
                                type.arrayDim().size(),
                                ctx.id() == null ? null : identifier(ctx.id()),
                                ctx.help == null ? null : unquote(ctx.help.getText()),
                                ctx.outName == null ? null : unquote(ctx.outName.getText())));
            }
            checkParams(params);
            return params;
        }

        private void checkParams(List<? extends Param> params) {
            Set<String> seen = new HashSet<>();
            for (Param param : params) {
                if (param.isDefault() && params.size() > 1) {
                    throw new BuildFailure(
                            new MroParseException(
                                    "unnamed " + param.getMode() + " parameter must be the only one in its list",
                                    file.getFileName(),
                                    param.getNode().getLoc().getLine(),
                                    "parameter name",
                                    param.getTname()));
                }
                if (!seen.add(param.getId())) {
                    throw duplicate("parameter", param.getId(), param.getNode());
                }
            }
        }

        private SrcParam buildSrc(MroParser.SrcParamContext ctx) {
            AstNode node = comments.claim(ctx.SRC().getSymbol());
            String command = unquote(ctx.STRING().getText()).trim();
            List<String> words = command.isEmpty() ? List.of("") : Arrays.asList(command.split("\\s+"));
            return new SrcParam(
                    node,
                    interner.intern(ctx.id().getText()),
                    words.get(0),
                    words.subList(1, words.size()));
        }

        private Resources buildResources(MroParser.ResourcesClauseContext ctx) {
            Resources resources = new Resources(comments.claim(ctx.RPAREN().getSymbol()));
            for (MroParser.ResourceFieldContext field : ctx.resourceField()) {
                AstNode node = comments.claim(field.getStart());
                if (field instanceof MroParser.MemGbFieldContext mem) {
                    requireUnset(resources.getMemNode(), "mem_gb", field);
                    resources.setMemGb(node, parseInt(mem.INT().getSymbol()));
                } else if (field instanceof MroParser.ThreadsFieldContext threads) {
                    requireUnset(resources.getThreadNode(), "threads", field);
                    resources.setThreads(node, parseInt(threads.INT().getSymbol()));
                } else if (field instanceof MroParser.SpecialFieldContext special) {
                    requireUnset(resources.getSpecialNode(), "special", field);
                    resources.setSpecial(node, unquote(special.STRING().getText()));
                } else if (field instanceof MroParser.VolatileFieldContext) {
                    requireUnset(resources.getVolatileNode(), "volatile", field);
                    resources.setStrictVolatile(node);
                }
            }
            return resources;
        }

        private void requireUnset(AstNode existing, String key, ParserRuleContext field) {
            if (existing != null) {
                throw new BuildFailure(
                        new MroParseException(
                                key + " is given more than once",
                                file.getFileName(),
                                field.getStart().getLine(),
                                "resource field or ')'",
                                key));
            }
        }

        private RetainParams buildRetain(MroParser.RetainClauseContext ctx) {
            AstNode node = comments.claim(ctx.RPAREN().getSymbol());
            List<RetainParams.RetainParam> params = new ArrayList<>();
            for (MroParser.RetainParamContext param : ctx.retainParam()) {
                params.add(
                        new RetainParams.RetainParam(comments.claim(param.getStart()), identifier(param.id())));
            }
            return new RetainParams(node, params);
        }

        private CallStm buildCall(MroParser.CallStmContext ctx) {
            AstNode node = comments.claim(ctx.CALL().getSymbol());
            boolean local = false;
            boolean preflight = false;
            boolean volatileFlag = false;
            for (MroParser.ModifierContext modifier : ctx.modifier()) {
                local |= modifier.LOCAL() != null;
                preflight |= modifier.PREFLIGHT() != null;
                volatileFlag |= modifier.VOLATILE() != null;
            }
            String decId = identifier(ctx.decId);
            String id = ctx.alias == null ? decId : identifier(ctx.alias);
            BindStms bindings = buildBindings(ctx.LPAREN().getSymbol(), ctx.bindStm());

            BindStms modifierBindings = null;
            if (ctx.modifierBindings() != null) {
                MroParser.ModifierBindingsContext using = ctx.modifierBindings();
                modifierBindings = new BindStms(comments.claim(using.LPAREN().getSymbol()));
                for (MroParser.ModifierBindingContext binding : using.modifierBinding()) {
                    AstNode bindingNode = comments.claim(binding.getStart());
                    BindStm bindStm =
                            new BindStm(
                                    bindingNode,
                                    interner.intern(binding.modifierKey().getText()),
                                    expressions.build(binding.exp(), true),
                                    false);
                    if (modifierBindings.add(bindStm) != null) {
                        throw duplicate("modifier", bindStm.getId(), bindingNode);
                    }
                }
            }
            return new CallStm(
                    node, id, decId, new Modifiers(local, preflight, volatileFlag, modifierBindings), bindings);
        }

        private BindStms buildBindings(Token open, List<MroParser.BindStmContext> contexts) {
            BindStms bindings = new BindStms(comments.claim(open));
            for (MroParser.BindStmContext ctx : contexts) {
                AstNode node = comments.claim(ctx.getStart());
                BindStm binding;
                if (ctx.bindValue() instanceof MroParser.SweepValueContext sweep) {
                    List<Exp> values = new ArrayList<>();
                    for (MroParser.ExpContext exp : sweep.exp()) {
                        values.add(expressions.build(exp, false));
                    }
                    ValExp alternatives = ValExp.ofArray(comments.claim(sweep.SWEEP().getSymbol()), values);
                    binding = new BindStm(node, identifier(ctx.id()), alternatives, true);
                } else {
                    MroParser.PlainValueContext plain = (MroParser.PlainValueContext) ctx.bindValue();
                    binding = new BindStm(node, identifier(ctx.id()), expressions.build(plain.exp(), true), false);
                }
                if (bindings.add(binding) != null) {
                    throw duplicate("binding", binding.getId(), node);
                }
            }
            return bindings;
        }

        private RefExp buildRef(MroParser.RefExpContext ctx, AstNode node) {
            if (ctx instanceof MroParser.SelfRefContext self) {
                return RefExp.self(node, identifier(self.id()));
            }
            MroParser.CallRefContext call = (MroParser.CallRefContext) ctx;
            String outputId = call.id().size() > 1 ? identifier(call.id(1)) : null;
            return RefExp.call(node, identifier(call.id(0)), outputId);
        }

        private String identifier(MroParser.IdContext ctx) {
            return interner.intern(ctx.getText());
        }

        private String typeName(MroParser.TypeIdContext ctx) {
            return interner.intern(ctx.getText());
        }

        private int parseInt(Token token) {
            try {
                return Integer.parseInt(token.getText());
            } catch (NumberFormatException ex) {
                throw new BuildFailure(
                        new MroParseException(
                                "integer out of range", file.getFileName(), token.getLine(), "integer", token.getText(), ex));
            }
        }

        private BuildFailure duplicate(String what, String id, AstNode node) {
            return new BuildFailure(
                    new DuplicateIdentifierException(what, id, file.getFileName(), node.getLoc().getLine()));
        }

        /**
         * Builds literal and reference expressions. Only the outermost expression of a binding
         * takes the comments in front of it; nested values are located without comments.
         */
        private final class ExpBuildingVisitor extends MroBaseVisitor<Exp> {
            private MroParser.ExpContext claimed;

            Exp build(MroParser.ExpContext ctx, boolean claimComments) {
                MroParser.ExpContext previous = claimed;
                claimed = claimComments ? ctx : null;
                try {
                    return visit(ctx);
                } finally {
                    claimed = previous;
                }
            }

            private AstNode nodeFor(MroParser.ExpContext ctx) {
                return ctx == claimed ? comments.claim(ctx.getStart()) : comments.locate(ctx.getStart());
            }

            @Override
            public Exp visitArrayExp(MroParser.ArrayExpContext ctx) {
                AstNode node = nodeFor(ctx);
                List<Exp> values = new ArrayList<>();
                for (MroParser.ExpContext value : ctx.exp()) {
                    values.add(visit(value));
                }
                return ValExp.ofArray(node, values);
            }

            @Override
            public Exp visitMapExp(MroParser.MapExpContext ctx) {
                AstNode node = nodeFor(ctx);
                Map<String, Exp> values = new LinkedHashMap<>();
                for (MroParser.MapEntryContext entry : ctx.mapEntry()) {
                    String key = unquote(entry.STRING().getText());
                    if (values.putIfAbsent(key, visit(entry.exp())) != null) {
                        throw duplicate("map key", key, comments.locate(entry.getStart()));
                    }
                }
                return ValExp.ofMap(node, values);
            }

            @Override
            public Exp visitIntExp(MroParser.IntExpContext ctx) {
                Token token = ctx.INT().getSymbol();
                try {
                    return ValExp.ofInt(nodeFor(ctx), Long.parseLong(token.getText()));
                } catch (NumberFormatException ex) {
                    throw new BuildFailure(
                            new MroParseException(
                                    "integer out of range",
                                    file.getFileName(),
                                    token.getLine(),
                                    "integer",
                                    token.getText(),
                                    ex));
                }
            }

            @Override
            public Exp visitFloatExp(MroParser.FloatExpContext ctx) {
                Token token = ctx.FLOAT().getSymbol();
                double value = Double.parseDouble(token.getText());
                if (Double.isInfinite(value)) {
                    throw new BuildFailure(
                            new MroParseException(
                                    "float out of range",
                                    file.getFileName(),
                                    token.getLine(),
                                    "float",
                                    token.getText()));
                }
                return ValExp.ofFloat(nodeFor(ctx), value);
            }

            @Override
            public Exp visitStringExp(MroParser.StringExpContext ctx) {
                return ValExp.ofString(nodeFor(ctx), unquote(ctx.STRING().getText()));
            }

            @Override
            public Exp visitBoolExp(MroParser.BoolExpContext ctx) {
                return ValExp.ofBool(nodeFor(ctx), ctx.TRUE() != null);
            }

            @Override
            public Exp visitNullExp(MroParser.NullExpContext ctx) {
                return ValExp.ofNull(nodeFor(ctx));
            }

            @Override
            public Exp visitReferenceExp(MroParser.ReferenceExpContext ctx) {
                return buildRef(ctx.refExp(), nodeFor(ctx));
            }
        }
    }

    private static String unquote(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
