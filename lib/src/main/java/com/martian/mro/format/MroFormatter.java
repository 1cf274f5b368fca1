package com.martian.mro.format;

import com.martian.mro.loader.ast.Ast;
import com.martian.mro.loader.ast.AstNode;
import com.martian.mro.loader.ast.BindStm;
import com.martian.mro.loader.ast.BindStms;
import com.martian.mro.loader.ast.CallStm;
import com.martian.mro.loader.ast.Callable;
import com.martian.mro.loader.ast.Include;
import com.martian.mro.loader.ast.Modifiers;
import com.martian.mro.loader.ast.Param;
import com.martian.mro.loader.ast.Pipeline;
import com.martian.mro.loader.ast.PipelineRetains;
import com.martian.mro.loader.ast.RefExp;
import com.martian.mro.loader.ast.Resources;
import com.martian.mro.loader.ast.RetainParams;
import com.martian.mro.loader.ast.ReturnStm;
import com.martian.mro.loader.ast.SrcParam;
import com.martian.mro.loader.ast.Stage;
import com.martian.mro.loader.ast.UserType;
import com.martian.mro.loader.ast.ValExp;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Renders an {@link Ast} as canonical MRO source. Formatting is idempotent: the output parses
 * back to an equivalent tree and formats to the same text.
 */
public final class MroFormatter {
    public static final String INDENT = "    ";
    public static final String NEWLINE = "\n";

    private static final int MAX_ALIGNED_ID = 35;
    private static final int MAX_ALIGNED_HELP = 25;
    private static final int MAX_ALIGNED_BINDING = 30;

    /** Column widths shared by the parameter lines of one declaration. */
    private record Widths(int mode, int type, int id, int help) {
        Widths withMinMode(int min) {
            return new Widths(Math.max(mode, min), type, id, help);
        }
    }

    public String format(Ast ast, boolean writeIncludes) {
        Printer printer = new Printer(ast);
        boolean needSpacer = false;
        if (writeIncludes) {
            for (Include include : ast.getIncludes()) {
                printer.printComments(include.getNode(), "");
                printer.append("@include \"").append(include.getValue()).append("\"\n");
                needSpacer = true;
            }
        }
        if (needSpacer && !ast.getUserTypes().isEmpty()) {
            printer.append(NEWLINE);
        }
        for (UserType userType : ast.getUserTypes()) {
            printer.printComments(userType.getNode(), "");
            printer.append("filetype ").append(userType.getId()).append(";\n");
            needSpacer = true;
        }
        List<Callable> callables = ast.getCallables().getList();
        if (needSpacer && !callables.isEmpty()) {
            printer.append(NEWLINE);
        }
        for (int i = 0; i < callables.size(); i++) {
            if (i > 0) {
                printer.append(NEWLINE);
            }
            Callable callable = callables.get(i);
            if (callable instanceof Stage stage) {
                formatStage(printer, stage);
            } else {
                formatPipeline(printer, (Pipeline) callable);
            }
        }
        if (ast.getCall() != null) {
            if (needSpacer || !callables.isEmpty()) {
                printer.append(NEWLINE);
            }
            formatCall(printer, ast.getCall(), "");
        }
        printer.dumpComments();
        return printer.toString();
    }

    private void formatStage(Printer printer, Stage stage) {
        printer.printComments(stage.getNode(), "");
        Widths widths = measure(stage.getInParams(), stage.getOutParams(), stage.getChunkIns(), stage.getChunkOuts())
                .withMinMode(3);
        printer.append("stage ").append(stage.getId()).append("(\n");
        formatParams(printer, stage.getInParams(), widths);
        formatParams(printer, stage.getOutParams(), widths);
        formatSrc(printer, stage.getSrc(), widths);
        if (widths.id() > MAX_ALIGNED_ID - 5 || widths.help() > MAX_ALIGNED_HELP - 5) {
            Widths chunks = measure(stage.getChunkIns(), stage.getChunkOuts());
            widths = new Widths(widths.mode(), widths.type(), chunks.id(), chunks.help());
        }
        if (stage.isSplit()) {
            printer.append(") split (\n");
            formatParams(printer, stage.getChunkIns(), widths);
            formatParams(printer, stage.getChunkOuts(), widths);
        }
        if (stage.getResources() != null) {
            formatResources(printer, stage.getResources());
        }
        if (stage.getRetain() != null) {
            formatRetain(printer, stage.getRetain());
        }
        printer.append(")\n");
    }

    private void formatPipeline(Printer printer, Pipeline pipeline) {
        printer.printComments(pipeline.getNode(), "");
        Widths widths = measure(pipeline.getInParams(), pipeline.getOutParams());
        printer.append("pipeline ").append(pipeline.getId()).append("(\n");
        formatParams(printer, pipeline.getInParams(), widths);
        formatParams(printer, pipeline.getOutParams(), widths);
        printer.append(")\n{");
        for (CallStm call : CallOrder.sort(pipeline.getCalls())) {
            printer.append(NEWLINE);
            formatCall(printer, call, INDENT);
        }
        printer.append(NEWLINE);
        formatReturn(printer, pipeline.getRet());
        if (pipeline.getRetain() != null) {
            printer.append(NEWLINE);
            formatPipelineRetain(printer, pipeline.getRetain());
        }
        printer.append("}\n");
    }

    @SafeVarargs
    private static Widths measure(List<? extends Param>... lists) {
        int mode = 0;
        int type = 0;
        int id = 0;
        int help = 0;
        for (List<? extends Param> params : lists) {
            for (Param param : params) {
                mode = Math.max(mode, param.getMode().length());
                type = Math.max(type, typeWidth(param));
                if (param.getId().length() < MAX_ALIGNED_ID) {
                    id = Math.max(id, param.getId().length());
                }
                if (param.getHelp().length() < MAX_ALIGNED_HELP) {
                    help = Math.max(help, param.getHelp().length());
                }
            }
        }
        return new Widths(mode, type, id, help);
    }

    private static int typeWidth(Param param) {
        return param.getTname().length() + 2 * param.getArrayDim();
    }

    private static void formatParams(Printer printer, List<? extends Param> params, Widths widths) {
        for (Param param : params) {
            formatParam(printer, param, widths);
        }
    }

    private static void formatParam(Printer printer, Param param, Widths widths) {
        printer.printComments(param.getNode(), INDENT);
        String id = param.isDefault() ? "" : param.getId();
        String help = param.getHelp();
        String outName = param.getOutName();
        String typePad = pad(widths.type() - typeWidth(param));
        String idPad = pad(widths.id() - id.length());
        String helpPad = pad(widths.help() - help.length());

        printer.append(INDENT).append(param.getMode()).append(pad(widths.mode() - param.getMode().length()));
        printer.append(' ').append(param.getTname());
        for (int i = 0; i < param.getArrayDim(); i++) {
            printer.append("[]");
        }
        if (!id.isEmpty()) {
            printer.append(typePad).append(' ').append(id);
        }
        // An output name can only follow a help string, so an empty help is kept as "".
        if (!help.isEmpty() || !outName.isEmpty()) {
            if (id.isEmpty()) {
                printer.append(typePad).append(' ');
            }
            printer.append(idPad).append("  \"").append(help).append('"');
        }
        if (!outName.isEmpty()) {
            printer.append(helpPad).append("  \"").append(outName).append('"');
        }
        printer.append(",\n");
    }

    private static void formatSrc(Printer printer, SrcParam src, Widths widths) {
        printer.printComments(src.getNode(), INDENT);
        printer.append(INDENT).append("src").append(pad(widths.mode() - 3));
        printer.append(' ').append(src.getLang()).append(pad(widths.type() - src.getLang().length()));
        printer.append(" \"").append(src.getPath());
        for (String arg : src.getArgs()) {
            printer.append(' ').append(arg);
        }
        printer.append("\",\n");
    }

    private static void formatResources(Printer printer, Resources resources) {
        printer.printComments(resources.getNode(), INDENT);
        printer.append(") using (\n");
        String memPad = "";
        String threadPad = "";
        if (resources.isStrictVolatile()) {
            memPad = "  ";
            threadPad = " ";
        } else if (resources.getSpecialNode() != null || resources.getThreadNode() != null) {
            memPad = " ";
        }
        if (resources.getMemNode() != null) {
            printer.printComments(resources.getMemNode(), INDENT);
            printer.append(INDENT).append("mem_gb").append(memPad).append(" = ")
                    .append(Integer.toString(resources.getMemGb())).append(",\n");
        }
        if (resources.getSpecialNode() != null) {
            printer.printComments(resources.getSpecialNode(), INDENT);
            printer.append(INDENT).append("special").append(threadPad).append(" = \"")
                    .append(resources.getSpecial()).append("\",\n");
        }
        if (resources.getThreadNode() != null) {
            printer.printComments(resources.getThreadNode(), INDENT);
            printer.append(INDENT).append("threads").append(threadPad).append(" = ")
                    .append(Integer.toString(resources.getThreads())).append(",\n");
        }
        if (resources.getVolatileNode() != null) {
            printer.printComments(resources.getVolatileNode(), INDENT);
            printer.append(INDENT).append("volatile = strict,\n");
        }
    }

    private static void formatRetain(Printer printer, RetainParams retain) {
        printer.printComments(retain.getNode(), INDENT);
        printer.append(") retain (\n");
        for (RetainParams.RetainParam param : retain.getParams()) {
            printer.printComments(param.node(), INDENT);
            printer.append(INDENT).append(param.id()).append(",\n");
        }
    }

    private static void formatCall(Printer printer, CallStm call, String prefix) {
        printer.printComments(call.getNode(), prefix);
        printer.append(prefix).append("call ").append(call.getDecId());
        if (!call.getId().equals(call.getDecId())) {
            printer.append(" as ").append(call.getId());
        }
        printer.append("(\n");
        printer.printComments(call.getBindings().getNode(), prefix + INDENT);
        formatBindings(printer, call.getBindings().getList(), prefix);
        Modifiers modifiers = call.getModifiers();
        if (!modifiers.isEmpty()) {
            BindStms bound = modifiers.getBindings();
            if (bound != null) {
                printer.printComments(bound.getNode(), prefix + INDENT);
            }
            printer.append(prefix).append(") using (\n");
            formatBindings(printer, modifierBindings(call), prefix);
        }
        printer.append(prefix).append(")\n");
    }

    /** Bare modifier keywords folded into the bound form, sorted by key. The call is left untouched. */
    static List<BindStm> modifierBindings(CallStm call) {
        Modifiers modifiers = call.getModifiers();
        List<BindStm> bindings = new ArrayList<>();
        if (modifiers.getBindings() != null) {
            bindings.addAll(modifiers.getBindings().getList());
        }
        addFlag(bindings, call, Modifiers.LOCAL, modifiers.isLocal());
        addFlag(bindings, call, Modifiers.PREFLIGHT, modifiers.isPreflight());
        addFlag(bindings, call, Modifiers.VOLATILE, modifiers.isVolatile());
        bindings.sort(Comparator.comparing(BindStm::getId));
        return bindings;
    }

    private static void addFlag(List<BindStm> bindings, CallStm call, String key, boolean set) {
        if (!set) {
            return;
        }
        for (BindStm binding : bindings) {
            if (binding.getId().equals(key)) {
                return;
            }
        }
        AstNode node = new AstNode(call.getNode().getLoc());
        bindings.add(new BindStm(node, key, ValExp.ofBool(new AstNode(node.getLoc()), true), false));
    }

    private static void formatBindings(Printer printer, List<BindStm> bindings, String prefix) {
        int idWidth = 0;
        for (BindStm binding : bindings) {
            if (binding.getId().length() < MAX_ALIGNED_BINDING) {
                idWidth = Math.max(idWidth, binding.getId().length());
            }
        }
        for (BindStm binding : bindings) {
            formatBinding(printer, binding, prefix, idWidth);
        }
    }

    private static void formatBinding(Printer printer, BindStm binding, String prefix, int idWidth) {
        String indent = prefix + INDENT;
        printer.printComments(binding.getNode(), indent);
        printer.printComments(binding.getExp().getNode(), indent);
        printer.append(indent).append(binding.getId()).append(pad(idWidth - binding.getId().length()))
                .append(" = ");
        if (binding.isSweep()
                && binding.getExp() instanceof ValExp values
                && values.getKind() == ValExp.Kind.ARRAY
                && values.asArray().size() > 1) {
            ExpFormatter.formatSweep(values.asArray(), printer.out(), indent);
        } else {
            ExpFormatter.format(binding.getExp(), printer.out(), indent);
        }
        printer.append(",\n");
    }

    private static void formatReturn(Printer printer, ReturnStm ret) {
        printer.printComments(ret.getNode(), INDENT);
        printer.append(INDENT).append("return (\n");
        printer.printComments(ret.getBindings().getNode(), INDENT + INDENT);
        formatBindings(printer, ret.getBindings().getList(), INDENT);
        printer.append(INDENT).append(")\n");
    }

    private static void formatPipelineRetain(Printer printer, PipelineRetains retain) {
        printer.printComments(retain.getNode(), INDENT);
        printer.append(INDENT).append("retain (\n");
        for (RefExp ref : retain.getRefs()) {
            printer.append(INDENT).append(INDENT);
            ExpFormatter.formatRef(ref, printer.out());
            printer.append(",\n");
        }
        printer.append(INDENT).append(")\n");
    }

    private static String pad(int width) {
        return width > 0 ? " ".repeat(width) : "";
    }
}
