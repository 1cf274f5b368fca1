package com.martian.mro.loader.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** One compilation unit, possibly merged from several included files. */
public final class Ast {
    private final List<Include> includes = new ArrayList<>();
    private final List<UserType> userTypes = new ArrayList<>();
    private final Callables callables = new Callables();
    private CallStm call;
    private final Map<String, SourceFile> files = new LinkedHashMap<>();
    private final List<CommentBlock> comments = new ArrayList<>();

    public List<Include> getIncludes() {
        return Collections.unmodifiableList(includes);
    }

    public void addInclude(Include include) {
        includes.add(Objects.requireNonNull(include, "include"));
    }

    public List<UserType> getUserTypes() {
        return Collections.unmodifiableList(userTypes);
    }

    public void addUserType(UserType userType) {
        userTypes.add(Objects.requireNonNull(userType, "userType"));
    }

    public Callables getCallables() {
        return callables;
    }

    public List<Stage> getStages() {
        List<Stage> stages = new ArrayList<>();
        for (Callable callable : callables.getList()) {
            if (callable instanceof Stage stage) {
                stages.add(stage);
            }
        }
        return stages;
    }

    public List<Pipeline> getPipelines() {
        List<Pipeline> pipelines = new ArrayList<>();
        for (Callable callable : callables.getList()) {
            if (callable instanceof Pipeline pipeline) {
                pipelines.add(pipeline);
            }
        }
        return pipelines;
    }

    /** Returns the top-level call, or {@code null} if the unit has none. */
    public CallStm getCall() {
        return call;
    }

    public void setCall(CallStm call) {
        this.call = call;
    }

    /** Files touched by this unit, keyed by full path, the top-level file first. */
    public Map<String, SourceFile> getFiles() {
        return Collections.unmodifiableMap(files);
    }

    public void addFile(SourceFile file) {
        files.putIfAbsent(file.getFullPath(), file);
    }

    /** Comments that no node claimed, in file order. */
    public List<CommentBlock> getComments() {
        return Collections.unmodifiableList(comments);
    }

    public void addComments(List<CommentBlock> blocks) {
        comments.addAll(blocks);
    }
}
