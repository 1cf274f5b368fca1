package com.martian.mro.format;

import com.martian.mro.loader.ast.BindStm;
import com.martian.mro.loader.ast.BindStms;
import com.martian.mro.loader.ast.CallStm;
import com.martian.mro.loader.ast.Exp;
import com.martian.mro.loader.ast.RefExp;
import com.martian.mro.loader.ast.ValExp;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Orders the calls of a pipeline so that every call follows the calls whose outputs it binds.
 * Among calls that are ready at the same time, source order wins.
 */
final class CallOrder {

    private CallOrder() {}

    static List<CallStm> sort(List<CallStm> calls) {
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < calls.size(); i++) {
            indexById.putIfAbsent(calls.get(i).getId(), i);
        }
        int[] pending = new int[calls.size()];
        List<List<Integer>> dependents = new ArrayList<>();
        for (int i = 0; i < calls.size(); i++) {
            dependents.add(new ArrayList<>());
        }
        for (int i = 0; i < calls.size(); i++) {
            for (String dependency : referencedCalls(calls.get(i))) {
                Integer j = indexById.get(dependency);
                if (j != null && j != i) {
                    dependents.get(j).add(i);
                    pending[i]++;
                }
            }
        }
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < calls.size(); i++) {
            if (pending[i] == 0) {
                ready.add(i);
            }
        }
        List<CallStm> sorted = new ArrayList<>(calls.size());
        while (!ready.isEmpty()) {
            int next = ready.poll();
            sorted.add(calls.get(next));
            for (int dependent : dependents.get(next)) {
                if (--pending[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (sorted.size() != calls.size()) {
            throw new IllegalStateException("cyclic dependency between calls");
        }
        return sorted;
    }

    private static Set<String> referencedCalls(CallStm call) {
        Set<String> ids = new LinkedHashSet<>();
        collect(call.getBindings(), ids);
        collect(call.getModifiers().getBindings(), ids);
        return ids;
    }

    private static void collect(BindStms bindings, Set<String> ids) {
        if (bindings == null) {
            return;
        }
        for (BindStm binding : bindings.getList()) {
            collect(binding.getExp(), ids);
        }
    }

    private static void collect(Exp exp, Set<String> ids) {
        if (exp instanceof RefExp ref) {
            if (ref.getKind() == RefExp.Kind.CALL) {
                ids.add(ref.getId());
            }
        } else if (exp instanceof ValExp val) {
            if (val.getKind() == ValExp.Kind.ARRAY) {
                for (Exp element : val.asArray()) {
                    collect(element, ids);
                }
            } else if (val.getKind() == ValExp.Kind.MAP) {
                for (Exp element : val.asMap().values()) {
                    collect(element, ids);
                }
            }
        }
    }
}
