package ai.importfix.cfg;

import ai.importfix.frame.Frame;
import ai.importfix.value.FuzzyValue;
import ai.importfix.value.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/** Joins the local bindings of alternative control-flow paths. */
final class Branches {

    private Branches() {}

    /**
     * Replaces the frame's locals with the join of {@code outcomes}. A name bound to the same value on every path
     * keeps it; otherwise it becomes a fuzzy value over the distinct values of the paths that bind it.
     */
    static void merge(Frame frame, List<Map<String, Value>> outcomes) {
        if (outcomes.size() == 1) {
            frame.restoreLocals(outcomes.get(0));
            return;
        }
        var names = new LinkedHashSet<String>();
        outcomes.forEach(o -> names.addAll(o.keySet()));
        int maxMembers = frame.registry().config().maxFuzzyMembers();
        var merged = new LinkedHashMap<String, Value>();
        for (var name : names) {
            var values = new ArrayList<Value>();
            for (var outcome : outcomes) {
                var v = outcome.get(name);
                if (v != null) {
                    values.add(v);
                }
            }
            merged.put(name, FuzzyValue.of(values, name, maxMembers));
        }
        frame.restoreLocals(merged);
    }
}
