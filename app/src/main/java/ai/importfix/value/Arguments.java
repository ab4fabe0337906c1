package ai.importfix.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluated call arguments. {@code openEnded} is set when a {@code *args} or {@code **kwargs} splat could not be
 * expanded, so parameters left unbound may still receive a value at runtime.
 */
public record Arguments(List<Value> positional, Map<String, Value> keywords, boolean openEnded) {

    public static final Arguments NONE = new Arguments(List.of(), Map.of(), false);

    public Arguments {
        positional = List.copyOf(positional);
        keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public static Arguments of(Value... positional) {
        return new Arguments(List.of(positional), Map.of(), false);
    }

    public Arguments prepend(Value self) {
        var args = new ArrayList<Value>(positional.size() + 1);
        args.add(self);
        args.addAll(positional);
        return new Arguments(args, keywords, openEnded);
    }
}
