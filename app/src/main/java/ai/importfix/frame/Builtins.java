package ai.importfix.frame;

import ai.importfix.value.Arguments;
import ai.importfix.value.ConcreteValue;
import ai.importfix.value.FuzzyBoolean;
import ai.importfix.value.Literals;
import ai.importfix.value.NativeValue;
import ai.importfix.value.NativeValue.NativeFunction;
import ai.importfix.value.Operators;
import ai.importfix.value.PyConstant;
import ai.importfix.value.PyDict;
import ai.importfix.value.PySequence;
import ai.importfix.value.UnknownValue;
import ai.importfix.value.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** The interpreter's builtin namespace. */
public final class Builtins {

    public static final Set<String> TYPES = Set.of(
            "bool", "bytearray", "bytes", "classmethod", "complex", "dict", "enumerate", "filter", "float",
            "frozenset", "int", "list", "map", "memoryview", "object", "property", "range", "reversed", "set",
            "slice", "staticmethod", "str", "super", "tuple", "type", "zip");

    public static final Set<String> FUNCTIONS = Set.of(
            "abs", "aiter", "all", "anext", "any", "ascii", "bin", "breakpoint", "callable", "chr", "compile",
            "copyright", "credits", "delattr", "dir", "divmod", "eval", "exec", "exit", "format", "getattr",
            "globals", "hasattr", "hash", "help", "hex", "id", "input", "isinstance", "issubclass", "iter", "len",
            "license", "locals", "max", "min", "next", "oct", "open", "ord", "pow", "print", "quit", "repr",
            "round", "setattr", "sorted", "sum", "vars", "__import__", "__build_class__");

    public static final Set<String> EXCEPTIONS = Set.of(
            "ArithmeticError", "AssertionError", "AttributeError", "BaseException", "BaseExceptionGroup",
            "BlockingIOError", "BrokenPipeError", "BufferError", "BytesWarning", "ChildProcessError",
            "ConnectionAbortedError", "ConnectionError", "ConnectionRefusedError", "ConnectionResetError",
            "DeprecationWarning", "EOFError", "EncodingWarning", "EnvironmentError", "Exception", "ExceptionGroup",
            "FileExistsError", "FileNotFoundError", "FloatingPointError", "FutureWarning", "GeneratorExit",
            "IOError", "ImportError", "ImportWarning", "IndentationError", "IndexError", "InterruptedError",
            "IsADirectoryError", "KeyError", "KeyboardInterrupt", "LookupError", "MemoryError",
            "ModuleNotFoundError", "NameError", "NotADirectoryError", "NotImplementedError", "OSError",
            "OverflowError", "PendingDeprecationWarning", "PermissionError", "ProcessLookupError",
            "RecursionError", "ReferenceError", "ResourceWarning", "RuntimeError", "RuntimeWarning",
            "StopAsyncIteration", "StopIteration", "SyntaxError", "SyntaxWarning", "SystemError", "SystemExit",
            "TabError", "TimeoutError", "TypeError", "UnboundLocalError", "UnicodeDecodeError",
            "UnicodeEncodeError", "UnicodeError", "UnicodeTranslateError", "UnicodeWarning", "UserWarning",
            "ValueError", "Warning", "ZeroDivisionError");

    public static final Set<String> CONSTANTS = Set.of("None", "True", "False", "Ellipsis", "NotImplemented",
            "__debug__");

    /** Names every module has without defining them. */
    public static final Set<String> MODULE_DUNDERS = Set.of(
            "__name__", "__file__", "__doc__", "__package__", "__spec__", "__loader__", "__path__", "__builtins__",
            "__cached__", "__annotations__", "__dict__", "__all__");

    private static final Set<String> ALL_NAMES = allNames();

    private Builtins() {}

    private static Set<String> allNames() {
        var names = new TreeSet<String>();
        names.addAll(TYPES);
        names.addAll(FUNCTIONS);
        names.addAll(EXCEPTIONS);
        names.addAll(CONSTANTS);
        return Collections.unmodifiableSet(names);
    }

    public static Set<String> names() {
        return ALL_NAMES;
    }

    public static boolean isBuiltin(String name) {
        return ALL_NAMES.contains(name);
    }

    /** A fresh builtin namespace; callers may share it between frames of one session. */
    public static Map<String, Value> createNamespace() {
        var ns = new LinkedHashMap<String, Value>();
        for (var name : ALL_NAMES) {
            ns.put(name, new NativeValue(name, modelFor(name)));
        }
        ns.put("None", ConcreteValue.none());
        ns.put("True", ConcreteValue.ofBoolean(true));
        ns.put("False", ConcreteValue.ofBoolean(false));
        ns.put("Ellipsis", ConcreteValue.of(PyConstant.ELLIPSIS));
        ns.put("NotImplemented", ConcreteValue.of(PyConstant.NOT_IMPLEMENTED));
        ns.put("__debug__", ConcreteValue.ofBoolean(true));
        return ns;
    }

    private static NativeFunction modelFor(String name) {
        return switch (name) {
            case "len" -> Builtins::len;
            case "isinstance", "issubclass", "hasattr", "callable" ->
                (args, caller) -> Operators.fromFuzzyBoolean(FuzzyBoolean.MAYBE);
            case "print", "setattr", "delattr", "exec", "breakpoint" -> (args, caller) -> ConcreteValue.none();
            case "str" -> Builtins::str;
            case "int" -> Builtins::toInt;
            case "bool" -> (args, caller) -> args.positional().isEmpty()
                    ? ConcreteValue.ofBoolean(false)
                    : Operators.fromFuzzyBoolean(args.positional().get(0).boolValue());
            case "list" -> (args, caller) -> copySequence(args, PySequence.Kind.LIST);
            case "tuple" -> (args, caller) -> copySequence(args, PySequence.Kind.TUPLE);
            case "set", "frozenset" -> (args, caller) -> copySequence(args, PySequence.Kind.SET);
            case "dict" -> (args, caller) -> dict(args);
            default -> (args, caller) -> new UnknownValue(name + "()");
        };
    }

    private static Value len(Arguments args, Frame caller) {
        if (args.positional().size() == 1 && args.positional().get(0) instanceof ConcreteValue c) {
            if (c.underlying() instanceof String s) {
                return ConcreteValue.of((long) s.codePointCount(0, s.length()));
            }
            if (c.underlying() instanceof PySequence seq && seq.kind() != PySequence.Kind.SET) {
                return ConcreteValue.of((long) seq.elements().size());
            }
        }
        return new UnknownValue("len()");
    }

    private static Value str(Arguments args, Frame caller) {
        if (args.positional().isEmpty()) {
            return ConcreteValue.of("");
        }
        if (args.positional().get(0) instanceof ConcreteValue c && c.isLiteral()) {
            var u = c.underlying();
            return ConcreteValue.of(u instanceof String s ? s : Literals.repr(u));
        }
        return new UnknownValue("str()");
    }

    private static Value toInt(Arguments args, Frame caller) {
        if (args.positional().isEmpty()) {
            return ConcreteValue.of(0L);
        }
        if (args.positional().size() == 1 && args.positional().get(0) instanceof ConcreteValue c) {
            var u = c.underlying();
            if (u instanceof Long || u instanceof Boolean) {
                return ConcreteValue.of(Literals.asLong(u));
            }
            if (u instanceof Double d && !d.isNaN() && !d.isInfinite()) {
                return ConcreteValue.of(d.longValue());
            }
            if (u instanceof String s) {
                try {
                    return ConcreteValue.of(Long.parseLong(s.trim().replace("_", "")));
                } catch (NumberFormatException e) {
                    return new UnknownValue("int(" + c.describe() + ")");
                }
            }
        }
        return new UnknownValue("int()");
    }

    private static Value copySequence(Arguments args, PySequence.Kind kind) {
        if (args.positional().isEmpty()) {
            return ConcreteValue.of(new PySequence(kind, List.of()));
        }
        if (args.positional().get(0) instanceof ConcreteValue c && c.underlying() instanceof PySequence seq) {
            return ConcreteValue.of(new PySequence(kind, new ArrayList<>(seq.elements())));
        }
        return new UnknownValue(kind.name().toLowerCase(Locale.ROOT) + "()");
    }

    private static Value dict(Arguments args) {
        var dict = new PyDict();
        for (var e : args.keywords().entrySet()) {
            dict.put(ConcreteValue.of(e.getKey()), e.getValue());
        }
        if (!args.positional().isEmpty() || args.openEnded()) {
            dict.markOpenEnded();
        }
        return ConcreteValue.of(dict);
    }
}
