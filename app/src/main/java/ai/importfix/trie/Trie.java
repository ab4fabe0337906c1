package ai.importfix.trie;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/**
 * Compressed prefix tree mapping strings to comparable values, tracking the highest value beneath every node so the
 * best completion of a prefix can be found by following a single chain of links.
 *
 * <p>Nodes hold whole runs of characters ({@code remainder}) where the tree would otherwise be a single chain, which
 * keeps file-path keys compact. Splitting a run inserts a new parent above the existing node, so a {@link Node}
 * returned by {@link #add} keeps representing the same key after later insertions.
 *
 * <p>A value equal to the trie's default value means "absent".
 *
 * @param <V> stored value
 * @param <S> optional opaque payload attached to a node
 */
public final class Trie<V extends Comparable<? super V>, S> {

    static final char NO_CHAR = '\0';

    private final V defaultValue;
    private final Node<V, S> root;

    public Trie(V defaultValue) {
        this.defaultValue = Objects.requireNonNull(defaultValue);
        this.root = new Node<>("", defaultValue);
    }

    /** A node in the trie. Handles stay valid for the key they were returned for. */
    public static final class Node<V extends Comparable<? super V>, S> {
        final TreeMap<Character, Node<V, S>> children = new TreeMap<>();
        String remainder;
        V value;
        V highest;
        char highestChar = NO_CHAR;

        @Nullable
        S storeValue;

        Node(String remainder, V value) {
            this.remainder = remainder;
            this.value = value;
            this.highest = value;
        }

        public V value() {
            return value;
        }

        /** Highest value at this node or anywhere beneath it. */
        public V highestValueAtOrBeneath() {
            return highest;
        }

        public char highestChildChar() {
            return highestChar;
        }

        public String remainder() {
            return remainder;
        }

        public @Nullable S storeValue() {
            return storeValue;
        }

        public void setStoreValue(@Nullable S storeValue) {
            this.storeValue = storeValue;
        }

        public Map<Character, Node<V, S>> children() {
            return Collections.unmodifiableMap(children);
        }

        /** Recomputes {@code highest} and {@code highestChar} from this node's value and direct children. */
        void refresh() {
            V best = value;
            char bestChar = NO_CHAR;
            for (var e : children.entrySet()) {
                var childHighest = e.getValue().highest;
                if (childHighest.compareTo(best) > 0) {
                    best = childHighest;
                    bestChar = e.getKey();
                }
            }
            highest = best;
            highestChar = bestChar;
        }

        @Override
        public String toString() {
            return "Trie.Node[" + remainder + "=" + value + ", highest=" + highest + "]";
        }
    }

    /** One step of a root-to-node walk: the edge character and the node it leads to. */
    public record PathEntry<V extends Comparable<? super V>, S>(char ch, Node<V, S> node) {}

    public V defaultValue() {
        return defaultValue;
    }

    public Node<V, S> root() {
        return root;
    }

    public Node<V, S> add(String key, V value) {
        return add(key, value, null);
    }

    /**
     * Inserts or updates {@code key}. A non-null {@code storeValue} replaces the node's payload.
     *
     * @return the node representing exactly {@code key}
     */
    public Node<V, S> add(String key, V value, @Nullable S storeValue) {
        var path = new ArrayList<Node<V, S>>();
        path.add(root);
        var node = root;
        int i = 0;
        Node<V, S> target;
        while (true) {
            if (i == key.length()) {
                target = node;
                break;
            }
            char c = key.charAt(i);
            var child = node.children.get(c);
            if (child == null) {
                target = new Node<>(key.substring(i + 1), value);
                node.children.put(c, target);
                path.add(target);
                break;
            }
            var rem = child.remainder;
            int start = i + 1;
            int j = 0;
            while (j < rem.length() && start + j < key.length() && rem.charAt(j) == key.charAt(start + j)) {
                j++;
            }
            if (j == rem.length()) {
                node = child;
                i = start + j;
                path.add(child);
                continue;
            }
            // key diverges from, or ends inside, the child's remainder: split above the child
            var middle = new Node<V, S>(rem.substring(0, j), defaultValue);
            middle.children.put(rem.charAt(j), child);
            child.remainder = rem.substring(j + 1);
            node.children.put(c, middle);
            path.add(middle);
            if (start + j == key.length()) {
                target = middle;
            } else {
                target = new Node<>(key.substring(start + j + 1), value);
                middle.children.put(key.charAt(start + j), target);
                path.add(target);
            }
            break;
        }
        target.value = value;
        if (storeValue != null) {
            target.storeValue = storeValue;
        }
        refreshPath(path);
        return target;
    }

    private static <V extends Comparable<? super V>, S> void refreshPath(List<Node<V, S>> path) {
        for (int k = path.size() - 1; k >= 0; k--) {
            path.get(k).refresh();
        }
    }

    /**
     * Walks the nodes matching {@code prefix}. The prefix may end inside the last node's remainder, in which case that
     * node is the last entry. The root is not included.
     *
     * @return the walk, or null when no key starts with {@code prefix}
     */
    public @Nullable List<PathEntry<V, S>> getPathTo(String prefix) {
        var path = new ArrayList<PathEntry<V, S>>();
        var node = root;
        int i = 0;
        while (i < prefix.length()) {
            char c = prefix.charAt(i);
            var child = node.children.get(c);
            if (child == null) {
                return null;
            }
            path.add(new PathEntry<>(c, child));
            var rem = child.remainder;
            int start = i + 1;
            int n = Math.min(rem.length(), prefix.length() - start);
            if (!prefix.regionMatches(start, rem, 0, n)) {
                return null;
            }
            if (n < rem.length()) {
                return path;
            }
            node = child;
            i = start + n;
        }
        return path;
    }

    /** The node for exactly {@code key}, if that key has been inserted (or split out as a branch point). */
    public @Nullable Node<V, S> getNode(String key) {
        var node = root;
        int i = 0;
        while (i < key.length()) {
            var child = node.children.get(key.charAt(i));
            if (child == null) {
                return null;
            }
            var rem = child.remainder;
            if (!key.startsWith(rem, i + 1)) {
                return null;
            }
            node = child;
            i += 1 + rem.length();
        }
        return node;
    }

    /** Value stored for exactly {@code key}, or the default value. */
    public V getValue(String key) {
        var node = getNode(key);
        return node == null ? defaultValue : node.value;
    }

    public boolean contains(String key) {
        var node = getNode(key);
        return node != null && !isAbsent(node);
    }

    /** Highest value stored under {@code prefix}, or the default value. */
    public V getMaxValueAtOrBeneath(String prefix) {
        var path = getPathTo(prefix);
        if (path == null) {
            return defaultValue;
        }
        return path.isEmpty() ? root.highest : path.get(path.size() - 1).node().highest;
    }

    /**
     * Completion of {@code prefix} with the highest value, found by following highest-child links from the prefix's
     * node.
     *
     * @return the completed key, or null when nothing starts with {@code prefix}
     */
    public @Nullable String getMax(String prefix) {
        var path = getPathTo(prefix);
        if (path == null) {
            return null;
        }
        var sb = new StringBuilder();
        var node = root;
        for (var entry : path) {
            sb.append(entry.ch()).append(entry.node().remainder);
            node = entry.node();
        }
        while (node.highest.compareTo(node.value) > 0 && node.highestChar != NO_CHAR) {
            sb.append(node.highestChar);
            node = Objects.requireNonNull(node.children.get(node.highestChar));
            sb.append(node.remainder);
        }
        return sb.toString();
    }

    /**
     * Deepest node on the way to {@code key} that carries a store value, including the node for {@code key} itself.
     * Only nodes whose whole key is a prefix of {@code key} qualify.
     */
    public @Nullable Node<V, S> getDeepestStoreNode(String key) {
        Node<V, S> found = root.storeValue != null ? root : null;
        var node = root;
        int i = 0;
        while (i < key.length()) {
            var child = node.children.get(key.charAt(i));
            if (child == null || !key.startsWith(child.remainder, i + 1)) {
                break;
            }
            node = child;
            i += 1 + child.remainder.length();
            if (node.storeValue != null) {
                found = node;
            }
        }
        return found;
    }

    /**
     * Clears {@code key}'s value and payload and prunes nodes that no longer lead anywhere.
     *
     * @return true if the key was present
     */
    public boolean remove(String key) {
        var nodes = new ArrayList<Node<V, S>>();
        var chars = new ArrayList<Character>();
        nodes.add(root);
        var node = root;
        int i = 0;
        while (i < key.length()) {
            char c = key.charAt(i);
            var child = node.children.get(c);
            if (child == null || !key.startsWith(child.remainder, i + 1)) {
                return false;
            }
            nodes.add(child);
            chars.add(c);
            node = child;
            i += 1 + child.remainder.length();
        }
        boolean present = !isAbsent(node);
        node.value = defaultValue;
        node.storeValue = null;
        for (int k = nodes.size() - 1; k >= 1; k--) {
            var current = nodes.get(k);
            var parent = nodes.get(k - 1);
            char c = chars.get(k - 1);
            if (isAbsent(current) && current.children.isEmpty()) {
                parent.children.remove(c);
            } else if (isAbsent(current) && current.children.size() == 1) {
                // fold a pass-through node into its only child; the child keeps its identity
                var only = current.children.firstEntry();
                var child = only.getValue();
                child.remainder = current.remainder + only.getKey() + child.remainder;
                parent.children.put(c, child);
            }
        }
        for (int k = nodes.size() - 1; k >= 0; k--) {
            nodes.get(k).refresh();
        }
        return present;
    }

    private boolean isAbsent(Node<V, S> node) {
        return node.value.compareTo(defaultValue) == 0 && node.storeValue == null;
    }

    /** Visits every present key starting with {@code prefix}, in key order. */
    public void forEachWithPrefix(String prefix, BiConsumer<String, Node<V, S>> visitor) {
        var path = getPathTo(prefix);
        if (path == null) {
            return;
        }
        var key = new StringBuilder();
        var start = root;
        for (var entry : path) {
            key.append(entry.ch()).append(entry.node().remainder);
            start = entry.node();
        }
        record Pending<V extends Comparable<? super V>, S>(String key, Node<V, S> node) {}
        Deque<Pending<V, S>> stack = new ArrayDeque<>();
        stack.push(new Pending<>(key.toString(), start));
        while (!stack.isEmpty()) {
            var pending = stack.pop();
            if (!isAbsent(pending.node())) {
                visitor.accept(pending.key(), pending.node());
            }
            var descending = pending.node().children.descendingMap();
            for (var e : descending.entrySet()) {
                stack.push(new Pending<>(pending.key() + e.getKey() + e.getValue().remainder, e.getValue()));
            }
        }
    }

    /** Store values of {@code node} and every node beneath it. */
    public List<S> storeValuesAtOrBeneath(Node<V, S> node) {
        var out = new ArrayList<S>();
        Deque<Node<V, S>> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            var current = stack.pop();
            if (current.storeValue != null) {
                out.add(current.storeValue);
            }
            current.children.descendingMap().values().forEach(stack::push);
        }
        return out;
    }

    /** All present keys and their values, in key order. */
    public Map<String, V> toMap() {
        var out = new TreeMap<String, V>();
        forEachWithPrefix("", (k, n) -> out.put(k, n.value));
        return out;
    }

    /**
     * Copy containing only the subtrees whose highest value is at least {@code minValue}. Values below the threshold
     * are reset to the default; store values are not copied.
     */
    public Trie<V, S> copyWithLowerValuesPruned(V minValue) {
        var out = new Trie<V, S>(defaultValue);
        copyPruned(root, out.root, minValue);
        return out;
    }

    private void copyPruned(Node<V, S> from, Node<V, S> to, V minValue) {
        to.remainder = from.remainder;
        to.value = from.value.compareTo(minValue) >= 0 ? from.value : defaultValue;
        for (var e : from.children.entrySet()) {
            var child = e.getValue();
            if (child.highest.compareTo(minValue) >= 0) {
                var copy = new Node<V, S>(child.remainder, defaultValue);
                copyPruned(child, copy, minValue);
                to.children.put(e.getKey(), copy);
            }
        }
        to.refresh();
    }

    /* ================= Serialization ================= */

    /**
     * Converts the trie to nested lists, one {@code [remainder, value, children]} tuple per node, with trailing
     * default fields left out. Highest-value links are not written; they are re-derived on load.
     */
    public List<Object> toSerializable(Function<V, Object> valueEncoder) {
        return serializeNode(root, valueEncoder);
    }

    private List<Object> serializeNode(Node<V, S> node, Function<V, Object> valueEncoder) {
        var fields = new ArrayList<Object>(3);
        fields.add(node.remainder);
        fields.add(valueEncoder.apply(node.value));
        var children = new TreeMap<String, Object>();
        for (var e : node.children.entrySet()) {
            children.put(String.valueOf(e.getKey()), serializeNode(e.getValue(), valueEncoder));
        }
        fields.add(children);

        // trailing defaults are elided
        if (children.isEmpty()) {
            fields.remove(2);
            if (node.value.compareTo(defaultValue) == 0) {
                fields.remove(1);
                if (node.remainder.isEmpty()) {
                    fields.remove(0);
                }
            }
        }
        return fields;
    }

    /**
     * Rebuilds a trie written by {@link #toSerializable}.
     *
     * @throws TrieFormatException if the input does not have the expected shape
     */
    public static <V extends Comparable<? super V>, S> Trie<V, S> fromSerializable(
            Object serialized, V defaultValue, Function<Object, V> valueDecoder) {
        var trie = new Trie<V, S>(defaultValue);
        trie.deserializeInto(trie.root, serialized, valueDecoder);
        return trie;
    }

    private void deserializeInto(Node<V, S> node, Object serialized, Function<Object, V> valueDecoder) {
        if (!(serialized instanceof List<?> fields) || fields.size() > 3) {
            throw new TrieFormatException("Expected a node tuple of at most 3 fields but got " + describe(serialized));
        }
        if (!fields.isEmpty()) {
            if (!(fields.get(0) instanceof String remainder)) {
                throw new TrieFormatException("Node remainder must be a string: " + describe(fields.get(0)));
            }
            node.remainder = remainder;
        }
        if (fields.size() > 1) {
            try {
                node.value = Objects.requireNonNull(valueDecoder.apply(fields.get(1)));
            } catch (ClassCastException | NullPointerException e) {
                throw new TrieFormatException("Undecodable node value: " + describe(fields.get(1)), e);
            }
        }
        if (fields.size() > 2) {
            if (!(fields.get(2) instanceof Map<?, ?> children)) {
                throw new TrieFormatException("Node children must be a map: " + describe(fields.get(2)));
            }
            for (var e : children.entrySet()) {
                if (!(e.getKey() instanceof String edge) || edge.length() != 1) {
                    throw new TrieFormatException("Child edge must be a single character: " + e.getKey());
                }
                var child = new Node<V, S>("", defaultValue);
                deserializeInto(child, e.getValue(), valueDecoder);
                node.children.put(edge.charAt(0), child);
            }
        }
        node.refresh();
    }

    private static String describe(@Nullable Object o) {
        return o == null ? "null" : o.getClass().getSimpleName() + "(" + o + ")";
    }

    @Override
    public String toString() {
        return "Trie" + toMap();
    }
}
