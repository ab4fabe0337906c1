package ai.importfix.trie;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Reads and writes {@link Trie}s as CBOR. */
public final class TrieIO {
    private static final Logger logger = LogManager.getLogger(TrieIO.class);

    private static final ObjectMapper CBOR_MAPPER = new ObjectMapper(new CBORFactory());

    private TrieIO() {}

    public static <V extends Comparable<? super V>> void save(
            Trie<V, ?> trie, Path file, Function<V, Object> valueEncoder) throws IOException {
        var parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        CBOR_MAPPER.writeValue(file.toFile(), trie.toSerializable(valueEncoder));
        logger.debug("Saved trie to {}", file);
    }

    /**
     * @throws TrieFormatException if the file holds something other than a serialized trie
     */
    public static <V extends Comparable<? super V>, S> Trie<V, S> load(
            Path file, V defaultValue, Function<Object, V> valueDecoder) throws IOException {
        Object raw;
        try {
            raw = CBOR_MAPPER.readValue(file.toFile(), Object.class);
        } catch (JsonProcessingException e) {
            throw new TrieFormatException("Unreadable trie data in " + file + ": " + e.getOriginalMessage(), e);
        }
        Trie<V, S> trie = Trie.fromSerializable(raw, defaultValue, valueDecoder);
        logger.debug("Loaded trie from {}", file);
        return trie;
    }

    /** Decoder for {@code Long} values, which CBOR may hand back as any integral type. */
    public static Long decodeLong(Object raw) {
        if (raw instanceof Number n) {
            return n.longValue();
        }
        throw new TrieFormatException("Expected a number but got " + raw);
    }
}
