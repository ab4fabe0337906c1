package ai.importfix.trie;

/** Serialized trie data does not have the expected shape. */
public class TrieFormatException extends RuntimeException {

    public TrieFormatException(String message) {
        super(message);
    }

    public TrieFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
