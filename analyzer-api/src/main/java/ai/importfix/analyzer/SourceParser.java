package ai.importfix.analyzer;

/** Turns source text into a {@link SyntaxNode} tree. */
public interface SourceParser {

    /**
     * Parses the given source. Syntax errors do not throw: the returned tree contains error nodes instead.
     *
     * @throws ParseException if the parser could not produce any tree at all
     */
    SyntaxNode parse(String source) throws ParseException;
}
