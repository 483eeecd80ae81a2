package io.github.tclast.analyzer.parsers;

import io.github.tclast.analyzer.CommandText;
import io.github.tclast.analyzer.Range;
import io.github.tclast.analyzer.TclTokenizer;
import io.github.tclast.analyzer.Word;
import io.github.tclast.analyzer.ast.Body;
import java.util.List;

/** What a construct parser may ask of the builder that invoked it. */
public interface ParseContext {

    Range rangeOf(CommandText command);

    Range rangeOf(Word word);

    /**
     * Parses a script argument (braced, quoted or bare) into a body whose statements sit at {@code depth}. Ranges of
     * the nested statements are absolute in the source being built.
     */
    Body parseBody(Word word, int depth);

    /**
     * Splits a list-valued argument, such as a switch block, into its elements. Outer braces or quotes are dropped
     * first; the returned words carry absolute offsets so they can be passed back to {@link #parseBody}.
     */
    List<Word> listWords(Word word);

    /** Tokenizer configured for this build, for list-valued arguments nested inside other lists. */
    TclTokenizer tokenizer();
}
