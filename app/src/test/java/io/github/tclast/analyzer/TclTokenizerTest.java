package io.github.tclast.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TclTokenizerTest {

    private final TclTokenizer tokenizer = new TclTokenizer();

    @Test
    void splitsOnWhitespace() {
        assertEquals(List.of("set", "x", "1"), tokenizer.tokenize("set x 1"));
        assertEquals(List.of("set", "x", "1"), tokenizer.tokenize("  set\tx   1  "));
    }

    @Test
    void bracedWordsKeepTheirBraces() {
        assertEquals(List.of("puts", "{a {b} c}"), tokenizer.tokenize("puts {a {b} c}"));
        assertEquals(List.of("if", "1", "{a; b}"), tokenizer.tokenize("if 1 {a; b}"));
    }

    @Test
    void escapedBraceDoesNotCount() {
        assertEquals(List.of("puts", "{a \\} b}"), tokenizer.tokenize("puts {a \\} b}"));
    }

    @Test
    void quoteInsideCommandSubstitutionDoesNotEndWord() {
        var source = "puts \"a [lindex $l \"x\"] b\"";
        assertEquals(List.of("puts", "\"a [lindex $l \"x\"] b\""), tokenizer.tokenize(source));
    }

    @Test
    void variableFormsStayTogether() {
        assertEquals(List.of("set", "v", "$a(x y)"), tokenizer.tokenize("set v $a(x y)"));
        assertEquals(List.of("puts", "${a b}"), tokenizer.tokenize("puts ${a b}"));
        assertEquals(List.of("puts", "$ns::v"), tokenizer.tokenize("puts $ns::v"));
    }

    @Test
    void bracketWordContinuesAfterClose() {
        assertEquals(List.of("set", "y", "[get a]suffix"), tokenizer.tokenize("set y [get a]suffix"));
        assertEquals(List.of("puts", "[list \"]\" {]}]"), tokenizer.tokenize("puts [list \"]\" {]}]"));
    }

    @Test
    void newlinesAndSemicolonsSeparateCommands() {
        var scan = tokenizer.splitCommands("a; b\nc d");
        assertEquals(3, scan.commands().size());
        assertEquals("c", scan.commands().get(2).name());
        assertEquals(List.of("d"), scan.commands().get(2).texts(1));
        assertEquals(4, tokenizer.countTokens("a; b\nc d"));
    }

    @Test
    void backslashNewlineContinuesCommand() {
        var scan = tokenizer.splitCommands("set x \\\n    1\nputs $x");
        assertEquals(2, scan.commands().size());
        assertEquals(List.of("x", "1"), scan.commands().get(0).texts(1));
    }

    @Test
    void commentsOnlyInCommandPosition() {
        var scan = tokenizer.splitCommands("# hello\nputs a # b\n  ;# trailing");
        assertEquals(List.of(" hello", " trailing"),
                scan.comments().stream().map(CommentText::text).toList());
        assertEquals(List.of("puts", "a", "#", "b"), scan.commands().get(0).texts(0));
    }

    @Test
    void commentContinuesAfterBackslashNewline() {
        var scan = tokenizer.splitCommands("# one \\\n two\nputs x");
        assertEquals(1, scan.comments().size());
        assertEquals(" one \\\n two", scan.comments().get(0).text());
        assertEquals(1, scan.commands().size());
    }

    @Test
    void unmatchedDelimiterRunsToEndOfInput() {
        var words = tokenizer.words("proc broken {\n  puts x");
        assertEquals(3, words.size());
        var last = words.get(2);
        assertEquals("{\n  puts x", last.text());
        assertFalse(last.isTerminated());
        assertEquals(Delimiter.BRACE, last.unclosed());

        assertEquals(Delimiter.QUOTE, tokenizer.words("puts \"abc").get(1).unclosed());
        assertEquals(Delimiter.BRACKET, tokenizer.words("set x [foo").get(2).unclosed());
    }

    @Test
    void reportsOutermostOpenDelimiter() {
        var word = tokenizer.words("puts {a [b").get(1);
        assertEquals(Delimiter.BRACE, word.unclosed());
    }

    @Test
    void getTokenIsTotal() {
        assertEquals("x", tokenizer.getToken("set x 1", 1));
        assertEquals("", tokenizer.getToken("set x 1", 3));
        assertEquals("", tokenizer.getToken("set x 1", -1));
        assertEquals("", tokenizer.getToken("", 0));
    }

    @Test
    void delimiterDepthGuardTakesRestLiterally() {
        var shallow = new TclTokenizer(3);
        var word = shallow.words("{{{{x}}}} tail").get(0);
        assertEquals("{{{{x}}}} tail", word.text());
        assertEquals(Delimiter.BRACE, word.unclosed());

        assertTrue(shallow.words("{{{x}}}").get(0).isTerminated());
    }

    @Test
    void controlAndSupplementaryCharactersAreOpaque() {
        assertEquals(List.of("puts", "\u0000\u0001"), tokenizer.tokenize("puts \u0000\u0001"));
        assertEquals(List.of("puts", "😀x"), tokenizer.tokenize("puts 😀x"));
    }

    @Test
    void listElementsIgnoreCommandSeparators() {
        assertEquals(List.of("a", "{b c}", "\"d e\"", "f;g", "#h"),
                tokenizer.listElements("a {b c} \"d e\"\n f;g #h"));
        assertEquals(List.of(), tokenizer.listElements("  \n "));
    }

    @Test
    void wordOffsetsAreAbsolute() {
        var source = "puts {abc} x";
        var scan = tokenizer.splitCommands(source, 5, 10);
        var word = scan.commands().get(0).word(0);
        assertEquals("{abc}", word.text());
        assertEquals(5, word.start());
        assertEquals(10, word.end());

        var inner = tokenizer.splitCommands(source, 6, 9);
        assertEquals(6, inner.commands().get(0).start());
    }
}
