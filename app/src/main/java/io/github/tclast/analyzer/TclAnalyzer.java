package io.github.tclast.analyzer;

import io.github.tclast.analyzer.ast.AstNode;
import io.github.tclast.analyzer.ast.ErrorNode;
import io.github.tclast.analyzer.ast.Root;
import io.github.tclast.analyzer.parsers.ConstructParsers;
import io.github.tclast.json.AstJsonSerializer;
import io.github.tclast.util.ParserConfig;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tcl implementation of {@link IScriptAnalyzer}. Holds only immutable configuration, so one instance can serve any
 * number of threads.
 */
public class TclAnalyzer implements IScriptAnalyzer {
    private static final Logger logger = LogManager.getLogger(TclAnalyzer.class);

    private final ParserConfig config;
    private final TclTokenizer tokenizer;
    private final ConstructParsers parsers;
    private final AstJsonSerializer serializer;

    /** Uses {@link ParserConfig#load()}. */
    public TclAnalyzer() {
        this(ParserConfig.load());
    }

    public TclAnalyzer(ParserConfig config) {
        this(config, ConstructParsers.standard());
    }

    public TclAnalyzer(ParserConfig config, ConstructParsers parsers) {
        this.config = config;
        this.tokenizer = new TclTokenizer(config.maxDelimiterDepth());
        this.parsers = parsers;
        this.serializer = new AstJsonSerializer(config.prettyPrint());
    }

    @Override
    public Root build(String source, String filepath) {
        var builder = new AstBuilder(source, tokenizer, parsers, config.maxBodyDepth());
        Root root;
        try {
            var children = builder.buildTopLevel();
            var range = builder.rangeOf(0, source.length());
            root = Root.of(filepath, builder.comments(), children, builder.errors(), range);
        } catch (RuntimeException e) {
            // failures inside a command are already contained; this covers the walk itself
            logger.error("Building AST for {} failed; returning an error-only tree", filepath, e);
            var range = new PositionTracker(source).rangeOf(0, source.length());
            var error = new ErrorNode(
                    "Internal error while parsing: " + e.getClass().getSimpleName(),
                    ErrorNode.Kind.INTERNAL,
                    null,
                    range,
                    0);
            root = Root.of(filepath, List.of(), List.of(error), List.of(error), range);
        }
        if (logger.isDebugEnabled()) {
            logger.debug(
                    "Built {} ({} chars): {} nodes, {} comments, {} errors",
                    filepath,
                    source.length(),
                    AstTraversal.preOrder(root).size(),
                    root.comments().size(),
                    root.errors().size());
        }
        return root;
    }

    @Override
    public String toJson(AstNode node) {
        return serializer.toJson(node);
    }
}
