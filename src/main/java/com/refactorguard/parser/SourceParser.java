package com.refactorguard.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;

/**
 * Parses Java program units into {@link SyntaxTree}s.
 * A fresh {@link JavaParser} is created per call, so one instance can be shared by worker threads.
 */
public class SourceParser {

    private final ParserConfiguration configuration;

    public SourceParser() {
        this(new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public SourceParser(ParserConfiguration configuration) {
        this.configuration = configuration;
    }

    public SyntaxTree parse(String sourceName, String source) throws ParseFailureException {
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new ParseFailureException(sourceName, result.getProblems());
        }
        CompilationUnit cu = LexicalPreservingPrinter.setup(result.getResult().get());
        return new SyntaxTree(sourceName, source, cu);
    }

    /**
     * Produces an independent tree for the same text. Used to obtain a working
     * copy that can be rewritten while the original stays untouched.
     */
    public SyntaxTree reparse(SyntaxTree tree) {
        try {
            return parse(tree.getSourceName(), tree.getSource());
        } catch (ParseFailureException e) {
            throw new IllegalStateException("Source parsed once but not twice: " + tree.getSourceName(), e);
        }
    }

    public ParserConfiguration getConfiguration() {
        return configuration;
    }
}
