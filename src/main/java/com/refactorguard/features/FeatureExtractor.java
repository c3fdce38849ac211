package com.refactorguard.features;

import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.NameExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns a (before, after) pair of code fragments into a {@link FeatureVector}.
 * <p>
 * A fragment that does not parse counts as empty: all of its measures,
 * its line count included, are 0. Extraction never fails.
 */
public class FeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

    private final SnippetParser parser;

    public FeatureExtractor() {
        this(new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public FeatureExtractor(ParserConfiguration configuration) {
        this.parser = new SnippetParser(configuration);
    }

    public FeatureVector extract(String before, String after) {
        Measures b = measure(before);
        Measures a = measure(after);
        return FeatureVector.of(
                b.complexity, a.complexity, a.complexity - b.complexity,
                b.length, a.length, a.length - b.length,
                b.nesting, a.nesting, a.nesting - b.nesting,
                a.variableReferences - b.variableReferences
        );
    }

    public double complexity(String code) {
        return measure(code).complexity;
    }

    public int lineCount(String code) {
        return measure(code).length;
    }

    public int nestingDepth(String code) {
        return measure(code).nesting;
    }

    public int variableReferences(String code) {
        return measure(code).variableReferences;
    }

    private Measures measure(String code) {
        Optional<Node> root = parser.parse(code);
        if (root.isEmpty()) {
            log.debug("Snippet does not parse, scoring it as empty");
            return Measures.EMPTY;
        }
        Node tree = root.get();
        return new Measures(
                CyclomaticComplexity.average(tree),
                code.strip().split("\\R", -1).length,
                Math.max(depth(tree) - 1, 0),
                variableReferenceCount(tree));
    }

    static int depth(Node node) {
        int deepest = 0;
        for (Node child : node.getChildNodes()) {
            deepest = Math.max(deepest, depth(child));
        }
        return 1 + deepest;
    }

    // reads only: the target of an assignment is a write
    private static int variableReferenceCount(Node tree) {
        return (int) tree.findAll(NameExpr.class).stream()
                .filter(name -> name.getParentNode()
                        .filter(AssignExpr.class::isInstance)
                        .map(parent -> ((AssignExpr) parent).getTarget() != name)
                        .orElse(true))
                .count();
    }

    private record Measures(double complexity, int length, int nesting, int variableReferences) {
        static final Measures EMPTY = new Measures(0, 0, 0, 0);
    }
}
