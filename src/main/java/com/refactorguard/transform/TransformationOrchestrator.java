package com.refactorguard.transform;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.nodeTypes.NodeWithStatements;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.refactorguard.detector.DetectorKind;
import com.refactorguard.detector.PatternDetector;
import com.refactorguard.detector.PatternDetectors;
import com.refactorguard.parser.NodeKind;
import com.refactorguard.parser.SourceParser;
import com.refactorguard.parser.SourcePosition;
import com.refactorguard.parser.SyntaxTree;
import com.refactorguard.transform.rules.ConditionalChainToMapRule;
import com.refactorguard.transform.rules.LoopToComprehensionRule;
import com.refactorguard.transform.rules.NestedConditionalMergeRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies the rules to a tree in a single bottom-up pass.
 * <p>
 * Children are rewritten before their parent, so a rule always sees already
 * rewritten children. Every node is offered to each matching rule at most
 * once, in detector report order, and the first replacement wins. Nodes
 * produced by a rewrite are not revisited.
 * <p>
 * The pass does not run to a fixed point: a rewrite can expose a new match
 * (a merge that leaves a fresh equality chain, say) that only a second run
 * picks up.
 */
public class TransformationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TransformationOrchestrator.class);

    private final SourceParser parser;
    private final List<Binding> bindings;

    public TransformationOrchestrator(SourceParser parser,
                                      PatternDetectors detectors,
                                      List<TransformationRule> rules) {
        this.parser = parser;
        Map<DetectorKind, TransformationRule> rulesByKind = rules.stream()
                .collect(Collectors.toMap(TransformationRule::kind, Function.identity()));
        List<Binding> bound = new ArrayList<>();
        for (PatternDetector detector : detectors.getDetectors()) {
            TransformationRule rule = rulesByKind.get(detector.kind());
            if (rule == null) {
                throw new IllegalArgumentException("No rule registered for " + detector.kind());
            }
            bound.add(new Binding(detector, rule));
        }
        this.bindings = List.copyOf(bound);
    }

    public static TransformationOrchestrator standard(SourceParser parser, BranchBodyPolicy policy) {
        return new TransformationOrchestrator(parser, PatternDetectors.standard(), List.of(
                new LoopToComprehensionRule(),
                new NestedConditionalMergeRule(),
                new ConditionalChainToMapRule(policy)
        ));
    }

    public TransformationResult transform(SyntaxTree original) {
        SyntaxTree working = parser.reparse(original);
        CompilationUnit cu = working.getCompilationUnit();

        List<RewriteRecord> records = new ArrayList<>();
        Set<String> imports = new TreeSet<>();
        rewrite(cu, records, imports);

        boolean changed = records.stream().anyMatch(RewriteRecord::applied);
        if (!changed) {
            return new TransformationResult(working, original.getSource(), List.copyOf(records));
        }
        imports.forEach(cu::addImport);
        return new TransformationResult(working, unparse(working), List.copyOf(records));
    }

    private void rewrite(Node node, List<RewriteRecord> records, Set<String> imports) {
        for (Node child : new ArrayList<>(node.getChildNodes())) {
            rewrite(child, records, imports);
        }
        if (!isRewriteSite(NodeKind.of(node))) {
            return;
        }
        for (Binding binding : bindings) {
            if (!binding.detector().matches(node)) {
                continue;
            }
            SourcePosition position = SourcePosition.of(node);
            TransformOutcome outcome = binding.rule().apply(node);
            if (outcome instanceof TransformOutcome.Replaced replaced) {
                splice((Statement) node, replaced.statements());
                imports.addAll(replaced.requiredImports());
                records.add(RewriteRecord.ofApplied(position, binding.detector().kind(), replaced.notes()));
                log.info("Refactored {} at line {}", binding.detector().kind(), position.line());
                replaced.notes().forEach(note -> log.warn("Lossy rewrite at line {}: {}", position.line(), note));
                return;
            }
            TransformOutcome.Unchanged unchanged = (TransformOutcome.Unchanged) outcome;
            records.add(RewriteRecord.ofSkipped(position, binding.detector().kind(), unchanged));
            log.debug("Skipped refactoring at line {}: {} ({})",
                    position.line(), unchanged.detail(), unchanged.reason());
        }
    }

    private static boolean isRewriteSite(NodeKind kind) {
        switch (kind) {
            case LOOP:
            case CONDITIONAL:
                return true;
            case CALL:
            case ASSIGNMENT:
            case BINARY_OP:
            case COMPARISON:
            case IDENTIFIER:
            case CONSTANT:
            case BLOCK:
            case LAMBDA:
            case MAPPING:
            case OTHER:
                return false;
        }
        throw new IllegalStateException("Unhandled node kind " + kind);
    }

    /**
     * Puts {@code replacements} where {@code target} was. Several statements
     * go straight into the enclosing statement list; in a single-statement
     * slot (an unbraced loop or if body) they are wrapped in a block.
     */
    static void splice(Statement target, List<Statement> replacements) {
        Node parent = target.getParentNode()
                .orElseThrow(() -> new IllegalStateException("Cannot replace a detached statement"));
        if (replacements.size() == 1) {
            if (!target.replace(replacements.get(0))) {
                throw new IllegalStateException("Parent " + parent.getClass().getSimpleName() + " refused the replacement");
            }
            return;
        }
        if (parent instanceof NodeWithStatements<?> holder) {
            NodeList<Statement> statements = holder.getStatements();
            int index = indexOf(statements, target);
            statements.set(index, replacements.get(0));
            for (int i = 1; i < replacements.size(); i++) {
                statements.add(index + i, replacements.get(i));
            }
            return;
        }
        if (!target.replace(new BlockStmt(new NodeList<>(replacements)))) {
            throw new IllegalStateException("Parent " + parent.getClass().getSimpleName() + " refused the replacement");
        }
    }

    // NodeList.indexOf compares structurally, the splice needs identity.
    private static int indexOf(NodeList<Statement> statements, Statement target) {
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i) == target) {
                return i;
            }
        }
        throw new IllegalStateException("Statement not found in its parent's statement list");
    }

    private static String unparse(SyntaxTree tree) {
        try {
            return tree.unparse();
        } catch (RuntimeException e) {
            log.warn("Layout-preserving print failed for {}, falling back to pretty printing: {}",
                    tree.getSourceName(), e.getMessage());
            return tree.getCompilationUnit().toString();
        }
    }

    private record Binding(PatternDetector detector, TransformationRule rule) {
    }
}
