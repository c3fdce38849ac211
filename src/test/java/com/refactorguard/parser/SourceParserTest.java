package com.refactorguard.parser;

import com.github.javaparser.ast.stmt.ForEachStmt;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceParserTest {

    private static final String SOURCE = """
            package demo;

            class Demo {
                void run(java.util.List<Integer> items, java.util.List<Integer> out) {
                    for (int i : items) {
                        out.add(i);   // keep me
                    }
                }
            }
            """;

    private final SourceParser parser = new SourceParser();

    @Test
    void parsesAndPrintsBackUnchanged() throws ParseFailureException {
        SyntaxTree tree = parser.parse("Demo.java", SOURCE);

        assertThat(tree.getSourceName()).isEqualTo("Demo.java");
        assertThat(tree.getSource()).isSameAs(SOURCE);
        assertThat(tree.unparse()).isEqualTo(SOURCE);
    }

    @Test
    void malformedSourceIsReportedWithProblems() {
        assertThatThrownBy(() -> parser.parse("Broken.java", "class Broken { void m( { }"))
                .isInstanceOf(ParseFailureException.class)
                .hasMessageStartingWith("Syntax error in Broken.java")
                .satisfies(e -> assertThat(((ParseFailureException) e).getProblems()).isNotEmpty());
    }

    @Test
    void reparseGivesAnIndependentCopy() throws ParseFailureException {
        SyntaxTree tree = parser.parse("Demo.java", SOURCE);
        SyntaxTree copy = parser.reparse(tree);

        assertThat(copy.getCompilationUnit()).isNotSameAs(tree.getCompilationUnit());
        assertThat(copy.getCompilationUnit()).isEqualTo(tree.getCompilationUnit());

        copy.getCompilationUnit().findFirst(ForEachStmt.class).orElseThrow().remove();
        assertThat(tree.getCompilationUnit().findFirst(ForEachStmt.class)).isPresent();
    }

    @Test
    void positionsAreOneBased() throws ParseFailureException {
        SyntaxTree tree = parser.parse("Demo.java", SOURCE);
        ForEachStmt loop = tree.getCompilationUnit().findFirst(ForEachStmt.class).orElseThrow();

        assertThat(SourcePosition.of(loop)).isEqualTo(new SourcePosition(5, 9));
        assertThat(SourcePosition.of(new ForEachStmt())).isEqualTo(SourcePosition.UNKNOWN);
    }
}
