package com.refactorguard.transform.rules;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.stmt.Statement;
import com.refactorguard.transform.TransformOutcome;

import static org.assertj.core.api.Assertions.assertThat;

final class RuleAssertions {

    private RuleAssertions() {
    }

    static Statement stmt(String code) {
        return StaticJavaParser.parseStatement(code);
    }

    static TransformOutcome.Replaced replaced(TransformOutcome outcome) {
        assertThat(outcome).isInstanceOf(TransformOutcome.Replaced.class);
        return (TransformOutcome.Replaced) outcome;
    }

    static TransformOutcome.Unchanged unchanged(TransformOutcome outcome) {
        assertThat(outcome).isInstanceOf(TransformOutcome.Unchanged.class);
        return (TransformOutcome.Unchanged) outcome;
    }

    /** Compares both sides in pretty-printed form, so layout in {@code expected} does not matter. */
    static void assertSameCode(Statement actual, String expected) {
        assertThat(actual.toString()).isEqualTo(stmt(expected).toString());
    }
}
