package com.refactorguard.transform;

import com.github.javaparser.StaticJavaParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformOutcomeTest {

    @Test
    void replacedNeedsAStatement() {
        assertThatThrownBy(() -> new TransformOutcome.Replaced(List.of(), Set.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void factoriesTagTheOutcome() {
        TransformOutcome replaced = TransformOutcome.replaced(StaticJavaParser.parseStatement("a();"), Set.of());
        TransformOutcome unchanged = TransformOutcome.unchanged(MismatchReason.NOT_APPEND_CALL, "no append");

        assertThat(replaced.isReplaced()).isTrue();
        assertThat(unchanged.isReplaced()).isFalse();
        assertThat(((TransformOutcome.Unchanged) unchanged).detail()).isEqualTo("no append");
    }
}
