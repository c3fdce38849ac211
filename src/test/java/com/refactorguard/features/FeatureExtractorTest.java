package com.refactorguard.features;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor();

    @Test
    void alwaysProducesTheTenKeysInOrder() {
        FeatureVector features = extractor.extract("a();", "b();");

        assertThat(features.keys()).containsExactly(
                "complexity_before", "complexity_after", "complexity_change",
                "length_before", "length_after", "length_change",
                "nesting_before", "nesting_after", "nesting_change",
                "variable_usage_diff");
        assertThat(features.asMap()).containsOnlyKeys(FeatureVector.SCHEMA);
        assertThat(features.toArray()).hasSize(10);
    }

    @Test
    void malformedSnippetScoresZero() {
        FeatureVector features = extractor.extract("class {{{", "int total = a + b;\nuse(total);");

        assertThat(features.get(FeatureVector.COMPLEXITY_BEFORE)).isZero();
        assertThat(features.get(FeatureVector.LENGTH_BEFORE)).isZero();
        assertThat(features.get(FeatureVector.NESTING_BEFORE)).isZero();
        assertThat(features.get(FeatureVector.LENGTH_AFTER)).isEqualTo(2);
        assertThat(features.get(FeatureVector.LENGTH_CHANGE)).isEqualTo(2);
        assertThat(features.get(FeatureVector.VARIABLE_USAGE_DIFF)).isEqualTo(3);
    }

    @Test
    void complexityAveragesCallables() {
        String code = """
                class T {
                    int a(int x) {
                        if (x > 0 && x < 5) {
                            return 1;
                        }
                        return 0;
                    }
                    int b() {
                        return 2;
                    }
                }""";

        // a: 1 + if + && = 3, b: 1
        assertThat(extractor.complexity(code)).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void looseStatementsCountOnlyWhenTheyBranch() {
        assertThat(extractor.complexity("x = 1;\ny = 2;")).isZero();
        assertThat(extractor.complexity("for (int i : xs) { if (i > 0) { use(i); } }")).isEqualTo(3);
        assertThat(extractor.complexity("int v = a ? 1 : 2;")).isEqualTo(2);
    }

    @Test
    void nestedCallablesAreScoredSeparately() {
        String code = """
                class T {
                    void outer() {
                        Object o = new Object() {
                            void inner() {
                                if (a) { b(); }
                            }
                        };
                    }
                }""";

        // outer: 1, inner: 2
        assertThat(extractor.complexity(code)).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void lineCountUsesStrippedText() {
        assertThat(extractor.lineCount("\n\na();\nb();\n\n")).isEqualTo(2);
        assertThat(extractor.lineCount("a();")).isEqualTo(1);
    }

    @Test
    void deeperCodeNestsDeeper() {
        int flat = extractor.nestingDepth("a();");
        int nested = extractor.nestingDepth("if (x) { if (y) { while (z) { a(); } } }");

        assertThat(nested).isGreaterThan(flat);
        assertThat(extractor.nestingDepth("class {")).isZero();
    }

    @Test
    void assignmentTargetsAreNotReads() {
        assertThat(extractor.variableReferences("x = y + z;")).isEqualTo(2);
        assertThat(extractor.variableReferences("x += y;")).isEqualTo(1);
    }

    @Test
    void changesAreAfterMinusBefore() {
        FeatureVector features = extractor.extract(
                "if (x == 1) { a(); } else if (x == 2) { b(); }",
                "a();");

        assertThat(features.get(FeatureVector.COMPLEXITY_CHANGE))
                .isEqualTo(features.get(FeatureVector.COMPLEXITY_AFTER) - features.get(FeatureVector.COMPLEXITY_BEFORE));
        assertThat(features.get(FeatureVector.LENGTH_CHANGE)).isEqualTo(0);
        assertThat(features.get(FeatureVector.NESTING_CHANGE)).isNegative();
        assertThat(features.get(FeatureVector.VARIABLE_USAGE_DIFF)).isEqualTo(-2);
    }
}
