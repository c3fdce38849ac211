package com.refactorguard.detector;

import com.refactorguard.parser.ParseFailureException;
import com.refactorguard.parser.SourceParser;
import com.refactorguard.parser.SyntaxTree;

public final class DetectorTestSupport {

    private DetectorTestSupport() {
    }

    /** Wraps statements into {@code class T { void m() { ... } }}; the first statement is on line 3. */
    public static SyntaxTree method(String body) {
        return parse("class T {\n    void m() {\n" + body + "\n    }\n}\n");
    }

    public static SyntaxTree parse(String source) {
        try {
            return new SourceParser().parse("T.java", source);
        } catch (ParseFailureException e) {
            throw new AssertionError(e.getMessage(), e);
        }
    }
}
