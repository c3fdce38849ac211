package com.refactorguard.parser;

import com.github.javaparser.Problem;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a program unit is not syntactically valid Java. Aborts the
 * processing of that unit only.
 */
public class ParseFailureException extends Exception {

    private final String sourceName;
    private final List<String> problems;

    public ParseFailureException(String sourceName, List<Problem> problems) {
        super("Syntax error in " + sourceName + ": " + summarize(problems));
        this.sourceName = sourceName;
        this.problems = problems.stream()
                .map(Problem::getVerboseMessage)
                .collect(Collectors.toUnmodifiableList());
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<String> getProblems() {
        return problems;
    }

    private static String summarize(List<Problem> problems) {
        if (problems.isEmpty()) {
            return "no compilation unit produced";
        }
        return problems.get(0).getMessage()
                + (problems.size() > 1 ? " (+" + (problems.size() - 1) + " more)" : "");
    }
}
