package com.refactorguard.parser;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One parsed program unit. The compilation unit is set up for lexical
 * preservation, so untouched regions print back exactly as they were read.
 */
@Getter
@AllArgsConstructor
public class SyntaxTree {
    private final String sourceName;
    private final String source;
    private final CompilationUnit compilationUnit;

    /** Prints the current state of the tree, keeping the original layout where nothing changed. */
    public String unparse() {
        return LexicalPreservingPrinter.print(compilationUnit);
    }
}
