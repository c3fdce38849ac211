package com.refactorguard.features;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.BlockStmt;

import java.util.Optional;

/**
 * Parses code fragments of unknown shape. Training data holds whole files as
 * well as loose statements, so a snippet is tried as a compilation unit first
 * and then as the body of a block.
 */
class SnippetParser {

    private final ParserConfiguration configuration;

    SnippetParser(ParserConfiguration configuration) {
        this.configuration = configuration;
    }

    Optional<Node> parse(String code) {
        JavaParser parser = new JavaParser(configuration);
        ParseResult<CompilationUnit> unit = parser.parse(code);
        if (unit.isSuccessful() && unit.getResult().isPresent()) {
            return Optional.of(unit.getResult().get());
        }
        ParseResult<BlockStmt> block = parser.parseBlock("{\n" + code + "\n}");
        if (block.isSuccessful() && block.getResult().isPresent()) {
            return Optional.of(block.getResult().get());
        }
        return Optional.empty();
    }
}
