package me.christianrobert.ftranspile.frontend.parser;

import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of parsing Fortran source or a single expression.
 * Contains the parse tree, the token stream (hidden-channel comments included)
 * and any syntax errors encountered.
 */
public class ParseResult {

    private final ParserRuleContext tree;
    private final CommonTokenStream tokens;
    private final List<String> errors;
    private final String originalSource;

    public ParseResult(ParserRuleContext tree, CommonTokenStream tokens, List<String> errors, String originalSource) {
        this.tree = tree;
        this.tokens = tokens;
        this.errors = new ArrayList<>(errors);
        this.originalSource = originalSource;
    }

    /**
     * Gets the ANTLR parse tree root node.
     */
    public ParserRuleContext getTree() {
        return tree;
    }

    /**
     * Gets the token stream the tree was built from.
     */
    public CommonTokenStream getTokens() {
        return tokens;
    }

    /**
     * Gets the list of syntax errors encountered during parsing.
     */
    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Gets the source text that was parsed.
     */
    public String getOriginalSource() {
        return originalSource;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Gets a formatted error message combining all errors.
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("\n", errors);
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + isSuccess() + ", errors=" + errors.size() + "}";
    }
}
