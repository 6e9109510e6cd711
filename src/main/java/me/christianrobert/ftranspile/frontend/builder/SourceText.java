package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranLexer;
import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.ir.Source;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;

import java.util.List;

/**
 * Recovers exact source text, line spans, labels and trailing comments for parse-tree nodes.
 *
 * <p>Statement contexts end with their newline tokens; those are excluded from the span so
 * that the recorded text is exactly the statement as written (continuation lines included).</p>
 */
public class SourceText {

    private final String raw;
    private final CommonTokenStream tokens;

    public SourceText(String raw, CommonTokenStream tokens) {
        this.raw = raw;
        this.tokens = tokens;
    }

    /**
     * Source span of a context: line range and exact substring.
     */
    public Source source(ParserRuleContext ctx) {
        if (ctx == null || ctx.start == null) {
            return null;
        }
        Token first = ctx.start;
        Token last = lastSignificantToken(ctx);
        if (last == null || first.getType() == Token.EOF) {
            return new Source(first.getLine(), first.getLine(), "");
        }
        return new Source(first.getLine(), last.getLine(), substring(first, last));
    }

    /**
     * Exact text of a context without trailing newline tokens.
     */
    public String text(ParserRuleContext ctx) {
        Source source = source(ctx);
        return source != null ? source.getString() : "";
    }

    /**
     * Statement text with a leading numeric label removed.
     */
    public String textWithoutLabel(ParserRuleContext ctx) {
        String text = text(ctx);
        String label = label(ctx);
        if (label != null && text.startsWith(label)) {
            return text.substring(label.length()).trim();
        }
        return text;
    }

    /**
     * Legacy numeric label of a statement, or null.
     */
    public String label(ParserRuleContext ctx) {
        if (ctx == null || ctx.getChildCount() == 0) {
            return null;
        }
        ParseTree first = ctx.getChild(0);
        if (first instanceof FortranParser.LabelContext) {
            return first.getText();
        }
        return null;
    }

    /**
     * Trailing {@code ! comment} on the last line of a statement, or null.
     */
    public String inlineComment(ParserRuleContext ctx) {
        Token last = lastSignificantToken(ctx);
        if (last == null || tokens == null) {
            return null;
        }
        List<Token> hidden = tokens.getHiddenTokensToRight(last.getTokenIndex(), Lexer.HIDDEN);
        if (hidden == null) {
            return null;
        }
        for (Token token : hidden) {
            if (token.getType() == FortranLexer.INLINE_COMMENT) {
                return token.getText().trim();
            }
        }
        return null;
    }

    private Token lastSignificantToken(ParserRuleContext ctx) {
        Token stop = ctx.stop;
        if (stop == null) {
            return null;
        }
        if (tokens == null || stop.getTokenIndex() < 0) {
            return stop;
        }
        int index = stop.getTokenIndex();
        int startIndex = ctx.start.getTokenIndex();
        while (index > startIndex) {
            Token token = tokens.get(index);
            // trailing comments live on the hidden channel and are not part of the statement
            if (token.getChannel() == Token.DEFAULT_CHANNEL
                    && token.getType() != FortranLexer.NEWLINE && token.getType() != Token.EOF) {
                return token;
            }
            index--;
        }
        return tokens.get(startIndex);
    }

    private String substring(Token first, Token last) {
        int begin = first.getStartIndex();
        int end = last.getStopIndex() + 1;
        if (begin < 0 || end > raw.length() || begin >= end) {
            return first.getText();
        }
        return raw.substring(begin, end);
    }
}
