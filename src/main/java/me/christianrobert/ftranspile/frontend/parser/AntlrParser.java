package me.christianrobert.ftranspile.frontend.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.ftranspile.antlr.FortranLexer;
import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.frontend.context.LoweringException;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Owns the generated Fortran lexer and parser.
 *
 * <p>Each call parses in SLL mode with a bail-out strategy first. Only input that SLL
 * prediction cannot handle (syntax errors, or the ambiguity around labelled DO
 * termination) is parsed a second time in full LL mode, where errors are recovered
 * from and collected as {@code "Line l:c - message"} strings.</p>
 *
 * <p>The generated parser's DFA is shared between instances; it is cleared after every
 * parse so that transpiling many files in one process does not keep growing it.</p>
 */
@Dependent
public class AntlrParser {

    private static final Logger log = LoggerFactory.getLogger(AntlrParser.class);

    /**
     * Parses a complete free-form Fortran source file.
     * A trailing newline is appended when missing, since every statement ends on one.
     *
     * @param source Fortran source code
     * @return ParseResult containing the parse tree and any errors
     */
    public ParseResult parseProgram(String source) {
        if (source == null) {
            throw new LoweringException("Fortran source cannot be null");
        }

        String text = source.endsWith("\n") ? source : source + "\n";
        log.debug("Parsing Fortran source: {}", text.substring(0, Math.min(100, text.length())));
        return run(text, FortranParser::program, "program");
    }

    /**
     * Parses a single Fortran expression such as {@code "a + b(i)"}.
     *
     * @param expression expression text without statement context
     * @return ParseResult whose tree is a SingleExpressionContext
     */
    public ParseResult parseExpression(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new LoweringException("Expression cannot be null or empty");
        }

        log.debug("Parsing expression: {}", expression);
        return run(expression, FortranParser::singleExpression, "expression");
    }

    private ParseResult run(String text, Function<FortranParser, ? extends ParserRuleContext> rule, String what) {
        try {
            return parse(text, rule, what);
        } catch (RuntimeException e) {
            log.error("Failed to parse Fortran {}", what, e);
            throw new LoweringException("Failed to parse Fortran " + what + ": " + e.getMessage(),
                    "ANTLR parsing", null, e);
        }
    }

    private ParseResult parse(String text, Function<FortranParser, ? extends ParserRuleContext> rule, String what) {
        List<String> errors = new ArrayList<>();

        FortranLexer lexer = new FortranLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ErrorCollector(errors));
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        FortranParser parser = new FortranParser(tokens);
        parser.removeErrorListeners();
        try {
            // STEP 1: fast path
            parser.setErrorHandler(new BailErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
            try {
                ParserRuleContext tree = rule.apply(parser);
                log.trace("SLL parse of {} succeeded", what);
                return new ParseResult(tree, tokens, errors, text);
            } catch (ParseCancellationException bail) {
                log.trace("SLL parse of {} bailed out, retrying in LL mode", what);
            }

            // STEP 2: full prediction with error recovery
            tokens.seek(0);
            parser.reset();
            parser.setErrorHandler(new DefaultErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            parser.addErrorListener(new ErrorCollector(errors));
            ParserRuleContext tree = rule.apply(parser);
            log.debug("LL parse of {} finished with {} error(s)", what, errors.size());
            return new ParseResult(tree, tokens, errors, text);

        } finally {
            parser.getInterpreter().clearDFA();
        }
    }

    /**
     * Records syntax errors with their position.
     */
    private static class ErrorCollector extends BaseErrorListener {

        private final List<String> errors;

        ErrorCollector(List<String> errors) {
            this.errors = errors;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            String error = String.format("Line %d:%d - %s", line, charPositionInLine, msg);
            errors.add(error);
            log.warn("Parse error: {}", error);
        }
    }
}
