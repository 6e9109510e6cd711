package me.christianrobert.ftranspile.codegen;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.frontend.builder.IrBuilder;
import me.christianrobert.ftranspile.frontend.builder.SourceText;
import me.christianrobert.ftranspile.frontend.context.FrontendConfig;
import me.christianrobert.ftranspile.frontend.parser.AntlrParser;
import me.christianrobert.ftranspile.frontend.parser.ParseResult;
import me.christianrobert.ftranspile.ir.SourceFile;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 * Base class for printer tests that start from Fortran source.
 *
 * <p>Sources are parsed and lowered in lenient mode without preprocessing, so the
 * printed output depends only on the IR the builder produces.</p>
 */
public abstract class CodegenTestBase {

    private final AntlrParser parser = new AntlrParser();

    protected SourceFile lower(String source) {
        ParseResult result = parser.parseProgram(source);
        assertFalse(result.hasErrors(), () -> "Unexpected parse errors: " + result.getErrorMessage());
        SourceText text = new SourceText(result.getOriginalSource(), result.getTokens());
        return new IrBuilder(text, FrontendConfig.lenient(), Map.of())
                .build((FortranParser.ProgramContext) result.getTree(), null);
    }
}
