package me.christianrobert.ftranspile.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.config.service.ConfigService;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.frontend.builder.ExpressionBuilder;
import me.christianrobert.ftranspile.frontend.builder.IrBuilder;
import me.christianrobert.ftranspile.frontend.builder.SourceText;
import me.christianrobert.ftranspile.frontend.context.FrontendConfig;
import me.christianrobert.ftranspile.frontend.context.LoweringException;
import me.christianrobert.ftranspile.frontend.parser.AntlrParser;
import me.christianrobert.ftranspile.frontend.parser.ParseResult;
import me.christianrobert.ftranspile.frontend.preprocessing.PreprocessingInfo;
import me.christianrobert.ftranspile.frontend.preprocessing.PreprocessingRegistry;
import me.christianrobert.ftranspile.frontend.preprocessing.Sanitizer;
import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.SourceFile;
import me.christianrobert.ftranspile.scope.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Front end entry point: Fortran source text to IR.
 *
 * <p>Pipeline:
 * <pre>
 * source → preprocessing filters → ANTLR parse → IrBuilder → rule post-processing → Sanitizer
 * </pre>
 *
 * <p>Parse errors and lowering failures surface as {@link LoweringException}; no partial
 * IR is returned. Strict mode and the active preprocessing rules come from
 * {@link ConfigService}.</p>
 */
@ApplicationScoped
public class FortranFrontend {

    private static final Logger log = LoggerFactory.getLogger(FortranFrontend.class);

    @Inject
    AntlrParser parser;

    @Inject
    ConfigService configService;

    /**
     * Lowers a source file, running the configured preprocessing rules first.
     *
     * @param source Fortran source text
     * @param definitions modules lowered earlier, keyed by lower-case name; may be empty
     * @return the sanitized IR of the whole file
     * @throws LoweringException on parse errors or constructs that cannot be lowered
     */
    public SourceFile parseSource(String source, Map<String, Module> definitions) {
        if (source == null) {
            throw new IllegalArgumentException("Fortran source cannot be null");
        }
        PreprocessingRegistry registry = registry();
        Map<String, List<PreprocessingInfo>> info = new HashMap<>();
        String filtered = registry.filter(source, info);
        return lower(filtered, definitions, registry, info);
    }

    /**
     * Lowers source text that has already been filtered, handing the collected
     * information back to the rules for post-processing.
     */
    public SourceFile parseSource(String filteredSource, Map<String, Module> definitions,
                                  Map<String, List<PreprocessingInfo>> ppInfo) {
        if (filteredSource == null) {
            throw new IllegalArgumentException("Fortran source cannot be null");
        }
        return lower(filteredSource, definitions, registry(), ppInfo);
    }

    /**
     * Lowers a single expression against an existing scope, e.g. to build replacement
     * expressions for a transformation.
     */
    public Expression parseExpression(String text, Scope scope) {
        ParseResult parseResult = parser.parseExpression(text);
        if (parseResult.hasErrors()) {
            throw new LoweringException("Parse errors: " + parseResult.getErrorMessage(), "expression", null);
        }
        SourceText sourceText = new SourceText(parseResult.getOriginalSource(), parseResult.getTokens());
        ExpressionBuilder builder = new ExpressionBuilder(() -> scope, sourceText, configService.getFrontendConfig());
        return builder.visit(parseResult.getTree());
    }

    private SourceFile lower(String source, Map<String, Module> definitions, PreprocessingRegistry registry,
                             Map<String, List<PreprocessingInfo>> info) {
        FrontendConfig config = configService.getFrontendConfig();

        // STEP 1: parse
        log.debug("Step 1: Parsing Fortran source");
        ParseResult parseResult = parser.parseProgram(source);
        if (parseResult.hasErrors()) {
            String errorMsg = "Parse errors: " + parseResult.getErrorMessage();
            log.warn("Parse failed: {}", errorMsg);
            throw new LoweringException(errorMsg, "program", null);
        }

        // STEP 2: lower to IR
        log.debug("Step 2: Lowering parse tree ({})", config);
        SourceText sourceText = new SourceText(parseResult.getOriginalSource(), parseResult.getTokens());
        IrBuilder builder = new IrBuilder(sourceText, config, definitions != null ? definitions : Map.of());
        SourceFile ir = builder.build((FortranParser.ProgramContext) parseResult.getTree(), null);

        // STEP 3: repair what the preprocessing filters changed, then tidy comments and pragmas
        log.debug("Step 3: Post-processing IR");
        SourceFile result = (SourceFile) Sanitizer.sanitize(registry.postprocess(ir, info));

        log.info("Lowered Fortran source: {} module(s), {} subroutine(s)",
                result.getModules().size(), result.getSubroutines().size());
        return result;
    }

    private PreprocessingRegistry registry() {
        return PreprocessingRegistry.defaults()
                .retainOnly(configService.getConfigValueAsStringList(ConfigService.PREPROCESSING_RULES));
    }
}
