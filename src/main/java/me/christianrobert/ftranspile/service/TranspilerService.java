package me.christianrobert.ftranspile.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.ftranspile.codegen.CodegenException;
import me.christianrobert.ftranspile.codegen.CodegenOptions;
import me.christianrobert.ftranspile.config.service.ConfigService;
import me.christianrobert.ftranspile.frontend.context.LoweringException;
import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.SourceFile;
import me.christianrobert.ftranspile.util.IrTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Source-to-source transpilation of Fortran into one of the {@link Target} languages.
 *
 * <p>Architecture:
 * <pre>
 * Fortran Source → FortranFrontend (parse + lower) → IR → Stringifier of the target → Code
 *                         ↓                                        ↓
 *                  FortranParser + IrBuilder           FortranCodegen / MaxjCodegen / PyCodegen
 * </pre>
 *
 * <p>Failures never escape as exceptions: parse and lowering errors, code generation
 * errors and unexpected runtime errors are all reported through a failed
 * {@link TranspileResult}.</p>
 */
@ApplicationScoped
public class TranspilerService {

    private static final Logger log = LoggerFactory.getLogger(TranspilerService.class);

    @Inject
    FortranFrontend frontend;

    @Inject
    ConfigService configService;

    /**
     * Transpiles a self-contained source file.
     */
    public TranspileResult transpile(String fortranSource, Target target) {
        return transpile(fortranSource, target, new LinkedHashMap<>(), false);
    }

    /**
     * Transpiles a source file with optional IR tree output.
     *
     * <p>Modules defined by the file are added to {@code definitions}, so that a caller
     * transpiling several files in dependency order can pass the same map to each call.</p>
     *
     * @param fortranSource Fortran source text
     * @param target output language
     * @param definitions modules known from earlier files, keyed by lower-case name
     * @param includeIr whether to include the IR tree in the result (for debugging)
     * @return TranspileResult containing the generated code or error details
     */
    public TranspileResult transpile(String fortranSource, Target target, Map<String, Module> definitions,
                                     boolean includeIr) {
        if (fortranSource == null || fortranSource.trim().isEmpty()) {
            return TranspileResult.failure(fortranSource, target, "Fortran source cannot be null or empty");
        }

        if (target == null) {
            return TranspileResult.failure(fortranSource, null, "Target cannot be null");
        }

        log.debug("Transpiling Fortran source to {}", target);
        log.trace("Fortran source: {}", fortranSource);

        String irTree = null;
        try {
            // STEP 1: Parse and lower to IR
            log.debug("Step 1: Lowering Fortran source");
            SourceFile ir = frontend.parseSource(fortranSource, definitions);
            if (includeIr) {
                irTree = IrTreeFormatter.format(ir);
            }

            // STEP 2: Remember the modules for later files
            if (definitions != null) {
                for (Module module : ir.getModules()) {
                    definitions.put(module.getName().toLowerCase(Locale.ROOT), module);
                }
            }

            // STEP 3: Generate target code
            log.debug("Step 3: Generating {} code", target);
            String output = generate(ir, target);

            log.info("Successfully transpiled Fortran source to {}", target);
            return includeIr
                    ? TranspileResult.successWithIr(fortranSource, target, output, irTree)
                    : TranspileResult.success(fortranSource, target, output);

        } catch (LoweringException e) {
            log.error("Lowering failed: {}", e.getDetailedMessage(), e);
            return TranspileResult.failure(fortranSource, target, e);

        } catch (CodegenException e) {
            log.error("Code generation failed: {}", e.getDetailedMessage(), e);
            return TranspileResult.failureWithIr(fortranSource, target, e, irTree);

        } catch (Exception e) {
            log.error("Unexpected error during transpilation", e);
            return TranspileResult.failure(fortranSource, target, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Renders an IR node with the configured code generation options.
     *
     * @throws CodegenException if the target cannot express the node
     */
    public String generate(Node node, Target target) {
        CodegenOptions options = configService.getCodegenOptions();
        log.trace("Code generation options: {}", options);
        return target.generator(options).generate(node);
    }
}
