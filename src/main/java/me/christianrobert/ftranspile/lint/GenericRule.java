package me.christianrobert.ftranspile.lint;

import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.SourceFile;
import me.christianrobert.ftranspile.ir.Subroutine;

import java.util.Collections;
import java.util.Map;

/**
 * Base class of linter rules.
 *
 * <p>A rule declares its {@link RuleType}, a title and optional configuration defaults,
 * and overrides only the entry points it needs. {@link #check} dispatches over a
 * source file, module or subroutine:</p>
 * <pre>
 * SourceFile → checkFile, then every module and every top-level routine
 * Module     → checkModule, then every contained routine
 * Subroutine → checkSubroutine, then every member routine
 * </pre>
 * <p>Each program unit is visited exactly once.</p>
 */
public abstract class GenericRule {

    public abstract RuleType getType();

    public abstract String getTitle();

    /**
     * Configuration options of the rule with their default values.
     */
    public Map<String, Object> getDefaultConfig() {
        return Collections.emptyMap();
    }

    public boolean isFixable() {
        return false;
    }

    protected void checkFile(SourceFile file, RuleReport report, Map<String, Object> config) {
    }

    protected void checkModule(Module module, RuleReport report, Map<String, Object> config) {
    }

    protected void checkSubroutine(Subroutine subroutine, RuleReport report, Map<String, Object> config) {
    }

    /**
     * Runs the rule on a source file, module or subroutine and everything below it.
     *
     * @throws IllegalArgumentException for any other node kind
     */
    public final void check(Node unit, RuleReport report, Map<String, Object> config) {
        if (unit instanceof SourceFile) {
            SourceFile file = (SourceFile) unit;
            checkFile(file, report, config);
            for (Module module : file.getModules()) {
                check(module, report, config);
            }
            for (Subroutine subroutine : file.getSubroutines()) {
                check(subroutine, report, config);
            }
        } else if (unit instanceof Module) {
            Module module = (Module) unit;
            checkModule(module, report, config);
            for (Subroutine subroutine : module.getSubroutines()) {
                check(subroutine, report, config);
            }
        } else if (unit instanceof Subroutine) {
            Subroutine subroutine = (Subroutine) unit;
            checkSubroutine(subroutine, report, config);
            for (Subroutine member : subroutine.getSubroutines()) {
                check(member, report, config);
            }
        } else {
            throw new IllegalArgumentException("Rules can only check source files, modules and subroutines, not "
                    + unit);
        }
    }
}
