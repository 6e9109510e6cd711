package me.christianrobert.ftranspile.lint;

import me.christianrobert.ftranspile.codegen.CodegenTestBase;
import me.christianrobert.ftranspile.ir.Comment;
import me.christianrobert.ftranspile.ir.Module;
import me.christianrobert.ftranspile.ir.SourceFile;
import me.christianrobert.ftranspile.ir.Subroutine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rule dispatch and configuration in {@link Linter}.
 */
class LinterTest extends CodegenTestBase {

    private static final String SOURCE = """
            module physics
            contains
              subroutine step(a, b, c, d)
                real :: a, b, c, d
                a = b
              end subroutine step
            end module physics
            subroutine driver(x)
              real :: x
              call inner(x)
            contains
              subroutine inner(y)
                real :: y
                y = 0.0
              end subroutine inner
            end subroutine driver
            """;

    /**
     * Flags routines with too many arguments and records the order of visits.
     */
    private static class ArgumentCountRule extends GenericRule {

        final List<String> visits = new ArrayList<>();

        @Override
        public RuleType getType() {
            return RuleType.WARN;
        }

        @Override
        public String getTitle() {
            return "argument-count";
        }

        @Override
        public Map<String, Object> getDefaultConfig() {
            return Map.of("max-args", 3);
        }

        @Override
        protected void checkFile(SourceFile file, RuleReport report, Map<String, Object> config) {
            visits.add("file");
        }

        @Override
        protected void checkModule(Module module, RuleReport report, Map<String, Object> config) {
            visits.add("module " + module.getName());
        }

        @Override
        protected void checkSubroutine(Subroutine subroutine, RuleReport report, Map<String, Object> config) {
            visits.add("routine " + subroutine.getName());
            int max = (Integer) config.get("max-args");
            if (subroutine.getArgnames().size() > max) {
                report.add("Too many arguments in " + subroutine.getName(), subroutine);
            }
        }
    }

    private ArgumentCountRule rule;
    private SourceFile file;

    @BeforeEach
    void setUp() {
        rule = new ArgumentCountRule();
        file = lower(SOURCE);
    }

    @Test
    void everyUnitIsVisitedOnceInOrder() {
        new Linter(List.of(rule), null).check(file);

        assertEquals(List.of("file", "module physics", "routine step", "routine driver", "routine inner"),
                rule.visits);
    }

    @Test
    void defaultConfigurationApplies() {
        // When
        List<RuleReport> reports = new Linter(List.of(rule), null).check(file);

        // Then
        assertEquals(1, reports.size());
        RuleReport report = reports.get(0);
        assertSame(rule, report.getRule());
        assertEquals(1, report.getProblems().size());
        RuleReport.Problem problem = report.getProblems().get(0);
        assertEquals(3, problem.getLine());
        assertEquals("line 3: Too many arguments in step", problem.toString());
    }

    @Test
    void overridesReplaceDefaults() {
        List<RuleReport> reports = new Linter(List.of(rule),
                Map.of("argument-count", Map.<String, Object>of("max-args", 4))).check(file);

        assertTrue(reports.get(0).isEmpty());
    }

    @Test
    void onlyProgramUnitsCanBeChecked() {
        RuleReport report = new RuleReport(rule, "x.f90");

        assertThrows(IllegalArgumentException.class,
                () -> rule.check(new Comment("! note", null), report, Map.of()));
    }

    @Test
    void problemWithoutLocationHasNoLine() {
        RuleReport report = new RuleReport(rule, "x.f90");

        report.add("file-wide", null);

        assertEquals(-1, report.getProblems().get(0).getLine());
        assertEquals("file-wide", report.getProblems().get(0).toString());
        assertTrue(RuleType.SERIOUS.isAtLeast(RuleType.WARN));
        assertFalse(RuleType.INFO.isAtLeast(RuleType.WARN));
    }
}
