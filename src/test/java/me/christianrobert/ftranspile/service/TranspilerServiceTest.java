package me.christianrobert.ftranspile.service;

import me.christianrobert.ftranspile.config.service.ConfigService;
import me.christianrobert.ftranspile.frontend.parser.AntlrParser;
import me.christianrobert.ftranspile.ir.Module;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for end-to-end transpilation and the reporting of failures.
 */
class TranspilerServiceTest {

    private static final String INCREMENT = """
            subroutine foo(x)
              integer, intent(inout) :: x
              x = x + 1
            end subroutine foo
            """;

    private TranspilerService service;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();

        FortranFrontend frontend = new FortranFrontend();
        frontend.parser = new AntlrParser();
        frontend.configService = configService;

        service = new TranspilerService();
        service.frontend = frontend;
        service.configService = configService;
    }

    // ========== SUCCESS ==========

    @Test
    void fortranRoundTrip() {
        TranspileResult result = service.transpile(INCREMENT, Target.FORTRAN);

        assertTrue(result.isSuccess(), result::getErrorMessage);
        assertEquals(Target.FORTRAN, result.getTarget());
        assertTrue(result.getOutput().contains("SUBROUTINE foo(x)"));
        assertTrue(result.getOutput().contains("x = x + 1"));
        assertFalse(result.hasIrTree());
    }

    @Test
    void pythonOutput() {
        TranspileResult result = service.transpile(INCREMENT, Target.PYTHON);

        assertTrue(result.isSuccess(), result::getErrorMessage);
        assertTrue(result.getOutput().startsWith("import numpy as np"));
        assertTrue(result.getOutput().contains("def foo(x: np.int32):"));
    }

    @Test
    void maxjOutput() {
        TranspileResult result = service.transpile(INCREMENT, Target.MAXJ);

        assertTrue(result.isSuccess(), result::getErrorMessage);
        assertTrue(result.getOutput().contains("foo(int x) {"));
        assertTrue(result.getOutput().contains("x = x + 1;"));
    }

    @Test
    void irTreeIsIncludedOnRequest() {
        TranspileResult result = service.transpile(INCREMENT, Target.FORTRAN, new HashMap<>(), true);

        assertTrue(result.isSuccess(), result::getErrorMessage);
        assertTrue(result.hasIrTree());
        assertTrue(result.getIrTree().contains("Subroutine"));
        assertTrue(result.toString().contains("hasIrTree=true"));
    }

    @Test
    void codegenOptionsComeFromConfiguration() {
        configService.setConfigValue(ConfigService.CONSERVATIVE, true);

        TranspileResult result = service.transpile("""
                subroutine foo(x)
                  integer :: x
                  x=x+1
                end subroutine foo
                """, Target.FORTRAN);

        assertTrue(result.isSuccess(), result::getErrorMessage);
        assertTrue(result.getOutput().contains("x=x+1"));
    }

    // ========== DEFINITIONS ==========

    @Test
    void modulesAreRememberedAcrossCalls() {
        // Given
        Map<String, Module> definitions = new HashMap<>();

        // When
        TranspileResult first = service.transpile("""
                module constants
                  integer, parameter :: nlev = 3
                end module constants
                """, Target.FORTRAN, definitions, false);
        TranspileResult second = service.transpile("""
                subroutine foo(x)
                  use constants, only: nlev
                  integer :: x
                  x = nlev
                end subroutine foo
                """, Target.FORTRAN, definitions, false);

        // Then
        assertTrue(first.isSuccess(), first::getErrorMessage);
        assertTrue(definitions.containsKey("constants"));
        assertTrue(second.isSuccess(), second::getErrorMessage);
        assertTrue(second.getOutput().contains("USE constants, ONLY: nlev"), second.getOutput());
    }

    // ========== FAILURES ==========

    @Test
    void parseErrorBecomesFailure() {
        TranspileResult result = service.transpile("""
                subroutine foo(
                end subroutine foo
                """, Target.FORTRAN);

        assertTrue(result.isFailure());
        assertNull(result.getOutput());
        assertTrue(result.getErrorMessage().startsWith("Parse errors"), result.getErrorMessage());
    }

    @Test
    void blankSourceIsRejected() {
        TranspileResult result = service.transpile("   ", Target.PYTHON);

        assertTrue(result.isFailure());
        assertEquals("Fortran source cannot be null or empty", result.getErrorMessage());
    }

    @Test
    void missingTargetIsRejected() {
        TranspileResult result = service.transpile(INCREMENT, null);

        assertTrue(result.isFailure());
        assertNull(result.getTarget());
    }

    @Test
    void codegenFailureKeepsIrTree() {
        // Given: MaxJ modules must be named after a kernel or manager
        String source = """
                module helpers
                  integer :: counter
                end module helpers
                """;

        // When
        TranspileResult result = service.transpile(source, Target.MAXJ, new HashMap<>(), true);

        // Then
        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().startsWith("MaxJ code generation failed"), result.getErrorMessage());
        assertTrue(result.hasIrTree());
    }
}
