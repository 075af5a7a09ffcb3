package com.tektonqueue.cel;

import com.tektonqueue.exception.CompilationException;
import dev.cel.common.types.ListType;
import dev.cel.common.types.MapType;
import dev.cel.common.types.SimpleType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CelProgramCompiler.
 */
class CelProgramCompilerTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "annotation('tekton.dev/note', 'hello')",
            "label('env', 'prod')",
            "priority('konflux-default')",
            "resource('aws-vm-x', 1000)",
            "[annotation('a', 'b'), label('c', 'd'), resource('e', 1)]",
            "{'type': 'label', 'key': 'env', 'value': 'prod'}",
            "plrNamespace == 'mintmaker' ? priority('konflux-dependency-update') : priority('konflux-default')",
            "annotation('kueue.konflux-ci.dev/requests-' + replace('linux/amd64', '/', '-'), '1')"
    })
    @DisplayName("Should compile mutation-shaped expressions")
    void shouldCompileValidExpressions(String expression) {
        List<CompiledProgram> programs = CelProgramCompiler.compile(List.of(expression));

        assertEquals(1, programs.size());
        assertEquals(expression, programs.get(0).getExpression());
    }

    @Test
    @DisplayName("Should compile the production policies in order")
    void shouldCompileProductionPolicies() {
        List<String> expressions = List.of(
                PolicyExpressions.BUILD_PLATFORMS,
                PolicyExpressions.OLD_STYLE_PLATFORMS,
                PolicyExpressions.COMPLEX_PRIORITY);

        List<CompiledProgram> programs = CelProgramCompiler.compile(expressions);

        assertEquals(3, programs.size());
        for (int i = 0; i < expressions.size(); i++) {
            assertEquals(expressions.get(i), programs.get(i).getExpression());
        }
    }

    @Test
    @DisplayName("Should reject a null or empty expression list")
    void shouldRejectEmptyList() {
        assertEquals("expressions list cannot be empty",
                assertThrows(CompilationException.class, () -> CelProgramCompiler.compile(List.of())).getMessage());
        assertEquals("expressions list cannot be empty",
                assertThrows(CompilationException.class, () -> CelProgramCompiler.compile(null)).getMessage());
    }

    @Test
    @DisplayName("Should reject blank expressions by index")
    void shouldRejectBlankExpression() {
        List<String> expressions = Arrays.asList("priority('a')", "   ");

        CompilationException e = assertThrows(CompilationException.class,
                () -> CelProgramCompiler.compile(expressions));
        assertEquals("expression 1 cannot be empty", e.getMessage());
    }

    @Test
    @DisplayName("Should report syntax errors with index and source")
    void shouldReportSyntaxErrors() {
        String expression = "priority('a'";

        CompilationException e = assertThrows(CompilationException.class,
                () -> CelProgramCompiler.compile(List.of("priority('ok')", expression)));

        assertTrue(e.getMessage().startsWith("failed to compile expression 1 (\"" + expression + "\"): "
                + "type checking failed for expression \"" + expression + "\": "), e.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "undeclared == 'x' ? priority('a') : priority('b')",
            "unknownFunction('x')",
            "annotation('only-key')",
            "resource('key', 'not-an-int')"
    })
    @DisplayName("Should reject expressions that fail type checking")
    void shouldRejectTypeErrors(String expression) {
        CompilationException e = assertThrows(CompilationException.class,
                () -> CelProgramCompiler.compile(List.of(expression)));

        assertTrue(e.getMessage().contains("type checking failed"), e.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {"'just a string'", "42", "true", "['a', 'b']", "{1: 'x'}"})
    @DisplayName("Should reject expressions with a non-mutation result type")
    void shouldRejectWrongReturnType(String expression) {
        CompilationException e = assertThrows(CompilationException.class,
                () -> CelProgramCompiler.compile(List.of(expression)));

        assertTrue(e.getMessage().startsWith("failed to compile expression 0 (\"" + expression + "\"): "
                + "invalid return type for expression \"" + expression + "\": expression must return "
                + "MutationRequest-compatible map<string, any> or list<map<string, any>>, got "), e.getMessage());
    }

    @Test
    @DisplayName("Should return no programs when one expression fails")
    void shouldFailFast() {
        List<String> expressions = new ArrayList<>(List.of("priority('a')", "label('b', 'c')", "'oops'"));

        assertThrows(CompilationException.class, () -> CelProgramCompiler.compile(expressions));
    }

    @Test
    @DisplayName("Should accept only string-keyed maps and lists of them")
    void shouldClassifyOutputTypes() {
        MapType mutation = MapType.create(SimpleType.STRING, SimpleType.DYN);

        assertTrue(CelProgramCompiler.isValidOutputType(mutation));
        assertTrue(CelProgramCompiler.isValidOutputType(MapType.create(SimpleType.STRING, SimpleType.STRING)));
        assertTrue(CelProgramCompiler.isValidOutputType(ListType.create(mutation)));

        assertFalse(CelProgramCompiler.isValidOutputType(MapType.create(SimpleType.INT, SimpleType.DYN)));
        assertFalse(CelProgramCompiler.isValidOutputType(ListType.create(SimpleType.STRING)));
        assertFalse(CelProgramCompiler.isValidOutputType(ListType.create(ListType.create(mutation))));
        assertFalse(CelProgramCompiler.isValidOutputType(SimpleType.STRING));
        assertFalse(CelProgramCompiler.isValidOutputType(SimpleType.DYN));
    }
}
