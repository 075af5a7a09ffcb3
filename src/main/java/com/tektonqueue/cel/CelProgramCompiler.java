package com.tektonqueue.cel;

import com.tektonqueue.exception.CompilationException;
import dev.cel.common.CelAbstractSyntaxTree;
import dev.cel.common.CelValidationException;
import dev.cel.common.types.CelKind;
import dev.cel.common.types.CelType;
import dev.cel.common.types.ListType;
import dev.cel.common.types.MapType;
import dev.cel.runtime.CelEvaluationException;
import dev.cel.runtime.CelRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compiles policy expressions into reusable, type-checked programs.
 * <p>
 * An expression must statically return either one mutation-shaped map
 * ({@code map<string, *>}) or a list of them. Compilation is all-or-nothing:
 * the first failing expression aborts the whole call.
 */
public final class CelProgramCompiler {

    private static final Logger log = LoggerFactory.getLogger(CelProgramCompiler.class);

    private CelProgramCompiler() {
    }

    /**
     * Compile a list of expressions, preserving order.
     *
     * @param expressions expression sources, must be non-empty and contain no blank entries
     * @return one compiled program per expression
     * @throws CompilationException if any expression fails to compile
     */
    public static List<CompiledProgram> compile(List<String> expressions) {
        if (expressions == null || expressions.isEmpty()) {
            throw new CompilationException("expressions list cannot be empty");
        }

        List<CompiledProgram> programs = new ArrayList<>(expressions.size());
        for (int i = 0; i < expressions.size(); i++) {
            String expression = expressions.get(i);
            if (expression == null || expression.isBlank()) {
                throw new CompilationException("expression " + i + " cannot be empty");
            }
            try {
                programs.add(compileSingleExpression(expression));
            } catch (CompilationException e) {
                throw new CompilationException(
                        "failed to compile expression " + i + " (\"" + expression + "\"): " + e.getMessage(), e);
            }
        }

        log.debug("Compiled {} CEL expressions", programs.size());
        return Collections.unmodifiableList(programs);
    }

    /**
     * Whether a static type is an accepted expression result:
     * {@code map<string, *>} or {@code list<map<string, *>>}.
     */
    static boolean isValidOutputType(CelType type) {
        if (type instanceof MapType mapType) {
            return isMutationShaped(mapType);
        }
        if (type instanceof ListType listType) {
            return listType.elemType() instanceof MapType elemType && isMutationShaped(elemType);
        }
        return false;
    }

    private static boolean isMutationShaped(MapType mapType) {
        return mapType.keyType().kind() == CelKind.STRING;
    }

    private static CompiledProgram compileSingleExpression(String expression) {
        CelAbstractSyntaxTree ast;
        try {
            ast = CelEnvironment.COMPILER.compile(expression).getAst();
        } catch (CelValidationException e) {
            throw new CompilationException(
                    "type checking failed for expression \"" + expression + "\": " + e.getMessage(), e);
        }

        CelType resultType = ast.getResultType();
        if (!isValidOutputType(resultType)) {
            throw new CompilationException("invalid return type for expression \"" + expression
                    + "\": expression must return MutationRequest-compatible map<string, any> "
                    + "or list<map<string, any>>, got " + resultType);
        }

        CelRuntime.Program program;
        try {
            program = CelEnvironment.RUNTIME.createProgram(ast);
        } catch (CelEvaluationException e) {
            throw new CompilationException(
                    "program creation failed for expression \"" + expression + "\": " + e.getMessage(), e);
        }
        return new CompiledProgram(expression, ast, program);
    }
}
