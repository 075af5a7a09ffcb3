package com.tektonqueue.cel;

import com.tektonqueue.variable.PipelineRunVariables;
import dev.cel.common.CelFunctionDecl;
import dev.cel.common.CelOptions;
import dev.cel.common.CelOverloadDecl;
import dev.cel.common.types.CelType;
import dev.cel.common.types.MapType;
import dev.cel.common.types.SimpleType;
import dev.cel.compiler.CelCompiler;
import dev.cel.compiler.CelCompilerFactory;
import dev.cel.parser.CelStandardMacro;
import dev.cel.runtime.CelRuntime;
import dev.cel.runtime.CelRuntime.CelFunctionBinding;
import dev.cel.runtime.CelRuntimeFactory;

import java.util.List;

/**
 * Typed CEL environment for PipelineRun mutation policies.
 * <p>
 * Declares the variables of {@link PipelineRunVariables} and the mutation functions of
 * {@link MutationFunctions} on top of the CEL standard library and macros. Compiler and
 * runtime are immutable and shared by every compiled program.
 */
final class CelEnvironment {

    /**
     * Static type returned by every mutation constructor.
     */
    static final CelType MUTATION_TYPE = MapType.create(SimpleType.STRING, SimpleType.DYN);

    private static final String ANNOTATION_OVERLOAD = "annotation_string_string_to_mutation";
    private static final String LABEL_OVERLOAD = "label_string_string_to_mutation";
    private static final String PRIORITY_OVERLOAD = "priority_string_to_mutation";
    private static final String RESOURCE_OVERLOAD = "resource_string_int_to_mutation";
    private static final String REPLACE_OVERLOAD = "replace_string_string_string_to_string";

    private static final CelOptions CEL_OPTIONS = CelOptions.newBuilder().build();

    static final CelCompiler COMPILER = CelCompilerFactory.standardCelCompilerBuilder()
            .setOptions(CEL_OPTIONS)
            .setStandardMacros(CelStandardMacro.STANDARD_MACROS)
            .addVar(PipelineRunVariables.PIPELINE_RUN, MapType.create(SimpleType.STRING, SimpleType.DYN))
            .addVar(PipelineRunVariables.PLR_NAMESPACE, SimpleType.STRING)
            .addVar(PipelineRunVariables.PAC_EVENT_TYPE, SimpleType.STRING)
            .addVar(PipelineRunVariables.PAC_TEST_EVENT_TYPE, SimpleType.STRING)
            .addFunctionDeclarations(
                    mutationFunction(MutationFunctions.ANNOTATION, ANNOTATION_OVERLOAD,
                            SimpleType.STRING, SimpleType.STRING),
                    mutationFunction(MutationFunctions.LABEL, LABEL_OVERLOAD,
                            SimpleType.STRING, SimpleType.STRING),
                    mutationFunction(MutationFunctions.PRIORITY, PRIORITY_OVERLOAD,
                            SimpleType.STRING),
                    mutationFunction(MutationFunctions.RESOURCE, RESOURCE_OVERLOAD,
                            SimpleType.STRING, SimpleType.INT),
                    CelFunctionDecl.newFunctionDeclaration(
                            MutationFunctions.REPLACE,
                            CelOverloadDecl.newGlobalOverload(
                                    REPLACE_OVERLOAD,
                                    SimpleType.STRING,
                                    SimpleType.STRING, SimpleType.STRING, SimpleType.STRING)))
            .build();

    static final CelRuntime RUNTIME = CelRuntimeFactory.standardCelRuntimeBuilder()
            .setOptions(CEL_OPTIONS)
            .addFunctionBindings(
                    CelFunctionBinding.from(
                            ANNOTATION_OVERLOAD, String.class, String.class, MutationFunctions::annotation),
                    CelFunctionBinding.from(
                            LABEL_OVERLOAD, String.class, String.class, MutationFunctions::label),
                    CelFunctionBinding.from(
                            PRIORITY_OVERLOAD, String.class, MutationFunctions::priority),
                    CelFunctionBinding.from(
                            RESOURCE_OVERLOAD, String.class, Long.class, MutationFunctions::resource),
                    CelFunctionBinding.from(
                            REPLACE_OVERLOAD,
                            List.<Class<?>>of(String.class, String.class, String.class),
                            args -> MutationFunctions.replace(
                                    (String) args[0], (String) args[1], (String) args[2])))
            .build();

    private CelEnvironment() {
    }

    private static CelFunctionDecl mutationFunction(String name, String overloadId, CelType... parameterTypes) {
        return CelFunctionDecl.newFunctionDeclaration(
                name,
                CelOverloadDecl.newGlobalOverload(overloadId, MUTATION_TYPE, parameterTypes));
    }
}
