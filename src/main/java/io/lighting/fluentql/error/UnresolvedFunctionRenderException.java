package io.lighting.fluentql.error;

import java.util.Objects;

public final class UnresolvedFunctionRenderException extends CompileException {
    private final String functionName;

    public UnresolvedFunctionRenderException(String dialectId, String functionName) {
        super(dialectId, "No render rule for function " + functionName);
        this.functionName = Objects.requireNonNull(functionName, "functionName");
    }

    public String functionName() {
        return functionName;
    }
}
