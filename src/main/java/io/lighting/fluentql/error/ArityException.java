package io.lighting.fluentql.error;

public final class ArityException extends TypeCheckException {
    private final int expectedCount;
    private final int actualCount;

    public ArityException(String functionName, int expectedCount, int actualCount) {
        super(
            functionName,
            functionName + " expects " + expectedCount + " argument(s), found " + actualCount
        );
        this.expectedCount = expectedCount;
        this.actualCount = actualCount;
    }

    public int expectedCount() {
        return expectedCount;
    }

    public int actualCount() {
        return actualCount;
    }
}
