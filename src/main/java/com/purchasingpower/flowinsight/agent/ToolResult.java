package com.purchasingpower.flowinsight.agent;

/**
 * Result from an investigation tool.
 *
 * <p>Both outcomes carry text for the model. A lookup miss is a normal
 * result with {@code success == false}, never an exception.
 *
 * @since 1.0.0
 */
public interface ToolResult {

    boolean isSuccess();

    /**
     * Text handed back to the model.
     */
    String getOutput();

    static ToolResult success(String output) {
        return new ToolResultImpl(true, output);
    }

    static ToolResult failure(String output) {
        return new ToolResultImpl(false, output);
    }
}

record ToolResultImpl(boolean isSuccess, String output) implements ToolResult {

    @Override
    public boolean isSuccess() {
        return isSuccess;
    }

    @Override
    public String getOutput() {
        return output;
    }
}
