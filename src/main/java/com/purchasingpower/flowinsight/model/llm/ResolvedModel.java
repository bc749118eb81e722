package com.purchasingpower.flowinsight.model.llm;

/**
 * Concrete provider, model and temperature chosen for a call.
 */
public record ResolvedModel(String provider, String modelName, double temperature) {

    @Override
    public String toString() {
        return provider + "/" + modelName + " (t=" + temperature + ")";
    }
}
