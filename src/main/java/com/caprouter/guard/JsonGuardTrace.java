package com.caprouter.guard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Diagnostic record of one guarded call: every raw reply seen, and the latest failure reason.
 */
public class JsonGuardTrace {
    private final List<String> outputs = new ArrayList<>();
    private String lastError = "";

    void addOutput(String raw) {
        outputs.add(raw);
    }

    void setLastError(String lastError) {
        this.lastError = lastError != null ? lastError : "";
    }

    public List<String> getOutputs() {
        return Collections.unmodifiableList(outputs);
    }

    public String getLastError() {
        return lastError;
    }

    public int getAttempts() {
        return outputs.size();
    }
}
