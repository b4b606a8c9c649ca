package com.github.rewrite.query.java;

import lombok.Value;

import java.util.List;

/**
 * Stream pipeline statement that can replace a loop, with the imports it still needs.
 */
@Value
public class StreamSuggestion {

    String code;

    /**
     * Fully qualified names of classes the code uses by simple name and the compilation unit does not import.
     */
    List<String> missingImports;

    public String describe() {
        if (missingImports.isEmpty()) {
            return code;
        }
        return code + " [requires import " + String.join(", ", missingImports) + "]";
    }
}
