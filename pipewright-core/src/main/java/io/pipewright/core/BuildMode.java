package io.pipewright.core;

/// How {@link PipelineCompiler} treats contract issues.
public enum BuildMode {
    /// Check, log every issue, and build anyway.
    ADVISORY,
    /// Check and refuse to build when any issue is an error.
    STRICT,
    /// Skip the contract checker.
    UNCHECKED;

    /// Parses a mode name case-insensitively.
    ///
    /// @param value mode name such as `strict`, not null
    /// @return the mode, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static BuildMode parse(String value) {
        for (BuildMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException(
                "Unknown build mode: " + value + ". Available: advisory, strict, unchecked");
    }
}
