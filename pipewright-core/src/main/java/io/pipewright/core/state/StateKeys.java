package io.pipewright.core.state;

/// Well-known state keys maintained by the backends.
public final class StateKeys {

    /// Text content of the most recent agent reply. Scoped, so replacing transforms keep it.
    public static final String LAST_OUTPUT = "temp:last_output";

    /// Selects the stub response scenario used by the mock backend.
    public static final String STUB_SCENARIO = "stub_scenario";

    private StateKeys() {}
}
