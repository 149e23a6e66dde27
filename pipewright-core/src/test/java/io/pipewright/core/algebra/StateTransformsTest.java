package io.pipewright.core.algebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pipewright.core.ir.TransformKind;
import io.pipewright.core.ir.TransformNode;
import io.pipewright.core.state.StateKeys;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StateTransforms")
class StateTransformsTest {

    private static Map<String, Object> run(Pipeline transform, Map<String, Object> state) {
        TransformNode node = (TransformNode) transform.toIr();
        Map<String, Object> result = new HashMap<>(state);
        node.function().apply(state).applyTo(result);
        return result;
    }

    @Test
    void shouldPickKeysAndKeepScopedOnes() {
        // GIVEN
        Map<String, Object> state = Map.of("a", 1, "b", 2, "temp:x", "keep");

        // WHEN
        Map<String, Object> result = run(StateTransforms.pick("a"), state);

        // THEN
        assertThat(result).containsOnlyKeys("a", "temp:x");
        TransformNode node = (TransformNode) StateTransforms.pick("a").toIr();
        assertThat(node.name()).isEqualTo("pick_a");
        assertThat(node.keyEffect().apply(Set.of("a", "b", "temp:x"))).containsExactlyInAnyOrder("a", "temp:x");
    }

    @Test
    void shouldDropKeys() {
        Map<String, Object> result = run(StateTransforms.drop("b"), Map.of("a", 1, "b", 2));

        assertThat(result).containsOnlyKeys("a");
    }

    @Test
    void shouldRenameKeysAndDeclareEffect() {
        // GIVEN
        Pipeline rename = StateTransforms.rename(Map.of("draft", "text"));

        // WHEN
        Map<String, Object> result = run(rename, Map.of("draft", "hello", "other", 1));

        // THEN
        assertThat(result).containsEntry("text", "hello").containsEntry("other", 1).doesNotContainKey("draft");
        TransformNode node = (TransformNode) rename.toIr();
        assertThat(node.keyEffect().apply(Set.of("draft", "other"))).containsExactlyInAnyOrder("text", "other");
    }

    @Test
    void shouldWriteDefaultsOnlyForMissingOrNullKeys() {
        Map<String, Object> state = new HashMap<>();
        state.put("tone", "formal");
        state.put("length", null);

        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("tone", "neutral");
        defaults.put("length", 100);
        defaults.put("lang", "en");
        Map<String, Object> result = run(StateTransforms.defaults(defaults), state);

        assertThat(result).containsEntry("tone", "formal").containsEntry("length", 100).containsEntry("lang", "en");
    }

    @Test
    void shouldMergeKeysSkippingAbsentValues() {
        Map<String, Object> result =
                run(StateTransforms.merge(List.of("a", "missing", "b"), "all", " | "), Map.of("a", "x", "b", "y"));

        assertThat(result).containsEntry("all", "x | y");
    }

    @Test
    void shouldTransformPresentKeyOnly() {
        Pipeline upper = StateTransforms.transform("name", value -> value.toString().toUpperCase());

        assertThat(run(upper, Map.of("name", "ada"))).containsEntry("name", "ADA");
        assertThat(run(upper, Map.of())).doesNotContainKey("name");
    }

    @Test
    void shouldComputeKeyFromState() {
        Pipeline total =
                StateTransforms.compute("total", state -> (Integer) state.get("a") + (Integer) state.get("b"), "a", "b");

        assertThat(run(total, Map.of("a", 2, "b", 3))).containsEntry("total", 5);
        TransformNode node = (TransformNode) total.toIr();
        assertThat(node.keyEffect().reads()).containsExactlyInAnyOrder("a", "b");
        assertThat(node.keyEffect().writes()).containsExactly("total");
    }

    @Test
    void shouldTolerateRepeatedComputeReads() {
        Pipeline doubled = StateTransforms.compute("doubled", state -> (Integer) state.get("n") * 2, "n", "n");

        assertThat(run(doubled, Map.of("n", 4))).containsEntry("doubled", 8);
        assertThat(((TransformNode) doubled.toIr()).keyEffect().reads()).containsExactly("n");
    }

    @Test
    void shouldFailGuardWhenPredicateDoesNotHold() {
        TransformNode guard =
                (TransformNode) StateTransforms.guard(state -> state.containsKey("id"), "id required").toIr();

        assertThatThrownBy(() -> guard.function().apply(Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("id required");
    }

    @Test
    void shouldCaptureLastOutput() {
        Map<String, Object> result =
                run(StateTransforms.capture("summary"), Map.of(StateKeys.LAST_OUTPUT, "done"));

        assertThat(result).containsEntry("summary", "done");
    }

    @Test
    void shouldRebuildParameterOnlyTransformsFromParams() {
        // GIVEN
        TransformNode original = (TransformNode) StateTransforms.set(Map.of("stage", "draft")).toIr();

        // WHEN
        TransformNode rebuilt = StateTransforms.rebuild(original.name(), original.kind(), original.params());

        // THEN
        assertThat(rebuilt.kind()).isEqualTo(TransformKind.SET);
        assertThat(rebuilt.keyEffect()).isEqualTo(original.keyEffect());
        assertThat(rebuilt.params()).isEqualTo(original.params());
        assertThat(rebuilt.function().apply(Map.of()).values()).containsEntry("stage", "draft");
    }

    @Test
    void shouldRebuildRenameFromUntypedParams() {
        // GIVEN
        TransformNode original = (TransformNode) StateTransforms.rename(Map.of("draft", "text")).toIr();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("mapping", new LinkedHashMap<>(Map.of("draft", "text")));

        // WHEN
        TransformNode rebuilt = StateTransforms.rebuild(original.name(), TransformKind.RENAME, params);

        // THEN
        assertThat(rebuilt.keyEffect()).isEqualTo(original.keyEffect());
        assertThat(run(Pipeline.of(rebuilt), Map.of("draft", "hello"))).containsEntry("text", "hello").doesNotContainKey("draft");
    }

    @Test
    void shouldRefuseToRebuildUserCodeTransforms() {
        assertThatThrownBy(() -> StateTransforms.rebuild("guard", TransformKind.GUARD, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("wraps user code");
    }
}
