package io.pipewright.core.ir;

import io.pipewright.core.state.StateUpdate;
import java.util.LinkedHashSet;
import java.util.Set;

/// Static description of how a transform changes the set of available state keys.
///
/// `after = ((before ∩ retains) − removes) ∪ writes`, where a null `retains` keeps every
/// key. Scoped keys (`app:`, `user:`, `temp:`) always survive `retains`.
///
/// @param reads keys the transform reads, not null
/// @param writes keys the transform guarantees to write, not null
/// @param removes keys the transform removes, not null
/// @param retains keys kept by a replacing transform, null if the transform only adds
public record KeyEffect(Set<String> reads, Set<String> writes, Set<String> removes, Set<String> retains) {

    public static final KeyEffect NONE = new KeyEffect(Set.of(), Set.of(), Set.of(), null);

    public KeyEffect {
        reads = reads != null ? Set.copyOf(reads) : Set.of();
        writes = writes != null ? Set.copyOf(writes) : Set.of();
        removes = removes != null ? Set.copyOf(removes) : Set.of();
        retains = retains != null ? Set.copyOf(retains) : null;
    }

    public static KeyEffect reading(Set<String> reads) {
        return new KeyEffect(reads, Set.of(), Set.of(), null);
    }

    public static KeyEffect readWrite(Set<String> reads, Set<String> writes) {
        return new KeyEffect(reads, writes, Set.of(), null);
    }

    /// Applies this effect to an availability set.
    ///
    /// @param before keys available before the transform, not null
    /// @return keys available after, never null
    public Set<String> apply(Set<String> before) {
        Set<String> after = new LinkedHashSet<>();
        for (String key : before) {
            if (retains == null || retains.contains(key) || StateUpdate.isScoped(key)) {
                after.add(key);
            }
        }
        after.removeAll(removes);
        after.addAll(writes);
        return after;
    }
}
