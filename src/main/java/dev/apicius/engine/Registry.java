package dev.apicius.engine;

import dev.apicius.model.TextHandle;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Interned text for one recipe compilation. Handles are dense indices into
 * an append-only table, so equal text always yields the same handle.
 *
 * <p>Handles carry no provenance: resolving a handle minted by another
 * registry is a programming error. Out-of-range handles are rejected with
 * {@link IllegalStateException}; in-range foreign handles cannot be detected.
 */
public final class Registry {
    private final Map<String, TextHandle> handles;
    private final List<String> texts;

    public Registry() {
        this.handles = new HashMap<>();
        this.texts = new ArrayList<>();
    }

    /**
     * Return the handle for {@code text}, allocating one on first sight.
     */
    public TextHandle intern(String text) {
        Objects.requireNonNull(text, "text");
        TextHandle existing = handles.get(text);
        if (existing != null) {
            return existing;
        }
        var handle = new TextHandle(texts.size());
        texts.add(text);
        handles.put(text, handle);
        return handle;
    }

    /**
     * Look up the text behind a handle.
     *
     * @throws IllegalStateException if the handle was not minted by this registry
     */
    public String resolve(TextHandle handle) {
        if (handle.index() >= texts.size()) {
            throw new IllegalStateException(
                "Handle %d was not issued by this registry (%d entries)".formatted(handle.index(), texts.size()));
        }
        return texts.get(handle.index());
    }

    /** Look up a handle without allocating. */
    public TextHandle lookup(String text) {
        return handles.get(text);
    }

    public int size() {
        return texts.size();
    }
}
