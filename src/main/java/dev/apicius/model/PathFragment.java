package dev.apicius.model;

import java.util.List;
import java.util.Objects;

/**
 * One rule of a recipe as a raw chain: {@code start -> body... -> end}.
 */
public record PathFragment(
    FragmentStart start,
    List<BodyElement> body,
    FragmentEnd end,
    SourceSpan span
) {
    public PathFragment {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        body = List.copyOf(body);
        span = span == null ? SourceSpan.UNKNOWN : span;
    }

    public PathFragment(FragmentStart start, List<BodyElement> body, FragmentEnd end) {
        this(start, body, end, SourceSpan.UNKNOWN);
    }
}
