package com.rowguard.fallback;

import java.util.Objects;
import java.util.Optional;

/**
 * Tag marking a node as not offloadable.
 *
 * <p>An appendable tag accepts further reasons; a locked tag keeps its reason and ignores
 * later ones. See {@link FallbackTagStore#tag} for the merge rules.
 *
 * @param reason why the node falls back, if known
 * @param locked whether later reasons are ignored
 */
public record Unsupported(Optional<String> reason, boolean locked) implements FallbackTag {

    static final String REASON_NOT_RECORDED = "Reason not recorded";

    public Unsupported {
        Objects.requireNonNull(reason, "reason must not be null");
    }

    public static Unsupported appendable(String reason) {
        return new Unsupported(Optional.of(reason), false);
    }

    public static Unsupported locked(String reason) {
        return new Unsupported(Optional.of(reason), true);
    }

    public static Unsupported withoutReason() {
        return new Unsupported(Optional.empty(), false);
    }

    @Override
    public String describe() {
        return reason.orElse(REASON_NOT_RECORDED);
    }
}
