package com.rowguard.fallback;

/**
 * Marker recorded on a plan node that must not be offloaded.
 *
 * <p>{@link Unsupported} is the only kind the engine produces. The store refuses to
 * merge any other kind with an existing tag.
 */
public interface FallbackTag {

    /**
     * Returns a human-readable rendering of the fallback reason.
     *
     * @return the reason, or a placeholder when none was recorded
     */
    String describe();
}
