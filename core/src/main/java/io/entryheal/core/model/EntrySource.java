package io.entryheal.core.model;

/** Where the entry handed back by a strategy came from. */
public enum EntrySource {
    /** The caller's current-schema bytes. */
    LOCAL,

    /** The legacy bridge, after transformation. */
    LEGACY_BRIDGE,

    /** The caller's bytes, returned without inspection. */
    PASSTHROUGH
}
