package com.openforge.mcpchat.selection;

public enum SelectionMode {

    /** User pins were present; exactly the pinned tools. */
    PINNED,

    /** Ranked by the semantic scorer. */
    SEMANTIC,

    /** Everything the catalog has, capped. */
    FALLBACK
}
