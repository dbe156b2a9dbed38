package com.eventharvester.model;

/**
 * Structural shape of a listing page, deciding which sub-parser handles it.
 */
public enum PageShape {
    /** Repeated event cards located with the container/field selector chain. */
    SELECTOR_CHAIN,
    /** Free-form prose blocks: dates, times and titles on consecutive lines. */
    PLAIN_TEXT,
    /** One record per line, cells separated by '|'. */
    PIPE_DELIMITED,
    /** Table rows with a date cell and a cell of mixed inline details. */
    INLINE_TABLE,
    /** DOM built by scripts; needs the rendered page loader, then the selector chain. */
    SCRIPT_RENDERED
}
