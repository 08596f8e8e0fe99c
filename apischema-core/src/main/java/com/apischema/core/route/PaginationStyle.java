package com.apischema.core.route;

/**
 * Families of pagination a list endpoint may use.
 */
public enum PaginationStyle {
    /** {@code ?page=N}, responses carry count/next/previous */
    PAGE_NUMBER,

    /** {@code ?limit=N&offset=M}, responses carry count/next/previous */
    LIMIT_OFFSET,

    /** Opaque {@code ?cursor=...}, responses carry next/previous only */
    CURSOR,

    /** Anything else; no envelope fields are known */
    CUSTOM
}
