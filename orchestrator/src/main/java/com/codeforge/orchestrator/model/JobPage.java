package com.codeforge.orchestrator.model;

import java.util.List;

/**
 * One page of a project's jobs, newest first. Pages are 1-based.
 */
public record JobPage(List<Job> jobs, int page, int pageSize, long total) {

    public static final int MAX_PAGE_SIZE = 100;

    public JobPage {
        jobs = List.copyOf(jobs);
    }

    public boolean hasNext() {
        return (long) page * pageSize < total;
    }

    /** Zero-based index of the first item on {@code page}. */
    public static long offset(int page, int pageSize) {
        checkBounds(page, pageSize);
        return (long) (page - 1) * pageSize;
    }

    public static void checkBounds(int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1, was " + page);
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException(
                    "pageSize must be between 1 and " + MAX_PAGE_SIZE + ", was " + pageSize);
        }
    }
}
