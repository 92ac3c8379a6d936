package dev.aparikh.mailindex.search;

/**
 * Page window over the date-ordered listing.
 */
public record ListQuery(int page, int size) {
    public ListQuery {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0");
        }
    }

    public long offset() {
        return (long) page * size;
    }

    public int totalPages(long totalCount) {
        return (int) Math.ceil((double) totalCount / size);
    }
}
