package com.crave.search.query;

/**
 * Offset/limit pair applied to a data statement.
 */
public final class PageWindow {
    private final int skip;
    private final int take;

    public PageWindow(int skip, int take) {
        this.skip = Math.max(0, skip);
        this.take = Math.max(0, take);
    }

    public static PageWindow forPage(int page, int pageSize) {
        return new PageWindow((Math.max(1, page) - 1) * pageSize, pageSize);
    }

    public int getSkip() {
        return skip;
    }

    public int getTake() {
        return take;
    }

    @Override
    public String toString() {
        return "PageWindow{skip=" + skip + ", take=" + take + '}';
    }
}
