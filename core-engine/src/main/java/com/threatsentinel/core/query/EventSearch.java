package com.threatsentinel.core.query;

import java.util.Objects;

/**
 * Free-text search with filtering, sorting and pagination.
 *
 * <p>
 * {@code text} matches case-insensitively against the event message and the
 * rendered metadata. {@code sortBy} is any field path accepted by
 * {@link com.threatsentinel.core.model.SecurityEvent#resolve(String)};
 * the default is {@code timestamp}, newest first.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventSearch {

    public static final String DEFAULT_SORT = "timestamp";

    private final String text;
    private final EventFilter filter;
    private final String sortBy;
    private final boolean ascending;
    private final int offset;
    private final int limit;

    private EventSearch(Builder builder) {
        this.text = builder.text;
        this.filter = builder.filter;
        this.sortBy = builder.sortBy;
        this.ascending = builder.ascending;
        this.offset = builder.offset;
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getText() {
        return text;
    }

    public EventFilter getFilter() {
        return filter;
    }

    public String getSortBy() {
        return sortBy;
    }

    public boolean isAscending() {
        return ascending;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * @return page size, or {@code 0} for no limit
     */
    public int getLimit() {
        return limit;
    }

    public static class Builder {
        private String text;
        private EventFilter filter = EventFilter.all();
        private String sortBy = DEFAULT_SORT;
        private boolean ascending;
        private int offset;
        private int limit;

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder filter(EventFilter filter) {
            this.filter = Objects.requireNonNull(filter, "EventFilter must not be null");
            return this;
        }

        public Builder sortBy(String sortBy, boolean ascending) {
            this.sortBy = Objects.requireNonNull(sortBy, "Sort field must not be null");
            this.ascending = ascending;
            return this;
        }

        public Builder page(int offset, int limit) {
            this.offset = offset;
            this.limit = limit;
            return this;
        }

        /**
         * @throws IllegalArgumentException if offset or limit is negative
         */
        public EventSearch build() {
            if (offset < 0 || limit < 0) {
                throw new IllegalArgumentException("offset and limit must be >= 0, got: " + offset + ", " + limit);
            }
            return new EventSearch(this);
        }
    }
}
