package com.quintstore.jena.store;

import java.util.List;

/**
 * Paging and ordering options for pattern queries.
 *
 * @param limit maximum number of rows, or null for no limit
 * @param offset number of rows to skip, or null for none
 * @param order columns to order by, empty for storage order
 * @param reverse whether the order is descending
 */
public record QueryOptions(Long limit, Long offset, List<TermName> order,
        boolean reverse) {

    /** No paging, no ordering. */
    public static final QueryOptions NONE = new QueryOptions(null, null,
        List.of(), false);

    /**
     * Validate and normalise the options.
     *
     * @param limit maximum number of rows, or null for no limit
     * @param offset number of rows to skip, or null for none
     * @param order columns to order by
     * @param reverse whether the order is descending
     */
    public QueryOptions {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        order = order == null ? List.of() : List.copyOf(order);
    }

    /**
     * Options with only a limit.
     *
     * @param limit the limit
     * @return the options
     */
    public static QueryOptions limit(final long limit) {
        return new QueryOptions(limit, null, List.of(), false);
    }

    /**
     * Start building options.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link QueryOptions}.
     */
    public static final class Builder {
        private Long limit;
        private Long offset;
        private List<TermName> order = List.of();
        private boolean reverse;

        private Builder() {
        }

        public Builder limit(final long value) {
            this.limit = value;
            return this;
        }

        public Builder offset(final long value) {
            this.offset = value;
            return this;
        }

        public Builder order(final TermName... names) {
            this.order = List.of(names);
            return this;
        }

        public Builder order(final List<TermName> names) {
            this.order = names;
            return this;
        }

        public Builder reverse(final boolean value) {
            this.reverse = value;
            return this;
        }

        public QueryOptions build() {
            return new QueryOptions(limit, offset, order, reverse);
        }
    }
}
