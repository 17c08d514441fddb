/**
 * Read-only queries over the rolling event buffer: filtered recent events,
 * text search with sorting and pagination, and per-type, per-severity and
 * hourly analytics.
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.query;
