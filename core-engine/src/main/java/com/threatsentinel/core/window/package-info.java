/**
 * Rolling state over recent events: the bounded event buffer and the
 * clock-driven occurrence counters keyed by event type, group and window
 * length.
 */
package com.threatsentinel.core.window;
