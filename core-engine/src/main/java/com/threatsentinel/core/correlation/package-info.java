/**
 * Multi-stage correlation of events across types, driven by the windowed
 * counters.
 */
package com.threatsentinel.core.correlation;
