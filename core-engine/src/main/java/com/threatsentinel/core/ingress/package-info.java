/**
 * Event ingress: validation, normalization and the per-event pipeline.
 */
package com.threatsentinel.core.ingress;
