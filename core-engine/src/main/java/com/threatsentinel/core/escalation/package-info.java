/**
 * Escalation of threats into alerts and incidents, with notification and
 * containment hand-off.
 */
package com.threatsentinel.core.escalation;
