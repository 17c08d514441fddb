/**
 * Typed in-process pub/sub bus for events, threats, alerts and incidents.
 */
package com.threatsentinel.core.bus;
