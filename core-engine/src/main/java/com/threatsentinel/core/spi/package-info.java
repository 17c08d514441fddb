/**
 * Collaborator contracts the engine calls out to (durable storage, alert
 * notification) and their logging defaults.
 */
package com.threatsentinel.core.spi;
