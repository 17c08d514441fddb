/**
 * Domain model: inbound and validated security events, threats, alerts,
 * incidents and the enums that classify them.
 *
 * <p>
 * {@link com.threatsentinel.core.model.SecurityEvent} is immutable once
 * created by ingress; {@link com.threatsentinel.core.model.Alert} and
 * {@link com.threatsentinel.core.model.Incident} are Jackson-friendly beans
 * built through fluent builders.
 * </p>
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.model;
