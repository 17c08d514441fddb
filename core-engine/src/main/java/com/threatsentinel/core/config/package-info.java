/**
 * YAML-backed configuration: the detection/correlation rule set and the
 * engine settings (alert-threshold categories, recipients, blacklist,
 * retention).
 *
 * <p>
 * Key classes:
 * </p>
 * <ul>
 * <li>{@link com.threatsentinel.core.config.RulesLoader}: rule set loading
 * with env → file → classpath resolution</li>
 * <li>{@link com.threatsentinel.core.config.SiemConfigLoader}: engine
 * settings</li>
 * </ul>
 */
package com.threatsentinel.core.config;
