/**
 * Automated containment: the dispatcher that audits and forwards
 * containment requests, and the enforcer contract.
 */
package com.threatsentinel.core.containment;
