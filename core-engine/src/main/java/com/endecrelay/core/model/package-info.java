/**
 * Domain model classes for ENDEC Relay.
 *
 * <p>
 * This package contains the values shared between the decode engine and the
 * relay service:
 * </p>
 * <ul>
 * <li>{@link com.endecrelay.core.model.AlertBlock} - raw lines framed by the
 * ENDEC start/end markers</li>
 * <li>{@link com.endecrelay.core.model.EasHeader} - parsed {@code ZCZC}
 * header</li>
 * <li>{@link com.endecrelay.core.model.ResolvedAlert} - message text plus
 * optional header, ready for dispatch</li>
 * <li>{@link com.endecrelay.core.model.Originator} - closed set of originator
 * codes</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.endecrelay.core.model;
