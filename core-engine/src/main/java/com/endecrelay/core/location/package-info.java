/**
 * SAME location code directory.
 *
 * @since 1.0.0
 */
package com.endecrelay.core.location;
