/**
 * Line-oriented reading from the ENDEC serial port.
 */
package com.endecrelay.relay.serial;
