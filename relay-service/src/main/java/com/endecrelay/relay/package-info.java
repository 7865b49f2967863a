/**
 * The relay process: entry point, serial-to-sink loop and shutdown handling.
 */
package com.endecrelay.relay;
