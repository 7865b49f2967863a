/**
 * Alert destinations and the dispatcher that fans alerts out to them.
 */
package com.endecrelay.relay.sink;
