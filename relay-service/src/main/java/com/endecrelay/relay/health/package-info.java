/**
 * Broker heartbeats and the local HTTP health endpoint.
 */
package com.endecrelay.relay.health;
