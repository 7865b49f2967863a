/**
 * AMQP publishing with publisher confirms, bounded retries and unroutable
 * detection.
 */
package com.endecrelay.relay.broker;
