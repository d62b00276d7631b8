/**
 * Outbound ports of the relay.
 *
 * <p>The evaluation loop and command handling depend only on these interfaces; the HTTP sensor
 * feed and the Telegram transport live in the infrastructure module.
 */
package sensor.relay.application.port;
