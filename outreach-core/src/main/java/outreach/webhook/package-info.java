/**
 * Inbound HTTP-facing entry points without an HTTP dependency: the ingress receiver for
 * channel updates and the gateway webhook handler.
 */
package outreach.webhook;
