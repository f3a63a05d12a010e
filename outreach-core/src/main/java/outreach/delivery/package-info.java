/**
 * Idempotent delivery of the paid subject's portal access.
 */
package outreach.delivery;
