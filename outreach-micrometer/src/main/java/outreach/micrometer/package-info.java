/**
 * Micrometer bridge for outreach metrics.
 */
package outreach.micrometer;
