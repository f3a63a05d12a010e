/**
 * Read-only operational snapshot.
 */
package outreach.ops;
