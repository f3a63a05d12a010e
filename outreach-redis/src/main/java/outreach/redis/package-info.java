/**
 * Redis-backed {@link outreach.spi.KeyValueStore}.
 */
package outreach.redis;
