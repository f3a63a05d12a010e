/**
 * Store key layout ({@link outreach.store.StoreKeys}) and the process-local
 * {@link outreach.store.InMemoryKeyValueStore}.
 */
package outreach.store;
