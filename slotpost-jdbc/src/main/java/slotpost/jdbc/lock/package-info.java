/**
 * Database-backed scheduler lock for deployments where processes share a database
 * rather than a filesystem.
 */
package slotpost.jdbc.lock;
