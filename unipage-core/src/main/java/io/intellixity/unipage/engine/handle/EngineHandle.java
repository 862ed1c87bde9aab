package io.intellixity.unipage.engine.handle;

/**
 * Resolved runtime handle for a backend engine family.\n
 *
 * Example:\n
 * - JDBC: client() is javax.sql.DataSource, namespace() is schema\n
 * - Mongo: client() is MongoClient, namespace() is database\n
 */
public interface EngineHandle<TClient> {
  /** Unique identifier for this handle (useful for logging/caching). */
  String id();

  /** Native client/handle used by an engine (DataSource, MongoClient, etc.). */
  TClient client();

  /** Namespace (schema/database) for this handle, or null when the store has none. */
  String namespace();
}
