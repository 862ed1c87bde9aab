package io.intellixity.unipage.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;

import java.util.concurrent.TimeUnit;

/** Factory methods for {@link MongoQueryEngine}. */
public final class MongoQueryEngines {
  private MongoQueryEngines() {}

  /**
   * Engine with its own client; closing the engine closes the client.
   *
   * @param serverSelectionTimeoutMs how long a request waits for a reachable server before failing
   */
  public static MongoQueryEngine connect(String id, String uri, String database, long serverSelectionTimeoutMs) {
    MongoClientSettings settings = MongoClientSettings.builder()
        .applyConnectionString(new ConnectionString(uri))
        .applyToClusterSettings(b -> b.serverSelectionTimeout(serverSelectionTimeoutMs, TimeUnit.MILLISECONDS))
        .build();
    MongoClient client = MongoClients.create(settings);
    return new MongoQueryEngine(new MongoHandle(id, client, database), true);
  }
}
