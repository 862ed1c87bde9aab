package io.intellixity.unipage.examples.config;

import io.intellixity.unipage.examples.engine.Engines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;

/**
 * Creates the {@code books} table and example rows in empty stores.\n
 *
 * Titles are {@code <sourceId>-r<n>}, authors alternate odd/even, years count up from 2001.
 */
public final class LibrarySeeder {
  private static final Logger log = LoggerFactory.getLogger(LibrarySeeder.class);

  static final String CREATE = "CREATE TABLE IF NOT EXISTS books ("
      + "id INTEGER PRIMARY KEY, title VARCHAR(200) NOT NULL, author VARCHAR(100), year INTEGER)";

  private LibrarySeeder() {}

  public static void seed(Engines engines, UnipageProperties props) {
    for (Map.Entry<String, UnipageProperties.SourceDb> e : props.getSources().entrySet()) {
      int rows = e.getValue().getSeedRows();
      if (rows <= 0) continue;
      DataSource ds = engines.get(e.getKey()).handle().client();
      try {
        int written = seed(ds, e.getKey(), rows);
        log.info("unipage.examples op=seed source={} rows={}", e.getKey(), written);
      } catch (SQLException ex) {
        throw new IllegalStateException("Seeding source '" + e.getKey() + "' failed", ex);
      }
    }
  }

  static int seed(DataSource ds, String sourceId, int rows) throws SQLException {
    try (Connection c = ds.getConnection()) {
      try (Statement st = c.createStatement()) {
        st.execute(CREATE);
        try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM books")) {
          if (rs.next() && rs.getLong(1) > 0) return 0;
        }
      }
      try (PreparedStatement ps = c.prepareStatement("INSERT INTO books (id, title, author, year) VALUES (?, ?, ?, ?)")) {
        for (int i = 1; i <= rows; i++) {
          ps.setInt(1, i);
          ps.setString(2, sourceId + "-r" + i);
          ps.setString(3, (i % 2 == 0) ? "even" : "odd");
          ps.setInt(4, 2000 + i);
          ps.addBatch();
        }
        ps.executeBatch();
      }
      return rows;
    }
  }
}
