package io.intellixity.unipage.jdbc;

import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

/** Temp-file SQLite databases with a {@code books(id, title, author, year)} table. */
final class SqliteFixtures {
  private SqliteFixtures() {}

  static SQLiteDataSource books(Path file, String prefix, int rows) {
    SQLiteDataSource ds = new SQLiteDataSource();
    ds.setUrl("jdbc:sqlite:" + file.toAbsolutePath());
    try (Connection c = ds.getConnection()) {
      try (Statement st = c.createStatement()) {
        st.execute("CREATE TABLE books (id INTEGER PRIMARY KEY, title TEXT NOT NULL, author TEXT, year INTEGER)");
      }
      try (PreparedStatement ps = c.prepareStatement("INSERT INTO books (id, title, author, year) VALUES (?, ?, ?, ?)")) {
        for (int i = 1; i <= rows; i++) {
          ps.setInt(1, i);
          ps.setString(2, prefix + "-r" + i);
          ps.setString(3, (i % 2 == 0) ? "even" : "odd");
          ps.setInt(4, 2000 + i);
          ps.addBatch();
        }
        ps.executeBatch();
      }
    } catch (SQLException e) {
      throw new IllegalStateException("fixture setup failed", e);
    }
    return ds;
  }
}
