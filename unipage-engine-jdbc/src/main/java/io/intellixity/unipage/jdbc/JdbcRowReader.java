package io.intellixity.unipage.jdbc;

import java.sql.Array;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads result-set rows into maps keyed by column label, in column order. */
final class JdbcRowReader {
  private final ResultSet rs;
  private final String[] labels;

  JdbcRowReader(ResultSet rs) throws SQLException {
    this.rs = rs;
    ResultSetMetaData md = rs.getMetaData();
    this.labels = new String[md.getColumnCount()];
    for (int i = 1; i <= labels.length; i++) labels[i - 1] = md.getColumnLabel(i);
  }

  List<Map<String, Object>> readAll() throws SQLException {
    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) out.add(readRow());
    return out;
  }

  private Map<String, Object> readRow() throws SQLException {
    Map<String, Object> row = new LinkedHashMap<>(labels.length * 2);
    for (int i = 0; i < labels.length; i++) {
      row.put(labels[i], normalize(rs.getObject(i + 1)));
    }
    return row;
  }

  private static Object normalize(Object v) throws SQLException {
    if (v instanceof Array a) {
      Object arr = a.getArray();
      if (arr instanceof Object[] oa) return Arrays.asList(oa);
      return arr;
    }
    if (v instanceof Clob c) {
      long len = c.length();
      return c.getSubString(1, (int) Math.min(len, Integer.MAX_VALUE));
    }
    return v;
  }
}
