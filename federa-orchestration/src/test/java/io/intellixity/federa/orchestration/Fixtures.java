package io.intellixity.federa.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.federa.spi.tool.ToolClient;
import io.intellixity.federa.spi.tool.ToolDescriptor;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.logging.Logger;

final class Fixtures {
  private static final ObjectMapper JSON = new ObjectMapper();

  private Fixtures() {}

  /** SQLite origin database with a small customers table. */
  static SQLiteDataSource crmDatabase(Path file) throws SQLException {
    SQLiteDataSource ds = new SQLiteDataSource();
    ds.setUrl("jdbc:sqlite:" + file);
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.executeUpdate("CREATE TABLE customers (id INTEGER, name TEXT, city TEXT, vip BOOLEAN)");
      st.executeUpdate("INSERT INTO customers VALUES (1, 'Ada', 'Oslo', 1), (2, 'Linus', 'Bergen', 0), (3, 'Grace', 'Oslo', 0)");
    }
    return ds;
  }

  static ToolClient tool(BiFunction<String, Map<String, Object>, String> jsonResponse) {
    return new ToolClient() {
      @Override
      public JsonNode callTool(String toolName, Map<String, Object> parameters) {
        try {
          return JSON.readTree(jsonResponse.apply(toolName, parameters));
        } catch (Exception e) {
          throw new IllegalStateException(e);
        }
      }

      @Override
      public List<ToolDescriptor> listTools() {
        return List.of(new ToolDescriptor("weather", "City weather", null));
      }
    };
  }

  static ToolClient weatherTool() {
    return tool((name, params) -> "[{\"city\":\"Oslo\",\"temp\":4.5},{\"city\":\"Bergen\",\"temp\":7.0}]");
  }

  /** Delegating data source that runs {@code beforeConnect} on every connection request. */
  static DataSource gated(DataSource target, Runnable beforeConnect) {
    return new DataSource() {
      @Override public Connection getConnection() throws SQLException {
        beforeConnect.run();
        return target.getConnection();
      }
      @Override public Connection getConnection(String user, String password) throws SQLException {
        beforeConnect.run();
        return target.getConnection(user, password);
      }
      @Override public PrintWriter getLogWriter() throws SQLException { return target.getLogWriter(); }
      @Override public void setLogWriter(PrintWriter out) throws SQLException { target.setLogWriter(out); }
      @Override public void setLoginTimeout(int seconds) throws SQLException { target.setLoginTimeout(seconds); }
      @Override public int getLoginTimeout() throws SQLException { return target.getLoginTimeout(); }
      @Override public Logger getParentLogger() throws SQLFeatureNotSupportedException { return target.getParentLogger(); }
      @Override public <T> T unwrap(Class<T> iface) throws SQLException { return target.unwrap(iface); }
      @Override public boolean isWrapperFor(Class<?> iface) throws SQLException { return target.isWrapperFor(iface); }
    };
  }
}
