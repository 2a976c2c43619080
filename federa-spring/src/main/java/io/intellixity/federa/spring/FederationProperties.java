package io.intellixity.federa.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "federa")
public class FederationProperties {
  /** Directory of the per-session scratch files. */
  private String scratchDir = Path.of(System.getProperty("java.io.tmpdir"), "federa").toString();
  private final Map<String, RelationalSource> sources = new LinkedHashMap<>();
  private final Map<String, ToolSource> tools = new LinkedHashMap<>();
  private final Cache cache = new Cache();

  public String getScratchDir() { return scratchDir; }
  public void setScratchDir(String scratchDir) { this.scratchDir = scratchDir; }
  public Map<String, RelationalSource> getSources() { return sources; }
  public Map<String, ToolSource> getTools() { return tools; }
  public Cache getCache() { return cache; }

  public static class RelationalSource {
    private String jdbcUrl;
    private String username;
    private String password;
    /** Optional schema that scopes source introspection. */
    private String schema;
    private int maxPoolSize = 5;
    private boolean readOnly = true;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
    public boolean isReadOnly() { return readOnly; }
    public void setReadOnly(boolean readOnly) { this.readOnly = readOnly; }
  }

  public static class ToolSource {
    /** JSON-RPC endpoint URL. */
    private String url;
    private String bearerToken;
    private long timeoutMillis = 30_000;

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getBearerToken() { return bearerToken; }
    public void setBearerToken(String bearerToken) { this.bearerToken = bearerToken; }
    public long getTimeoutMillis() { return timeoutMillis; }
    public void setTimeoutMillis(long timeoutMillis) { this.timeoutMillis = timeoutMillis; }
  }

  public static class Cache {
    private int maxHandles = 100;
    private int maxExecutors = 100;
    private long ttlMillis = 600_000;
    private long idleMillis = 300_000;

    public int getMaxHandles() { return maxHandles; }
    public void setMaxHandles(int maxHandles) { this.maxHandles = maxHandles; }
    public int getMaxExecutors() { return maxExecutors; }
    public void setMaxExecutors(int maxExecutors) { this.maxExecutors = maxExecutors; }
    public long getTtlMillis() { return ttlMillis; }
    public void setTtlMillis(long ttlMillis) { this.ttlMillis = ttlMillis; }
    public long getIdleMillis() { return idleMillis; }
    public void setIdleMillis(long idleMillis) { this.idleMillis = idleMillis; }
  }
}
