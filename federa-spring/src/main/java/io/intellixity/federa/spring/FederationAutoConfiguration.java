package io.intellixity.federa.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.federa.orchestration.ExecutionOrderPolicy;
import io.intellixity.federa.orchestration.FederationEngineFactory;
import io.intellixity.federa.orchestration.PlanExecutionListener;
import io.intellixity.federa.orchestration.QueryCountExecutionOrderPolicy;
import io.intellixity.federa.orchestration.resolve.DefaultSourceExecutorFactory;
import io.intellixity.federa.orchestration.resolve.SourceExecutorFactory;
import io.intellixity.federa.orchestration.resolve.SourceExecutorResolver;
import io.intellixity.federa.orchestration.resolve.SourceHandleResolver;
import io.intellixity.federa.orchestration.resolve.SourceRegistry;
import io.intellixity.federa.tool.http.HttpJsonRpcToolClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires {@code federa.*} properties into a source registry, a cached executor resolver and a
 * per-session engine factory.\n
 *
 * Relational sources get a HikariCP pool, opened on first use and closed when the resolver evicts
 * the source. Tool sources get an {@link HttpJsonRpcToolClient}.\n
 */
@AutoConfiguration
@EnableConfigurationProperties(FederationProperties.class)
public class FederationAutoConfiguration {
  private static final Logger log = LoggerFactory.getLogger(FederationAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public SourceHandleResolver sourceHandleResolver(FederationProperties props, ObjectProvider<ObjectMapper> mapper) {
    SourceRegistry registry = new SourceRegistry();
    props.getSources().forEach((id, src) -> {
      if (src.getJdbcUrl() == null || src.getJdbcUrl().isBlank()) {
        throw new IllegalArgumentException("Missing jdbc-url for federa source " + id);
      }
      registry.registerRelational(id, src.getSchema(), () -> pool(id, src));
    });

    ObjectMapper json = mapper.getIfAvailable(ObjectMapper::new);
    props.getTools().forEach((id, tool) -> {
      if (tool.getUrl() == null || tool.getUrl().isBlank()) {
        throw new IllegalArgumentException("Missing url for federa tool " + id);
      }
      URI endpoint = URI.create(tool.getUrl());
      Duration timeout = Duration.ofMillis(tool.getTimeoutMillis());
      registry.registerTool(id, () -> new HttpJsonRpcToolClient(endpoint, tool.getBearerToken(), timeout, json));
    });
    log.info("federa.config sources={}", registry.sourceIds());
    return registry;
  }

  @Bean
  @ConditionalOnMissingBean
  public SourceExecutorFactory sourceExecutorFactory() {
    return DefaultSourceExecutorFactory.INSTANCE;
  }

  @Bean
  @ConditionalOnMissingBean
  public SourceExecutorResolver sourceExecutorResolver(FederationProperties props,
                                                       SourceHandleResolver handles,
                                                       SourceExecutorFactory executors) {
    FederationProperties.Cache c = props.getCache();
    return new SourceExecutorResolver(handles, executors,
        c.getMaxHandles(), c.getMaxExecutors(), c.getTtlMillis(), c.getIdleMillis());
  }

  @Bean
  @ConditionalOnMissingBean
  public ExecutionOrderPolicy executionOrderPolicy() {
    return QueryCountExecutionOrderPolicy.INSTANCE;
  }

  @Bean
  @ConditionalOnMissingBean
  public FederationEngineFactory federationEngineFactory(FederationProperties props,
                                                         SourceExecutorResolver resolver,
                                                         ExecutionOrderPolicy orderPolicy,
                                                         ObjectProvider<PlanExecutionListener> listener) {
    return new FederationEngineFactory(Path.of(props.getScratchDir()), resolver, orderPolicy,
        listener.getIfAvailable(() -> PlanExecutionListener.NOOP));
  }

  private static HikariDataSource pool(String id, FederationProperties.RelationalSource src) {
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("federa-" + id);
    hc.setJdbcUrl(src.getJdbcUrl());
    hc.setUsername(src.getUsername());
    hc.setPassword(src.getPassword());
    hc.setMaximumPoolSize(src.getMaxPoolSize());
    hc.setReadOnly(src.isReadOnly());
    log.info("federa.config open_pool source={} maxPoolSize={} readOnly={}", id, src.getMaxPoolSize(), src.isReadOnly());
    return new HikariDataSource(hc);
  }
}
