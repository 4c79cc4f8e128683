package com.example.sessionguard.config;

import com.example.sessionguard.properties.ApplicationProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.SslOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.cluster.ClusterClientOptions;
import io.lettuce.core.cluster.ClusterTopologyRefreshOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.data.redis.RedisHealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisNode;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis configuration. Supports both standalone and cluster modes with connection pooling.
 *
 * <p>Two connection factories share client resources: the primary one serves session state with
 * the regular command timeout, the rate-limit one uses a much shorter timeout so a slow Redis
 * degrades to the in-process counter instead of stalling requests.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class RedisConfig {

  public static final String RATE_LIMIT_TEMPLATE = "rateLimitRedisTemplate";
  private static final String RATE_LIMIT_FACTORY = "rateLimitRedisConnectionFactory";

  private final ApplicationProperties properties;

  /**
   * Shared client resources for all Redis connections
   */
  @Bean(destroyMethod = "shutdown")
  public ClientResources lettuceClientResources() {
    return DefaultClientResources.builder()
        .ioThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .computationThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .build();
  }

  /**
   * Connection pool configuration
   */
  @Bean
  public GenericObjectPoolConfig<StatefulConnection<?, ?>> redisPoolConfig() {
    ApplicationProperties.RedisProperties.PoolProperties poolProps = properties.redis().pool();

    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(poolProps.maxActive());
    config.setMaxIdle(poolProps.maxIdle());
    config.setMinIdle(poolProps.minIdle());
    config.setMaxWait(poolProps.maxWait());

    config.setTestOnBorrow(false);
    config.setTestWhileIdle(true);
    config.setTimeBetweenEvictionRuns(poolProps.timeBetweenEvictionRuns());
    config.setMinEvictableIdleTime(Duration.ofMinutes(1));
    config.setNumTestsPerEvictionRun(3);

    return config;
  }

  /**
   * Session store connection factory with cluster support.
   */
  @Bean
  @Primary
  public RedisConnectionFactory redisConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {
    ApplicationProperties.RedisProperties redisProps = properties.redis();
    log.info("Configuring Redis session connection ({} mode, timeout {})", redisProps.mode(), redisProps.timeout());
    return createConnectionFactory(redisProps.timeout(), clientResources, poolConfig);
  }

  /**
   * Rate limiter connection factory; only needed when counters live in Redis.
   */
  @Bean(RATE_LIMIT_FACTORY)
  @ConditionalOnProperty(name = "app.rate-limit.store", havingValue = "redis", matchIfMissing = true)
  public RedisConnectionFactory rateLimitRedisConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {
    Duration timeout = properties.rateLimit().timeout();
    log.info("Configuring Redis rate limit connection (timeout {})", timeout);
    return createConnectionFactory(timeout, clientResources, poolConfig);
  }

  /**
   * Primary template for session hashes and indexes
   */
  @Bean
  @Primary
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    StringRedisTemplate template = new StringRedisTemplate();
    template.setConnectionFactory(connectionFactory);
    template.setEnableTransactionSupport(false);
    template.afterPropertiesSet();
    return template;
  }

  @Bean(RATE_LIMIT_TEMPLATE)
  @ConditionalOnProperty(name = "app.rate-limit.store", havingValue = "redis", matchIfMissing = true)
  public StringRedisTemplate rateLimitRedisTemplate(
      @Qualifier(RATE_LIMIT_FACTORY) RedisConnectionFactory connectionFactory) {
    StringRedisTemplate template = new StringRedisTemplate();
    template.setConnectionFactory(connectionFactory);
    template.afterPropertiesSet();
    return template;
  }

  /**
   * Redis health indicator for monitoring
   */
  @Bean
  public RedisHealthIndicator redisHealthIndicator(RedisConnectionFactory connectionFactory) {
    return new RedisHealthIndicator(connectionFactory);
  }

  private RedisConnectionFactory createConnectionFactory(
      Duration timeout,
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {
    ApplicationProperties.RedisProperties redisProps = properties.redis();

    if ("cluster".equalsIgnoreCase(redisProps.mode()) &&
        redisProps.cluster() != null &&
        redisProps.cluster().nodes() != null &&
        !redisProps.cluster().nodes().isBlank()) {
      return createClusterConnectionFactory(timeout, clientResources, poolConfig);
    }
    return createStandaloneConnectionFactory(timeout, clientResources, poolConfig);
  }

  private RedisConnectionFactory createStandaloneConnectionFactory(
      Duration timeout,
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();

    RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
    redisConfig.setHostName(redisProps.host());
    redisConfig.setPort(redisProps.port());
    if (redisProps.password() != null && !redisProps.password().isBlank()) {
      redisConfig.setPassword(redisProps.password());
    }
    redisConfig.setDatabase(redisProps.database());

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .commandTimeout(timeout)
            .shutdownTimeout(Duration.ofSeconds(2))
            .clientOptions(createClientOptions(timeout));

    if (redisProps.ssl().enabled()) {
      builder.useSsl();
    }

    LettuceConnectionFactory factory = new LettuceConnectionFactory(redisConfig, builder.build());
    factory.setShareNativeConnection(true);
    factory.setValidateConnection(false);

    return factory;
  }

  private RedisConnectionFactory createClusterConnectionFactory(
      Duration timeout,
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();
    ApplicationProperties.RedisProperties.ClusterProperties clusterProps = redisProps.cluster();

    RedisClusterConfiguration clusterConfig = new RedisClusterConfiguration();

    for (String node : clusterProps.nodes().split(",")) {
      String[] parts = node.trim().split(":");
      clusterConfig.addClusterNode(new RedisNode(parts[0], Integer.parseInt(parts[1])));
    }

    if (redisProps.password() != null && !redisProps.password().isBlank()) {
      clusterConfig.setPassword(redisProps.password());
    }
    clusterConfig.setMaxRedirects(clusterProps.maxRedirects());

    ClusterTopologyRefreshOptions topologyRefreshOptions =
        ClusterTopologyRefreshOptions.builder()
            .enablePeriodicRefresh(Duration.ofMinutes(1))
            .enableAllAdaptiveRefreshTriggers()
            .dynamicRefreshSources(true)
            .closeStaleConnections(true)
            .build();

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .clientOptions(createClusterClientOptions(topologyRefreshOptions, timeout))
            .commandTimeout(timeout);

    if (redisProps.ssl().enabled()) {
      builder.useSsl();
    }

    return new LettuceConnectionFactory(clusterConfig, builder.build());
  }

  private ClientOptions createClientOptions(Duration timeout) {
    ClientOptions.Builder builder = ClientOptions.builder()
        .socketOptions(createSocketOptions(timeout))
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .cancelCommandsOnReconnectFailure(false)
        .publishOnScheduler(true)
        .timeoutOptions(TimeoutOptions.enabled(timeout));

    if (properties.redis().ssl().enabled()) {
      builder.sslOptions(createSslOptions());
    }

    return builder.build();
  }

  private ClusterClientOptions createClusterClientOptions(
      ClusterTopologyRefreshOptions refreshOptions,
      Duration timeout) {

    ClusterClientOptions.Builder builder = ClusterClientOptions.builder()
        .topologyRefreshOptions(refreshOptions)
        .socketOptions(createSocketOptions(timeout))
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .validateClusterNodeMembership(false)
        .maxRedirects(properties.redis().cluster().maxRedirects())
        .publishOnScheduler(true)
        .timeoutOptions(TimeoutOptions.enabled(timeout));

    if (properties.redis().ssl().enabled()) {
      builder.sslOptions(createSslOptions());
    }

    return builder.build();
  }

  private SocketOptions createSocketOptions(Duration timeout) {
    return SocketOptions.builder()
        .connectTimeout(timeout)
        .keepAlive(true)
        .tcpNoDelay(true)
        .build();
  }

  private SslOptions createSslOptions() {
    return SslOptions.builder()
        .jdkSslProvider()
        .build();
  }
}
