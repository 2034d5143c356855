package org.hypertrace.core.metricquery.service;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Value;
import lombok.experimental.NonFinal;

@Value
@NonFinal
public class QueryServiceConfig {

  private static final String CONFIG_PATH_HANDLER_CLIENT_LIST = "clients";
  private static final String CONFIG_PATH_HANDLER_CONFIG_LIST = "queryRequestHandlersConfig";

  List<RequestHandlerClientConfig> requestHandlerClientConfigs;
  List<RequestHandlerConfig> queryRequestHandlersConfigs;

  public QueryServiceConfig(Config config) {
    Config resolved = config.resolve();
    this.requestHandlerClientConfigs =
        resolved.getConfigList(CONFIG_PATH_HANDLER_CLIENT_LIST).stream()
            .map(RequestHandlerClientConfig::new)
            .collect(Collectors.toUnmodifiableList());
    this.queryRequestHandlersConfigs =
        resolved.getConfigList(CONFIG_PATH_HANDLER_CONFIG_LIST).stream()
            .map(RequestHandlerConfig::new)
            .collect(Collectors.toUnmodifiableList());
  }

  @Value
  @NonFinal
  public static class RequestHandlerConfig {
    private static final String CONFIG_PATH_NAME = "name";
    private static final String CONFIG_PATH_TYPE = "type";
    private static final String CONFIG_PATH_CLIENT_KEY = "clientConfig";
    private static final String CONFIG_PATH_REQUEST_HANDLER_INFO = "requestHandlerInfo";

    String name;
    String type;
    String clientConfig;
    Config requestHandlerInfo;

    private RequestHandlerConfig(Config config) {
      this.name = config.getString(CONFIG_PATH_NAME);
      this.type = config.getString(CONFIG_PATH_TYPE);
      this.clientConfig = config.getString(CONFIG_PATH_CLIENT_KEY);
      this.requestHandlerInfo = config.getConfig(CONFIG_PATH_REQUEST_HANDLER_INFO);
    }
  }

  @Value
  @NonFinal
  public static class RequestHandlerClientConfig {
    private static final String CONFIG_PATH_TYPE = "type";
    private static final String CONFIG_PATH_CONNECTION_STRING = "connectionString";
    private static final String CONFIG_PATH_MAX_CONNECTIONS = "maxConnections";
    private static final String CONFIG_PATH_REQUEST_TIMEOUT = "requestTimeout";
    String type;
    String connectionString;
    Optional<Integer> maxConnections;
    Optional<Duration> requestTimeout;

    private RequestHandlerClientConfig(Config config) {
      this.type = config.getString(CONFIG_PATH_TYPE);
      this.connectionString = config.getString(CONFIG_PATH_CONNECTION_STRING);
      this.maxConnections =
          config.hasPath(CONFIG_PATH_MAX_CONNECTIONS)
              ? Optional.of(config.getInt(CONFIG_PATH_MAX_CONNECTIONS))
              : Optional.empty();
      this.requestTimeout =
          config.hasPath(CONFIG_PATH_REQUEST_TIMEOUT)
              ? Optional.of(config.getDuration(CONFIG_PATH_REQUEST_TIMEOUT))
              : Optional.empty();
    }
  }
}
