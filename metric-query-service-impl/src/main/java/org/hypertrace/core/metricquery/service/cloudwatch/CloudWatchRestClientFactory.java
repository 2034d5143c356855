package org.hypertrace.core.metricquery.service.cloudwatch;

import com.google.inject.Singleton;
import java.util.concurrent.ConcurrentHashMap;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.hypertrace.core.metricquery.service.QueryServiceConfig.RequestHandlerClientConfig;

@Singleton
class CloudWatchRestClientFactory {

  private final ConcurrentHashMap<String, CloudWatchRestClient> clientMap =
      new ConcurrentHashMap<>();

  CloudWatchRestClient getCloudWatchClient(RequestHandlerClientConfig clientConfig) {
    return this.clientMap.computeIfAbsent(
        clientConfig.getConnectionString(),
        connectionString ->
            new CloudWatchRestClient(connectionString, buildHttpClient(clientConfig)));
  }

  private static OkHttpClient buildHttpClient(RequestHandlerClientConfig clientConfig) {
    OkHttpClient.Builder builder = new OkHttpClient.Builder();
    clientConfig.getRequestTimeout().ifPresent(builder::callTimeout);
    clientConfig
        .getMaxConnections()
        .ifPresent(
            maxConnections -> {
              Dispatcher dispatcher = new Dispatcher();
              dispatcher.setMaxRequestsPerHost(maxConnections);
              builder.dispatcher(dispatcher);
            });
    return builder.build();
  }
}
