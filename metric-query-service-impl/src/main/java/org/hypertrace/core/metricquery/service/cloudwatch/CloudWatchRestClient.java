package org.hypertrace.core.metricquery.service.cloudwatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.hypertrace.core.metricquery.service.api.GetMetricDataInput;
import org.hypertrace.core.metricquery.service.api.GetMetricDataOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts {@code GetMetricData} inputs to a CloudWatch compatible JSON endpoint. All inputs are
 * fetched concurrently; each one is followed through its {@code NextToken}s until the last page.
 */
class CloudWatchRestClient {
  private static final Logger LOG = LoggerFactory.getLogger(CloudWatchRestClient.class);

  private static final String TARGET_HEADER = "X-Amz-Target";
  private static final String GET_METRIC_DATA_TARGET =
      "GraniteServiceVersion20100801.GetMetricData";
  private static final MediaType AMZ_JSON = MediaType.get("application/x-amz-json-1.0");

  private final String connectionString;
  private final OkHttpClient okHttpClient;

  CloudWatchRestClient(String connectionString, OkHttpClient okHttpClient) {
    this.connectionString = connectionString;
    this.okHttpClient = okHttpClient;
  }

  /**
   * @return the pages of every input, in input order and then page order
   * @throws CloudWatchClientException if any page could not be fetched
   */
  public List<GetMetricDataOutput> executeAll(List<GetMetricDataInput> inputs) {
    List<CompletableFuture<List<GetMetricDataOutput>>> futures =
        inputs.stream()
            .map(input -> fetchPages(input, new ArrayList<>()))
            .collect(Collectors.toUnmodifiableList());

    try {
      CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof CloudWatchClientException) {
        throw (CloudWatchClientException) e.getCause();
      }
      throw new CloudWatchClientException("Failed to fetch metric data", e.getCause());
    }

    return futures.stream()
        .flatMap(future -> future.join().stream())
        .collect(Collectors.toUnmodifiableList());
  }

  private CompletableFuture<List<GetMetricDataOutput>> fetchPages(
      GetMetricDataInput input, List<GetMetricDataOutput> pages) {
    return execute(input)
        .thenCompose(
            output -> {
              pages.add(output);
              return output
                  .getNextTokenIfPresent()
                  .map(
                      nextToken -> {
                        LOG.debug("Fetching next metric data page. page: {}", pages.size() + 1);
                        return fetchPages(input.withNextToken(nextToken), pages);
                      })
                  .orElseGet(() -> CompletableFuture.completedFuture(pages));
            });
  }

  private CompletableFuture<GetMetricDataOutput> execute(GetMetricDataInput input) {
    Request request;
    try {
      request = buildRequest(input);
    } catch (JsonProcessingException e) {
      return CompletableFuture.failedFuture(
          new CloudWatchClientException("Failed to serialize metric data input", e));
    }
    OkHttpResponseCallback callback = new OkHttpResponseCallback();
    okHttpClient.newCall(request).enqueue(callback);
    return callback.future.thenApply(this::convertResponse);
  }

  private Request buildRequest(GetMetricDataInput input) throws JsonProcessingException {
    return new Request.Builder()
        .url(getRequestUrl())
        .header(TARGET_HEADER, GET_METRIC_DATA_TARGET)
        .post(RequestBody.create(input.toJson(), AMZ_JSON))
        .build();
  }

  private GetMetricDataOutput convertResponse(Response response) {
    try (ResponseBody body = response.body()) {
      if (!response.isSuccessful()) {
        throw new CloudWatchClientException(response.code(), "Unexpected code " + response);
      }
      if (body == null) {
        throw new CloudWatchClientException(response.code(), "Empty response body " + response);
      }
      return GetMetricDataOutput.fromJson(body.string());
    } catch (IOException ioException) {
      throw new CloudWatchClientException("Failed to read metric data response", ioException);
    }
  }

  private String getRequestUrl() {
    return String.format("http://%s/", this.connectionString);
  }

  private static class OkHttpResponseCallback implements Callback {
    private final CompletableFuture<Response> future = new CompletableFuture<>();

    @Override
    public void onResponse(Call call, Response response) {
      future.complete(response);
    }

    @Override
    public void onFailure(Call call, IOException e) {
      future.completeExceptionally(
          new CloudWatchClientException("Metric data request failed: " + call.request().url(), e));
    }
  }
}
