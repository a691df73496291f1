package com.gentoro.claimgraph.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;

/** Debug logging of outgoing search requests; API keys in headers are never logged. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug("Sending {} {}", request.method(), request.url());

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received {} for {} in {} ms",
        response.code(),
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d));

    if (log.isTraceEnabled()) {
      ResponseBody peek = response.peekBody(64 * 1024);
      log.trace("Response body:\n{}\n", peek.string());
    }
    return response;
  }
}
