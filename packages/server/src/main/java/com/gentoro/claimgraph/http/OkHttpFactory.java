package com.gentoro.claimgraph.http;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /** Client shared by the search adapters; requests of one build run on many threads at once. */
  public static OkHttpClient create(long readTimeoutSeconds) {
    return new OkHttpClient.Builder()
        .connectTimeout(10, TimeUnit.SECONDS)
        .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
