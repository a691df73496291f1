package com.gentoro.claimgraph.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** OkHttp client whose interceptor answers every call with a canned response. */
public final class StubHttp {
  private static final MediaType JSON = MediaType.get("application/json");

  private StubHttp() {}

  public static OkHttpClient respond(int code, String body, List<Request> seen) {
    return new OkHttpClient.Builder()
        .addInterceptor(
            chain -> {
              seen.add(chain.request());
              return new Response.Builder()
                  .request(chain.request())
                  .protocol(Protocol.HTTP_1_1)
                  .code(code)
                  .message(code == 200 ? "OK" : "Error")
                  .body(ResponseBody.create(body, JSON))
                  .build();
            })
        .build();
  }

  public static String fixture(String name) {
    try (InputStream in = StubHttp.class.getResourceAsStream("/fixtures/" + name)) {
      if (in == null) {
        throw new IllegalStateException("Missing fixture " + name);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
