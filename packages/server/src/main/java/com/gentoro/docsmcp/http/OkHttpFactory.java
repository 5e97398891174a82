package com.gentoro.docsmcp.http;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

public class OkHttpFactory {

  /**
   * Client for the document service, configured from {@code docs.api.*}: connect/read timeouts in
   * seconds and the bearer token attached to every call.
   */
  public static OkHttpClient create(Configuration cfg) {
    return new OkHttpClient.Builder()
        .connectTimeout(cfg.getLong("docs.api.connect-timeout-seconds", 10L), TimeUnit.SECONDS)
        .readTimeout(cfg.getLong("docs.api.read-timeout-seconds", 30L), TimeUnit.SECONDS)
        .addInterceptor(new BearerTokenInterceptor(cfg.getString("docs.api.access-token", null)))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
