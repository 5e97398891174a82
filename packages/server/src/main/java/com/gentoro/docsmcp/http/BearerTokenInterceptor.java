package com.gentoro.docsmcp.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Adds {@code Authorization: Bearer <token>} to outgoing calls. Obtaining and refreshing the token
 * happens outside this server; an absent or unresolved token leaves requests untouched.
 */
public class BearerTokenInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(BearerTokenInterceptor.class);

  private final String token;

  public BearerTokenInterceptor(String token) {
    if (token == null || token.isBlank() || token.startsWith("${")) {
      log.warn("No document service access token configured; calls will be unauthenticated");
      this.token = null;
    } else {
      this.token = token.trim();
    }
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    if (token == null || original.header("Authorization") != null) {
      return chain.proceed(original);
    }
    Request authorized =
        original.newBuilder().header("Authorization", "Bearer " + token).build();
    return chain.proceed(authorized);
  }
}
