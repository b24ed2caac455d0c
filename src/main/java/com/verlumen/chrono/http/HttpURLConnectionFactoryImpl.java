package com.verlumen.chrono.http;

import com.google.inject.Inject;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.time.Duration;

final class HttpURLConnectionFactoryImpl implements HttpURLConnectionFactory {
  private static final int TIMEOUT_MILLIS = (int) Duration.ofSeconds(10).toMillis();

  @Inject
  HttpURLConnectionFactoryImpl() {}

  @Override
  public HttpURLConnection create(String url) throws IOException {
    HttpURLConnection connection = (HttpURLConnection) URI.create(url).toURL().openConnection();
    connection.setConnectTimeout(TIMEOUT_MILLIS);
    connection.setReadTimeout(TIMEOUT_MILLIS);
    return connection;
  }
}
