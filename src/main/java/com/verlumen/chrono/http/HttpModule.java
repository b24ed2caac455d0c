package com.verlumen.chrono.http;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

public final class HttpModule extends AbstractModule {
  public static HttpModule create() {
    return new HttpModule();
  }

  private HttpModule() {}

  @Override
  protected void configure() {
    bind(HttpClient.class).to(HttpClientImpl.class);
    bind(HttpURLConnectionFactory.class).to(HttpURLConnectionFactoryImpl.class);
  }

  /** Shared client for the exchange WebSocket connections. */
  @Provides
  @Singleton
  java.net.http.HttpClient provideWebSocketClient() {
    return java.net.http.HttpClient.newHttpClient();
  }
}
