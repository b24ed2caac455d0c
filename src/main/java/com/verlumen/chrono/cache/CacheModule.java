package com.verlumen.chrono.cache;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.google.inject.name.Names;

@AutoValue
public abstract class CacheModule extends AbstractModule {
  public static final int DEFAULT_QUEUE_CAPACITY = 256;

  public static CacheModule create(int broadcastQueueCapacity) {
    return new AutoValue_CacheModule(broadcastQueueCapacity);
  }

  abstract int broadcastQueueCapacity();

  @Override
  protected void configure() {
    bindConstant().annotatedWith(Names.named(PriceBroadcaster.QUEUE_CAPACITY)).to(broadcastQueueCapacity());
    bind(PublishedPriceCache.class).to(PublishedPriceCacheImpl.class).in(Singleton.class);
  }
}
