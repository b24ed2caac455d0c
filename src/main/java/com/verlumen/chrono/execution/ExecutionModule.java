package com.verlumen.chrono.execution;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/** Process-wide collaborators: run mode, the clock and the scheduler every timer runs on. */
@AutoValue
public abstract class ExecutionModule extends AbstractModule {
  public static ExecutionModule create(RunMode runMode, int schedulerThreads) {
    return new AutoValue_ExecutionModule(runMode, schedulerThreads);
  }

  abstract RunMode runMode();

  abstract int schedulerThreads();

  @Override
  protected void configure() {
    bind(RunMode.class).toInstance(runMode());
    bind(Clock.class).toInstance(Clock.systemUTC());
  }

  @Provides
  @Singleton
  ScheduledExecutorService provideScheduler() {
    return Executors.newScheduledThreadPool(
        schedulerThreads(),
        new ThreadFactoryBuilder().setNameFormat("chrono-scheduler-%d").setDaemon(true).build());
  }
}
