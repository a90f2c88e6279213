package com.scholary.flow.assemblyai;

import java.time.Duration;

/** Pause between status polls. Replaced in tests to avoid real waiting. */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
