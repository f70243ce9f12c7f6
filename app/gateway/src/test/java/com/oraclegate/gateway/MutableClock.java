package com.oraclegate.gateway;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/** UTC clock whose instant is set by the test. */
public class MutableClock extends Clock {

  private final AtomicReference<Instant> current;

  public MutableClock(Instant initial) {
    this.current = new AtomicReference<>(initial);
  }

  public void set(Instant instant) {
    current.set(instant);
  }

  public void advance(Duration duration) {
    current.updateAndGet(instant -> instant.plus(duration));
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(ZoneId zone) {
    return this;
  }

  @Override
  public Instant instant() {
    return current.get();
  }
}
