package com.mk.fx.qa.bench.sut.service;

import com.mk.fx.qa.bench.sut.cfg.SutProperties;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Shared counter behind a slow store. */
@Service
@RequiredArgsConstructor
public class CounterService {

  private final SutProperties properties;
  private final AtomicLong counter = new AtomicLong();

  public long increment() throws InterruptedException {
    Pauses.pause(properties.getCounterDelay());
    return counter.incrementAndGet();
  }

  public long current() {
    return counter.get();
  }
}
