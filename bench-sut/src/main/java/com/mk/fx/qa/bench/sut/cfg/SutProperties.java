package com.mk.fx.qa.bench.sut.cfg;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Simulated latencies and limits of the demo service, bound from {@code sut.*}. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sut")
public class SutProperties {

  /** Loop iterations of one {@code /compute} call. */
  @Positive private long computeIterations = 10_000_000;

  @NotNull private Duration counterDelay = Duration.ofSeconds(5);

  @NotNull private Duration slowDelay = Duration.ofSeconds(20);

  /** Pause before every multiplication of {@code /factorial}. */
  @NotNull private Duration factorialStepDelay = Duration.ofMillis(200);

  /** Pause on every recursive call of {@code /fibonacci} above the base cases. */
  @NotNull private Duration fibonacciCallDelay = Duration.ofMillis(200);

  @NotNull private Duration depositDelay = Duration.ofMillis(500);

  @NotNull private Duration withdrawDelay = Duration.ofMillis(200);

  @PositiveOrZero private int maxFactorialInput = 15;

  @PositiveOrZero private int maxFibonacciInput = 25;

  @NotNull @PositiveOrZero private BigDecimal initialBalance = BigDecimal.valueOf(1000);
}
