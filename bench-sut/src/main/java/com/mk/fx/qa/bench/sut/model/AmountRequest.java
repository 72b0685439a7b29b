package com.mk.fx.qa.bench.sut.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;

/** Body of {@code /deposit} and {@code /withdraw}. */
public record AmountRequest(@NotNull @Positive BigDecimal amount) {}
