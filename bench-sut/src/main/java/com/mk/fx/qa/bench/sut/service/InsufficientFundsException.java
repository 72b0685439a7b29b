package com.mk.fx.qa.bench.sut.service;

import java.math.BigDecimal;
import lombok.Getter;

/** Raised when a withdrawal exceeds the current balance. The balance is left unchanged. */
@Getter
public class InsufficientFundsException extends RuntimeException {

  private final BigDecimal balance;
  private final BigDecimal requested;

  public InsufficientFundsException(BigDecimal balance, BigDecimal requested) {
    super("Insufficient funds: balance " + balance + ", requested " + requested);
    this.balance = balance;
    this.requested = requested;
  }
}
