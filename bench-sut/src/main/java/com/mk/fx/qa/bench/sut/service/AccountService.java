package com.mk.fx.qa.bench.sut.service;

import com.mk.fx.qa.bench.sut.cfg.SutProperties;
import java.math.BigDecimal;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the single account balance shared by {@code /deposit}, {@code /withdraw} and {@code
 * /account}.
 *
 * <p>The simulated latency is spent outside the lock; the balance check and update happen under
 * it, so concurrent withdrawals can never overdraw the account.
 */
@Slf4j
@Service
public class AccountService {

  private final SutProperties properties;
  private final Object balanceLock = new Object();
  private volatile BigDecimal balance;

  public AccountService(SutProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.balance = properties.getInitialBalance();
  }

  public BigDecimal balance() {
    return balance;
  }

  public BigDecimal deposit(BigDecimal amount) throws InterruptedException {
    requirePositive(amount);
    Pauses.pause(properties.getDepositDelay());
    synchronized (balanceLock) {
      balance = balance.add(amount);
      log.debug("Deposited {}, balance now {}", amount, balance);
      return balance;
    }
  }

  /**
   * Withdraws the amount.
   *
   * @throws InsufficientFundsException if the balance is lower than the amount
   */
  public BigDecimal withdraw(BigDecimal amount) throws InterruptedException {
    requirePositive(amount);
    Pauses.pause(properties.getWithdrawDelay());
    synchronized (balanceLock) {
      if (balance.compareTo(amount) < 0) {
        throw new InsufficientFundsException(balance, amount);
      }
      balance = balance.subtract(amount);
      log.debug("Withdrew {}, balance now {}", amount, balance);
      return balance;
    }
  }

  private static void requirePositive(BigDecimal amount) {
    if (amount == null || amount.signum() <= 0) {
      throw new IllegalArgumentException("amount must be > 0 but was " + amount);
    }
  }
}
