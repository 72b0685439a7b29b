package com.mk.fx.qa.bench.sut.resource;

import com.mk.fx.qa.bench.sut.model.AmountRequest;
import com.mk.fx.qa.bench.sut.model.Responses.BalanceResponse;
import com.mk.fx.qa.bench.sut.model.Responses.ComputeResponse;
import com.mk.fx.qa.bench.sut.model.Responses.CounterResponse;
import com.mk.fx.qa.bench.sut.model.Responses.FactorialResponse;
import com.mk.fx.qa.bench.sut.model.Responses.FibonacciResponse;
import com.mk.fx.qa.bench.sut.model.Responses.HealthResponse;
import com.mk.fx.qa.bench.sut.service.AccountService;
import com.mk.fx.qa.bench.sut.service.CounterService;
import com.mk.fx.qa.bench.sut.service.WorkloadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Demo endpoints. Slow work runs as a {@link Callable} on the MVC task executor so the servlet
 * container can answer with 503 once {@code spring.mvc.async.request-timeout} expires.
 */
@Slf4j
@Tag(name = "Benchmark target", description = "Slow and stateful endpoints to load test")
@RestController
@RequiredArgsConstructor
public class BenchTargetController {

  private final WorkloadService workloadService;
  private final CounterService counterService;
  private final AccountService accountService;

  // -----------------------------------------------------
  // Computations
  // -----------------------------------------------------
  @Operation(summary = "CPU-bound computation")
  @GetMapping("/compute")
  public Callable<ComputeResponse> compute() {
    return () -> new ComputeResponse(workloadService.compute());
  }

  @Operation(summary = "Increment the shared counter after a delay")
  @GetMapping("/counter")
  public Callable<CounterResponse> counter() {
    return () -> new CounterResponse(counterService.increment());
  }

  @Operation(summary = "Block for the configured slow delay")
  @GetMapping("/slow")
  public Callable<ResponseEntity<Void>> slow() {
    return () -> {
      workloadService.slowOperation();
      return ResponseEntity.ok().build();
    };
  }

  @Operation(summary = "Slow factorial", description = "0 <= n <= 15 unless configured otherwise")
  @GetMapping("/factorial/{n}")
  public Callable<FactorialResponse> factorial(@PathVariable int n) {
    return () -> new FactorialResponse(n, workloadService.factorial(n));
  }

  @Operation(summary = "Slow Fibonacci", description = "0 <= n <= 25 unless configured otherwise")
  @GetMapping("/fibonacci/{n}")
  public Callable<FibonacciResponse> fibonacci(@PathVariable int n) {
    return () -> new FibonacciResponse(n, workloadService.fibonacci(n));
  }

  // -----------------------------------------------------
  // Shared account
  // -----------------------------------------------------
  @Operation(summary = "Deposit into the shared account")
  @PostMapping("/deposit")
  public Callable<BalanceResponse> deposit(@Valid @RequestBody AmountRequest request) {
    log.debug("Deposit of {} requested", request.amount());
    return () -> new BalanceResponse(accountService.deposit(request.amount()));
  }

  @Operation(summary = "Withdraw from the shared account", description = "400 when funds are short")
  @PostMapping("/withdraw")
  public Callable<BalanceResponse> withdraw(@Valid @RequestBody AmountRequest request) {
    log.debug("Withdrawal of {} requested", request.amount());
    return () -> new BalanceResponse(accountService.withdraw(request.amount()));
  }

  @Operation(summary = "Current balance")
  @GetMapping("/account")
  public BalanceResponse account() {
    return new BalanceResponse(accountService.balance());
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse("ok");
  }
}
