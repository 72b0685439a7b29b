package com.mk.fx.qa.bench;

import com.mk.fx.qa.bench.cfg.BenchCommandLine;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BenchApplication {

  public static void main(String[] args) {
    var context =
        SpringApplication.run(BenchApplication.class, BenchCommandLine.toSpringArgs(args));
    System.exit(SpringApplication.exit(context));
  }
}
