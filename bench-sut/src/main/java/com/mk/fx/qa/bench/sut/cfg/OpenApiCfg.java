package com.mk.fx.qa.bench.sut.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("Benchmark Target API")
                .description(
                    "Deliberately slow endpoints sharing state, used as a load test target."));
  }
}
