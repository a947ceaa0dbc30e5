package com.mk.fx.qa.vecro.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi(VecroSettings settings) {
    return new OpenAPI()
        .info(
            new Info()
                .title("vecro-mongodb " + settings.name())
                .description(
                    "Synthetic microservice that issues a fixed number of MongoDB reads and"
                        + " writes per request."));
  }
}
