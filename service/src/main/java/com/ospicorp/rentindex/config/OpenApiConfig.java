package com.ospicorp.rentindex.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
  static final String BEARER_SCHEME = "bearer-jwt";

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Rent Index API")
            .version("v1")
            .description("Regional rent index series, SARIMA forecasts with 95% bands, "
                + "volatility indices and batch runs")
            .contact(new Contact().name("Housing Analytics Team").email("rent-index@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")))
        .tags(List.of(
            new Tag().name("Regions").description("Region catalog of the configured dataset"),
            new Tag().name("Data").description("Series, forecasts, volatility and trend"),
            new Tag().name("Batch").description("Forecast and volatility artifacts per region")))
        .components(new Components().addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
            .type(SecurityScheme.Type.HTTP)
            .scheme("bearer")
            .bearerFormat("JWT")
            .description("Required when security.auth.enabled=true; POST /v1/batch also needs "
                + "the batch:run scope")));
  }
}
