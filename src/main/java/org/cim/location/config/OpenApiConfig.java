package org.cim.location.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration for the location API.
 */
@Configuration
public class OpenApiConfig {

  /**
   * Configures the OpenAPI specification.
   *
   * @return the configured OpenAPI instance
   */
  @Bean
  public OpenAPI customOpenApi() {
    return new OpenAPI()
        .info(new Info()
            .title("Location Server")
            .description("""
                **Event-sourced Location aggregates**

                Every change to a location is stored as an immutable event; the current \
                state is derived by replaying them.

                ## Key Features

                - **Lifecycle**: define, update, add metadata, archive
                - **Hierarchy**: parent/child links that are kept free of cycles, \
                including batch reparenting validated against the resulting hierarchy
                - **Optimistic Locking**: the version is returned as ETag; send it in \
                If-Match to pin the version a change is based on
                - **History**: full event history and state at any past version

                ## Error Handling

                All errors follow RFC 7807 Problem Details format \
                (`application/problem+json`) with a machine-readable `code`.
                """)
            .version("0.1.0"))
        .addServersItem(new Server()
            .url("http://localhost:8080")
            .description("Development server"));
  }
}
