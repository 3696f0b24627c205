package com.kotsin.optionsengine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI engineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Kotsin Options Scalping Engine API")
                        .description("Signals, market states, pattern scores, positions and session statistics for the "
                                + "NIFTY / BANKNIFTY / SENSEX option legs, plus manual enter/exit commands and risk knobs.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Kotsin Development Team")
                                .email("dev@kotsin.com")))
                .servers(List.of(new Server()
                        .url("/")
                        .description("Relative base URL")));
    }
}
