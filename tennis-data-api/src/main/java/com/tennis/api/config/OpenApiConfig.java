package com.tennis.api.config;

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
    public OpenAPI tennisDataOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Tennis Data API")
                        .description("Cleaning, validation and display formatting of live match feeds, " +
                                "plus rankings, profiles and head-to-head records from the historical archive.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Tennis Data")
                                .email("admin@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Dev")
                ));
    }
}
