package com.apex.guardian.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI guardianOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Apex Guardian Core API")
                        .description("Multi-account signal execution and position guardian")
                        .version("1.0"));
    }
}
