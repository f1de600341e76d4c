package com.lynkvertx.vzev.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI (Swagger) Configuration
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI vzevOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("vZEV Billing API")
                .description("Interval completeness checks, proportional solar allocation and member billing for energy collectives")
                .version("0.1.0")
                .contact(new Contact()
                    .name("vZEV Team")
                    .email("support@lynkvertx.com"))
                .license(new License()
                    .name("Proprietary")
                    .url("https://lynkvertx.com/license")));
    }
}
