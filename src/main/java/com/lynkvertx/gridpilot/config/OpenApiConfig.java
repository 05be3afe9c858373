package com.lynkvertx.gridpilot.config;

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
    public OpenAPI gridPilotOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("GridPilot API")
                .description("Tariff and carbon aware appliance scheduling and autopilot decisions")
                .version("0.1.0")
                .contact(new Contact()
                    .name("GridPilot Team")
                    .email("support@lynkvertx.com"))
                .license(new License()
                    .name("Proprietary")));
    }
}
