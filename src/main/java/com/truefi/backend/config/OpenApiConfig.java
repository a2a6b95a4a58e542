package com.truefi.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI truefiOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("TrueFi Financial Signals API")
                        .description("Recurring income detection and goal progress tracking over synced bank data.")
                        .version("v1")
                        .contact(new Contact()
                                .name("TrueFi")
                                .email("support@truefi.app")
                        )
                );
    }
}
