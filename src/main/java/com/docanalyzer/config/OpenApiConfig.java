package com.docanalyzer.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI documentAnalyzerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Financial Document Analyzer API")
                        .description("Queued and synchronous analysis of uploaded financial PDF documents")
                        .version("1.0.0"));
    }
}
