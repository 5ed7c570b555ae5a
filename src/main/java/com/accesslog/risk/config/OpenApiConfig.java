package com.accesslog.risk.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI accessLogRiskOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Access Log Risk API")
                        .version("1.0.0")
                        .description(
                                "Unsupervised behavioral risk scoring for access-log uploads.\n\n" +
                                "**Analysis Pipeline:**\n" +
                                "1. Upload a CSV via `POST /analysis/upload` (or a parsed table via `POST /analysis/table`)\n" +
                                "2. Resolve the address / timestamp / endpoint / status columns from known header aliases\n" +
                                "3. Aggregate each address into 5-minute epoch-aligned windows of behavioral features\n" +
                                "4. Standardize the batch and score every window with an Isolation Forest\n" +
                                "5. Rescale raw scores to a batch-relative 0-100 risk score\n" +
                                "6. Classify: **LOW** (<40), **MEDIUM** (40-75), **HIGH** (>=75)\n\n" +
                                "**Features per window:** failed count, total count, success ratio, " +
                                "unique endpoints, requests per minute, mean inter-request gap.\n\n" +
                                "Scores are relative to the uploaded batch; nothing is persisted between uploads.")
                        .contact(new Contact().name("Access Log Risk Team")));
    }
}
