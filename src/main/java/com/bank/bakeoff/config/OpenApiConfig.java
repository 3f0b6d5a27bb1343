package com.bank.bakeoff.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI modelBakeoffOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Model Bake-off API")
                        .version("1.0.0")
                        .description(
                                "Candidate comparison, champion selection and batch scoring for wire anomaly detection.\n\n" +
                                "**Bake-off lifecycle:**\n" +
                                "1. Upload a labeled dataset via `POST /datasets`\n" +
                                "2. Start a bake-off via `POST /bakeoffs` (status **QUEUED**)\n" +
                                "3. The worker builds the feature matrix (status **RUNNING**)\n" +
                                "4. Candidates are trained in order, by the worker (BATCH) or by " +
                                "`POST /bakeoffs/{id}/candidates/{index}/train` (INCREMENTAL)\n" +
                                "5. `POST /bakeoffs/{id}/finalize` applies the rubric and picks the champion (status **COMPLETED**)\n\n" +
                                "**Rubric:** candidates meeting every minimum are ranked by the weighted sum of " +
                                "`recallAtReviewRate`, `prAuc`, `precisionAtReviewRate`, `stability` and `explainability`. " +
                                "When none qualifies, all successfully trained candidates are ranked.\n\n" +
                                "**Scoring:** `POST /runs` scores a dataset with the champion or an explicit version, " +
                                "flags the top review-rate fraction and stores ranked findings with reason codes.")
                        .contact(new Contact().name("Anomaly Detection Team")));
    }
}
