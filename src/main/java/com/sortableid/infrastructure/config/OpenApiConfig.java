package com.sortableid.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String REQUEST_ID_HEADER = "X-Request-Id";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Sortable ID API")
                        .version("1.0")
                        .description("Issues and decodes lexicographically sortable identifiers"));
    }

    @Bean
    public OperationCustomizer addRequestIdHeader() {
        return (operation, handlerMethod) -> {
            // optional on every call; generated by the server when absent
            operation.addParametersItem(new HeaderParameter()
                    .name(REQUEST_ID_HEADER)
                    .required(false)
                    .description("Correlation ID echoed back in the response")
                    .schema(new StringSchema()));
            return operation;
        };
    }
}
