package com.signal.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI streamAnomalyDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Stream Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Sliding-window anomaly detection for numeric time series.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Buffer incoming values until the window holds `windowSize` samples\n" +
                                "2. Train a fresh Isolation Forest on the full window\n" +
                                "3. Flag the top `contamination` share of the window's anomaly scores\n" +
                                "4. Emit verdicts for samples not yet classified (all of the first window, then the newest `slideSize`)\n" +
                                "5. Slide: drop the oldest `slideSize` samples and keep the rest as context\n" +
                                "6. At end of stream, score the remaining buffer once and emit the leftovers\n\n" +
                                "Every sample receives exactly one verdict, in stream order.")
                        .contact(new Contact().name("Stream Anomaly Detection Team")));
    }
}
