package com.lanparty.booking.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI stationBookingOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Station Booking API")
                .description("REST API for reserving gaming stations over time windows, "
                    + "with overlap detection and per-station concurrency control.")
                .version("1.0.0"));
    }
}
