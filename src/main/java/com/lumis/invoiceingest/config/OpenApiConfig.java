package com.lumis.invoiceingest.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI invoiceIngestOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Invoice Ingest API")
                        .description("""
                                Acquisition of DGI (Panama) electronic invoices from their QR confirmation URL.

                                ## Outcomes
                                Every submission ends in exactly one of:
                                - `COMMITTED`: header, line items and payments were stored together
                                - `DUPLICATE`: the CUFE is already on file, nothing was written
                                - `FALLBACK_PENDING`: the page could not be fetched, read or stored;
                                  the submission was queued for manual recovery
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Lumis Backend Team")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")));
    }
}
