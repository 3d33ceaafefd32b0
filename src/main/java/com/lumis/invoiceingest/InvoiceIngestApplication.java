package com.lumis.invoiceingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.lumis.invoiceingest")
@EnableJpaRepositories(basePackages = "com.lumis.invoiceingest.infrastructure.jpa")
@EntityScan(basePackages = "com.lumis.invoiceingest.infrastructure.jpa")
public class InvoiceIngestApplication {
	public static void main(String[] args) {
		SpringApplication.run(InvoiceIngestApplication.class, args);
	}
}
