package com.automate.CodeAudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CodeAuditApplication {
	public static void main(String[] args) {
		SpringApplication.run(CodeAuditApplication.class, args);
	}

}
