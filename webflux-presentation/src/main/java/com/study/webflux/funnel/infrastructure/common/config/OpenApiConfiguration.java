package com.study.webflux.funnel.infrastructure.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;

@Configuration
public class OpenApiConfiguration {

	@Bean
	public OpenAPI openAPI() {
		return new OpenAPI()
			.info(new Info()
				.title("Funnel Presentation API")
				.description("""
					Resumable streaming slide generation.
					GET /api/presentations/generate/stream streams slides as Server-Sent Events \
					(connected, slide_generated, progress, completed, error) and resumes a draft \
					with resumePresentationId and resumeFromSlide.
					GET /api/presentations/{id} returns the generation status and the next slide \
					to resume from.
					Callers identify themselves with the X-User-Id header.""")
				.version("1.0.0"));
	}
}
