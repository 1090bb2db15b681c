package com.study.webflux.funnel.infrastructure.common.template;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * 클래스패스 {@code templates/} 아래의 프롬프트 템플릿을 읽고 {@code {{name}}} 자리표시자를 치환합니다. 읽은 원문은 캐시합니다.
 */
@Component
public class FileBasedPromptTemplate {

	private static final List<String> TEMPLATE_EXTENSIONS = List.of(".md", ".txt");

	private final Map<String, String> cache = new ConcurrentHashMap<>();

	public String load(String templateName) {
		return load(templateName, Map.of());
	}

	public String load(String templateName, Map<String, String> variables) {
		String result = cache.computeIfAbsent(templateName, this::read);
		for (Map.Entry<String, String> entry : variables.entrySet()) {
			String value = entry.getValue() == null ? "" : entry.getValue();
			result = result.replace("{{" + entry.getKey() + "}}", value);
		}
		return result;
	}

	private String read(String templateName) {
		try {
			ClassPathResource resource = resolveResource(templateName);
			return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to load template: " + templateName, e);
		}
	}

	private ClassPathResource resolveResource(String templateName) throws IOException {
		for (String ext : TEMPLATE_EXTENSIONS) {
			ClassPathResource resource = new ClassPathResource("templates/" + templateName + ext);
			if (resource.exists()) {
				return resource;
			}
		}
		throw new IOException("Template not found for name: " + templateName);
	}
}
