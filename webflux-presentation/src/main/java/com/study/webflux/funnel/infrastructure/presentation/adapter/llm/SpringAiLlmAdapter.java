package com.study.webflux.funnel.infrastructure.presentation.adapter.llm;

import java.util.List;

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.stereotype.Component;

import com.study.webflux.funnel.domain.generation.model.CompletionRequest;
import com.study.webflux.funnel.domain.generation.model.Message;
import com.study.webflux.funnel.domain.generation.port.LlmPort;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Spring AI {@link ChatModel} 기반 LLM 어댑터입니다. 블로킹 호출은 boundedElastic 스케줄러에서 실행합니다.
 */
@Component
public class SpringAiLlmAdapter implements LlmPort {

	private final ChatModel chatModel;

	public SpringAiLlmAdapter(ChatModel chatModel) {
		this.chatModel = chatModel;
	}

	@Override
	public Mono<String> complete(CompletionRequest request) {
		Prompt prompt = new Prompt(convertMessages(request.messages()), buildOptions(request));

		return Mono.fromCallable(() -> {
			ChatResponse response = chatModel.call(prompt);

			var result = response == null ? null : response.getResult();
			if (result == null || result.getOutput() == null) {
				throw new IllegalStateException("Invalid response from LLM");
			}
			return result.getOutput().getText();
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private OpenAiChatOptions buildOptions(CompletionRequest request) {
		OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
			.model(request.model())
			.temperature(request.temperature())
			.maxTokens(request.maxTokens());
		if (request.jsonResponse()) {
			builder.responseFormat(ResponseFormat.builder()
				.type(ResponseFormat.Type.JSON_OBJECT)
				.build());
		}
		return builder.build();
	}

	private List<org.springframework.ai.chat.messages.Message> convertMessages(
		List<Message> messages) {
		return messages.stream().map(this::convertMessage).toList();
	}

	private org.springframework.ai.chat.messages.Message convertMessage(Message message) {
		return switch (message.role()) {
			case SYSTEM -> new SystemMessage(message.content());
			case USER -> new UserMessage(message.content());
			case ASSISTANT -> new AssistantMessage(message.content());
		};
	}
}
