package org.tanzu.azureagent.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import org.tanzu.azureagent.config.AgentProperties;
import org.tanzu.azureagent.intent.IntentHandler;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Wraps the intent handler in OpenAI chat-completion semantics.
 *
 * The intent handler blocks on outbound Azure calls, so every answer is
 * computed on the bounded-elastic scheduler rather than on a Netty event loop.
 */
@Service
public class ChatCompletionService {

    private static final Logger logger = LoggerFactory.getLogger(ChatCompletionService.class);

    static final String DONE = "[DONE]";

    private final IntentHandler intentHandler;
    private final AgentProperties agentProperties;
    private final ObjectMapper objectMapper;

    public ChatCompletionService(IntentHandler intentHandler, AgentProperties agentProperties, ObjectMapper objectMapper) {
        this.intentHandler = intentHandler;
        this.agentProperties = agentProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Extracts the query from a request.
     *
     * @throws ResponseStatusException 400 when the request carries no user message
     */
    public String requireUserMessage(ChatCompletionRequest request) {
        String userMessage = request == null ? null : request.lastUserMessage();
        if (userMessage == null || userMessage.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No user message found in request");
        }
        return userMessage;
    }

    /**
     * Answers a request with a single chat.completion object.
     */
    public Mono<ChatCompletionResponse> complete(ChatCompletionRequest request) {
        String userMessage = requireUserMessage(request);
        String model = modelOf(request);
        return answer(userMessage).map(text -> new ChatCompletionResponse(
                "chatcmpl-" + UUID.randomUUID(),
                Instant.now().getEpochSecond(),
                model,
                List.of(new ChatCompletionResponse.Choice(0, new ChatMessage("assistant", text), "stop")),
                new ChatCompletionResponse.Usage(countWords(userMessage), countWords(text))));
    }

    /**
     * Answers a request as server-sent chat.completion.chunk events.
     *
     * The whole answer goes out in one content chunk, followed by a chunk with
     * finish_reason "stop" and the [DONE] sentinel. Once the stream has started a
     * failure can no longer change the status code, so it is reported as content.
     */
    public Flux<ServerSentEvent<String>> stream(ChatCompletionRequest request) {
        String userMessage = requireUserMessage(request);
        String model = modelOf(request);
        String id = "chatcmpl-" + UUID.randomUUID();
        long created = Instant.now().getEpochSecond();

        return answer(userMessage)
                .onErrorResume(e -> {
                    logger.error("Error processing streamed chat completion: {}", e.getMessage(), e);
                    return Mono.just("Error processing request: " + e.getMessage());
                })
                .flatMapMany(text -> Flux.just(
                        chunk(new ChatCompletionChunk(id, created, model,
                                new ChatCompletionChunk.Choice(0, new ChatMessage("assistant", text), null))),
                        chunk(new ChatCompletionChunk(id, created, model,
                                new ChatCompletionChunk.Choice(0, new ChatMessage(), "stop"))),
                        ServerSentEvent.builder(DONE).build()));
    }

    /**
     * @return the single model this agent serves
     */
    public ModelList models() {
        return new ModelList(List.of(new ModelList.Model(
                agentProperties.getModelId(), 0L, agentProperties.getServiceName())));
    }

    private Mono<String> answer(String userMessage) {
        return Mono.fromCallable(() -> intentHandler.processQuery(userMessage))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String modelOf(ChatCompletionRequest request) {
        String model = request.getModel();
        return model == null || model.isBlank() ? agentProperties.getModelId() : model;
    }

    private ServerSentEvent<String> chunk(ChatCompletionChunk chunk) {
        try {
            return ServerSentEvent.builder(objectMapper.writeValueAsString(chunk)).build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize chat completion chunk", e);
        }
    }

    static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
