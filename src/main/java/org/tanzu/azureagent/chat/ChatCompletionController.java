package org.tanzu.azureagent.chat;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.tanzu.azureagent.config.AgentProperties;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * OpenAI-compatible HTTP surface, so chat front ends can use the agent as a model.
 *
 * curl -X POST http://localhost:6003/v1/chat/completions \
 *   -H "Content-Type: application/json" \
 *   -d '{"model":"azure-agent","messages":[{"role":"user","content":"show all vms"}]}'
 */
@RestController
public class ChatCompletionController {

    private final ChatCompletionService chatCompletionService;
    private final AgentProperties agentProperties;

    public ChatCompletionController(ChatCompletionService chatCompletionService, AgentProperties agentProperties) {
        this.chatCompletionService = chatCompletionService;
        this.agentProperties = agentProperties;
    }

    @PostMapping(value = "/v1/chat/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<?>> chatCompletions(@RequestBody ChatCompletionRequest request) {
        if (request.isStream()) {
            ResponseEntity<?> events = ResponseEntity.ok()
                    .contentType(MediaType.TEXT_EVENT_STREAM)
                    .body(chatCompletionService.stream(request));
            return Mono.just(events);
        }
        return chatCompletionService.complete(request)
                .<ResponseEntity<?>>map(ResponseEntity::ok);
    }

    @GetMapping("/v1/models")
    public ModelList models() {
        return chatCompletionService.models();
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "service", agentProperties.getServiceName());
    }
}
