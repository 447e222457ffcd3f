package org.tanzu.azureagent.chat;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Non-streaming chat completion in the OpenAI wire shape.
 */
public class ChatCompletionResponse {

    private final String id;
    private final String object = "chat.completion";
    private final long created;
    private final String model;
    private final List<Choice> choices;
    private final Usage usage;

    public ChatCompletionResponse(String id, long created, String model, List<Choice> choices, Usage usage) {
        this.id = id;
        this.created = created;
        this.model = model;
        this.choices = choices;
        this.usage = usage;
    }

    public String getId() { return id; }
    public String getObject() { return object; }
    public long getCreated() { return created; }
    public String getModel() { return model; }
    public List<Choice> getChoices() { return choices; }
    public Usage getUsage() { return usage; }

    public static class Choice {
        private final int index;
        private final ChatMessage message;

        @JsonProperty("finish_reason")
        private final String finishReason;

        public Choice(int index, ChatMessage message, String finishReason) {
            this.index = index;
            this.message = message;
            this.finishReason = finishReason;
        }

        public int getIndex() { return index; }
        public ChatMessage getMessage() { return message; }
        public String getFinishReason() { return finishReason; }
    }

    /**
     * Word counts standing in for token counts.
     */
    public static class Usage {
        @JsonProperty("prompt_tokens")
        private final int promptTokens;

        @JsonProperty("completion_tokens")
        private final int completionTokens;

        @JsonProperty("total_tokens")
        private final int totalTokens;

        public Usage(int promptTokens, int completionTokens) {
            this.promptTokens = promptTokens;
            this.completionTokens = completionTokens;
            this.totalTokens = promptTokens + completionTokens;
        }

        public int getPromptTokens() { return promptTokens; }
        public int getCompletionTokens() { return completionTokens; }
        public int getTotalTokens() { return totalTokens; }
    }
}
