package org.tanzu.azureagent.chat;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One server-sent event of a streamed chat completion.
 */
public class ChatCompletionChunk {

    private final String id;
    private final String object = "chat.completion.chunk";
    private final long created;
    private final String model;
    private final List<Choice> choices;

    public ChatCompletionChunk(String id, long created, String model, Choice choice) {
        this.id = id;
        this.created = created;
        this.model = model;
        this.choices = List.of(choice);
    }

    public String getId() { return id; }
    public String getObject() { return object; }
    public long getCreated() { return created; }
    public String getModel() { return model; }
    public List<Choice> getChoices() { return choices; }

    public static class Choice {
        private final int index;
        private final ChatMessage delta;

        /** Null on every chunk but the last */
        @JsonProperty("finish_reason")
        private final String finishReason;

        public Choice(int index, ChatMessage delta, String finishReason) {
            this.index = index;
            this.delta = delta;
            this.finishReason = finishReason;
        }

        public int getIndex() { return index; }
        public ChatMessage getDelta() { return delta; }
        public String getFinishReason() { return finishReason; }
    }
}
