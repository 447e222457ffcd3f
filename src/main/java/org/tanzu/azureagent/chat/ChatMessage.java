package org.tanzu.azureagent.chat;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One message of a chat conversation.
 *
 * Incoming content may be a plain string or an array of content parts; only the
 * text parts are kept, joined by newlines.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessage {

    private String role;
    private String content;

    public ChatMessage() {
    }

    public ChatMessage(String role, String content) {
        this.role = role;
        this.content = content;
    }

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }

    public String getContent() { return content; }

    @JsonProperty("content")
    public void setContent(JsonNode content) {
        this.content = textOf(content);
    }

    private static String textOf(JsonNode content) {
        if (content == null || content.isNull()) {
            return null;
        }
        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : content) {
                if ("text".equals(part.path("type").asText()) && part.hasNonNull("text")) {
                    if (sb.length() > 0) {
                        sb.append('\n');
                    }
                    sb.append(part.get("text").asText());
                }
            }
            return sb.toString();
        }
        return content.asText();
    }

    @Override
    public String toString() {
        return "ChatMessage{role='" + role + "', content='" + content + "'}";
    }
}
