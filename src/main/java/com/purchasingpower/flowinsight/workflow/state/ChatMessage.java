package com.purchasingpower.flowinsight.workflow.state;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.datatype.jsr310.deser.LocalDateTimeDeserializer;
import com.fasterxml.jackson.datatype.jsr310.ser.LocalDateTimeSerializer;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Single message in the investigation conversation.
 *
 * <p>Vendor neutral: the gateway maps it to the provider's own message types.
 */
@Value
@Builder
@Jacksonized
public class ChatMessage implements Serializable {

    public enum Role {
        SYSTEM,
        USER,
        ASSISTANT,
        TOOL
    }

    Role role;

    String content;

    /** Tool calls requested by an assistant message. */
    @Singular
    List<ToolCall> toolCalls;

    /** For TOOL messages: the id of the call this result answers. */
    String toolCallId;

    /** For TOOL messages: the name of the tool that produced the result. */
    String toolName;

    @JsonSerialize(using = LocalDateTimeSerializer.class)
    @JsonDeserialize(using = LocalDateTimeDeserializer.class)
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss.SSSSSSS")
    LocalDateTime timestamp;

    public static ChatMessage system(String content) {
        return of(Role.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return of(Role.USER, content);
    }

    public static ChatMessage assistant(String content, List<ToolCall> toolCalls) {
        return ChatMessage.builder()
                .role(Role.ASSISTANT)
                .content(content)
                .toolCalls(toolCalls == null ? List.of() : toolCalls)
                .timestamp(LocalDateTime.now())
                .build();
    }

    public static ChatMessage toolResult(ToolCall call, String result) {
        return ChatMessage.builder()
                .role(Role.TOOL)
                .content(result)
                .toolCallId(call.getId())
                .toolName(call.getName())
                .timestamp(LocalDateTime.now())
                .build();
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return role == Role.ASSISTANT && toolCalls != null && !toolCalls.isEmpty();
    }

    private static ChatMessage of(Role role, String content) {
        return ChatMessage.builder()
                .role(role)
                .content(content)
                .timestamp(LocalDateTime.now())
                .build();
    }
}
