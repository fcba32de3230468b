package com.uconnect.admissionsBot.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for chat messages.
 * A missing sessionId starts a new conversation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    private String sessionId;

    @NotBlank(message = "messageText cannot be blank")
    @Size(max = 1000, message = "messageText cannot exceed 1000 characters")
    private String messageText;
}
