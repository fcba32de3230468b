package com.uconnect.admissionsBot.gateway.dto;

import com.uconnect.admissionsBot.repository.model.ChatMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoryResponse {

    private String sessionId;
    private List<ChatMessage> messages;
}
