package com.uconnect.admissionsBot.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating identifiers of new conversations.
 */
@Service
public class SessionIdService {

    public String generateSessionId() {
        return UUID.randomUUID().toString();
    }
}
