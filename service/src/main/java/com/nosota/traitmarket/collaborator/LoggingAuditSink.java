package com.nosota.traitmarket.collaborator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.traitmarket.model.ActorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Writes audit events as JSON lines to the {@code AUDIT} logger (routed separately in logback-spring.xml).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingAuditSink implements AuditSink {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    private final ObjectMapper objectMapper;

    @Override
    public void record(ActorType actorType, String action, Map<String, Object> payload) {
        try {
            AUDIT.info("{} {} {}", actorType, action, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to write audit event {} by {}: {}", action, actorType, e.getMessage());
        }
    }
}
