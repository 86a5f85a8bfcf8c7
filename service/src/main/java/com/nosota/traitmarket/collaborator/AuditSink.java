package com.nosota.traitmarket.collaborator;

import com.nosota.traitmarket.model.ActorType;

import java.util.Map;

/**
 * Fire-and-forget audit trail. Implementations must never throw into the caller.
 */
public interface AuditSink {

    void record(ActorType actorType, String action, Map<String, Object> payload);
}
