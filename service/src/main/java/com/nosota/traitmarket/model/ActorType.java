package com.nosota.traitmarket.model;

/**
 * Who triggered an audited action.
 */
public enum ActorType {
    USER,
    ADMIN,
    SYSTEM
}
