package com.example.villages.authz.model;

/**
 * Entity kinds that carry their own rule table.
 */
public enum ResourceType {
    DOCUMENT,
    MESSAGE,
    FAMILY,
    USER,
    NOTIFICATION,
    CARE_PLAN,
    ACTIVITY,
    RESOURCE
}
