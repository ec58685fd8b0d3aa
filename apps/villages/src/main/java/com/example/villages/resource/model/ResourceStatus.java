package com.example.villages.resource.model;

public enum ResourceStatus {
    DRAFT,
    ACTIVE,
    ARCHIVED,
    DELETED
}
