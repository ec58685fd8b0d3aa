package com.example.villages.resource.model;

/**
 * Sharing tier of a resource instance.
 */
public enum Visibility {
    /** Creator only. */
    PRIVATE,
    /** Members of the resource's family. */
    FAMILY,
    /** Users holding a share for the resource. */
    SHARED,
    /** Everyone. */
    PUBLIC
}
