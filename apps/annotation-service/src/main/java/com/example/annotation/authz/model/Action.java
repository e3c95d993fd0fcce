package com.example.annotation.authz.model;

/**
 * Actions - what the subject wants to do with the resource.
 */
public enum Action {
    /**
     * Read a record or list records.
     * Navigator: own profile, any case, own sessions and their ratings.
     */
    SELECT,

    /**
     * Create a record.
     * Navigator: own profile, own sessions, ratings on own sessions.
     */
    INSERT,

    /**
     * Modify a record in place.
     * Navigator: own sessions and ratings on own sessions. Never profiles or cases.
     */
    UPDATE,

    /**
     * Remove a record (cascading for cases, profiles and sessions).
     * Navigator: own sessions and ratings on own sessions.
     */
    DELETE
}
