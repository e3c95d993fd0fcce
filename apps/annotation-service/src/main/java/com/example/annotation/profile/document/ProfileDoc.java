package com.example.annotation.profile.document;

import com.example.annotation.profile.model.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * MongoDB document for a caller profile.
 * The id is the external identity, so a second insert for the same caller
 * collides on {@code _id}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "profiles")
public class ProfileDoc {

    @Id
    private String id;

    @Indexed
    private Role role;

    private String fullName;

    /**
     * Optional four-digit secondary verification code. Never returned by the API.
     */
    private String pin;

    // Bumped when a session is started against this document
    private long revision;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
