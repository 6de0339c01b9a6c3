package com.example.authservice.dto;

import com.example.authservice.entity.User;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * User DTO for API responses. Never carries the password hash.
 */
public record UserDto(
    @JsonProperty("id")
    String id,

    @JsonProperty("email")
    String email,

    @JsonProperty("name")
    String name,

    @JsonProperty("created_at")
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime createdAt
) {
    /**
     * Factory method to create UserDto from User entity.
     */
    public static UserDto fromEntity(User user) {
        return new UserDto(
            user.getId(),
            user.getEmail(),
            user.getName(),
            user.getCreatedAt()
        );
    }
}
