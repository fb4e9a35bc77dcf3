package com.wgbot.domain.model;

/**
 * Bot user identified by a chat-platform id.
 */
public record User(
        long id,
        long telegramId,
        String username,
        String firstName,
        String lastName,
        boolean admin
) {
    public String displayName() {
        if (username == null || username.isBlank()) {
            return "ID: " + telegramId;
        }
        return username;
    }
}
