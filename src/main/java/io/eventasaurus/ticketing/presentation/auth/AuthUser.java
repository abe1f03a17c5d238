package io.eventasaurus.ticketing.presentation.auth;

public record AuthUser(Long userId, String email) {
}
