package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.AuthResponseDto;
import com.khoipd8.teacherdashboard.exception.InvalidCredentialsException;
import com.khoipd8.teacherdashboard.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.khoipd8.teacherdashboard.service.InMemoryTableStore.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuthServiceTest {

    private final InMemoryTableStore store = new InMemoryTableStore()
            .sheet("Authentication", List.of("EmployeeId", "Token"), List.of(row("EMP001", "x")));

    private final AuthService service = new AuthService(store.loader(),
            Clock.fixed(Instant.ofEpochMilli(1710403200000L), ZoneOffset.UTC));

    @Test
    void knownEmployeeGetsPlaceholderToken() {
        AuthResponseDto response = service.authenticate("EMP001");

        assertTrue(response.isSuccess());
        assertEquals("Authentication successful", response.getMessage());
        assertEquals("sample-token-1710403200000", response.getToken());
    }

    @Test
    void headerRowIsNotACredential() {
        assertThrows(InvalidCredentialsException.class, () -> service.authenticate("EmployeeId"));
    }

    @Test
    void missingIdIsRejectedBeforeFetching() {
        assertThrows(ValidationException.class, () -> service.authenticate(""));
        assertThrows(ValidationException.class, () -> service.authenticate(null));
        assertTrue(store.fetchedRanges().isEmpty());
    }
}
