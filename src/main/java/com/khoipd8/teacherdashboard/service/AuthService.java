package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.AuthResponseDto;
import com.khoipd8.teacherdashboard.exception.InvalidCredentialsException;
import com.khoipd8.teacherdashboard.exception.ValidationException;
import com.khoipd8.teacherdashboard.model.AuthenticationEntry;
import com.khoipd8.teacherdashboard.model.RecordMapper;
import com.khoipd8.teacherdashboard.table.JoinIndex;
import com.khoipd8.teacherdashboard.table.Sheets;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Employee-id login against the Authentication sheet. The issued token is a placeholder and is not
 * checked by any other endpoint.
 */
@Service
@Slf4j
public class AuthService {

    static final String TOKEN_PREFIX = "sample-token-";

    private final TableSnapshotLoader loader;
    private final Clock clock;

    public AuthService(TableSnapshotLoader loader, Clock clock) {
        this.loader = loader;
        this.clock = clock;
    }

    public AuthResponseDto authenticate(String employeeId) {
        if (employeeId == null || employeeId.isEmpty()) {
            throw new ValidationException("Employee ID is required");
        }

        List<AuthenticationEntry> entries = loader.load(Sheets.AUTHENTICATION)
                .records(Sheets.AUTHENTICATION, RecordMapper::authentication);
        if (!JoinIndex.on(entries, AuthenticationEntry::getId).contains(employeeId)) {
            log.warn("Rejected login for unknown employee id '{}'", employeeId);
            throw new InvalidCredentialsException("Invalid Employee ID");
        }

        return new AuthResponseDto(true, "Authentication successful", TOKEN_PREFIX + clock.millis());
    }
}
