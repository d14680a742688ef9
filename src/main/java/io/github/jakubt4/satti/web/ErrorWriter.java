package io.github.jakubt4.satti.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.satti.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

import java.io.IOException;

/**
 * Writes an {@link ErrorResponse} from a servlet filter, where the controller advice does not apply.
 */
final class ErrorWriter {

    private ErrorWriter() {
    }

    static void write(final ObjectMapper objectMapper,
                      final HttpServletResponse response,
                      final HttpStatus status,
                      final String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), new ErrorResponse(status.name(), message));
    }
}
