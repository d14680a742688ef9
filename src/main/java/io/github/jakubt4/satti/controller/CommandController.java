package io.github.jakubt4.satti.controller;

import io.github.jakubt4.satti.dto.CommandStatusResponse;
import io.github.jakubt4.satti.dto.UplinkCommandRequest;
import io.github.jakubt4.satti.dto.UplinkCommandResponse;
import io.github.jakubt4.satti.service.UplinkService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Uplink submission and command status.
 *
 * <p>{@code POST /uplink} answers {@code 202 Accepted} with the command in {@code QUEUED};
 * clients poll {@code GET /commands/{id}} to follow the lifecycle.
 */
@RestController
@RequiredArgsConstructor
public class CommandController {

    private final UplinkService uplinkService;

    @PostMapping("/uplink")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public UplinkCommandResponse uplink(@RequestBody final UplinkCommandRequest request) {
        return uplinkService.submit(request);
    }

    @GetMapping("/commands")
    public List<CommandStatusResponse> list() {
        return uplinkService.listStatus();
    }

    @GetMapping("/commands/{commandId}")
    public CommandStatusResponse status(@PathVariable final String commandId) {
        return uplinkService.getStatus(commandId);
    }

    /**
     * Re-runs a {@code FAILED} command.
     *
     * @return {@code 202 Accepted} with the reset status, {@code 404} for an unknown id,
     *         {@code 409} while in flight or after success
     */
    @PostMapping("/commands/{commandId}/rerun")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public CommandStatusResponse rerun(@PathVariable final String commandId) {
        return uplinkService.rerun(commandId);
    }
}
