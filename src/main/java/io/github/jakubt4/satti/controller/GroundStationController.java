package io.github.jakubt4.satti.controller;

import io.github.jakubt4.satti.dto.CreateGroundStationRequest;
import io.github.jakubt4.satti.dto.DeletedResponse;
import io.github.jakubt4.satti.dto.GroundStationResponse;
import io.github.jakubt4.satti.dto.SeedResponse;
import io.github.jakubt4.satti.dto.UpdateGroundStationRequest;
import io.github.jakubt4.satti.service.registry.GroundStationRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class GroundStationController {

    private final GroundStationRegistry groundStationRegistry;

    @PostMapping("/ground-stations")
    @ResponseStatus(HttpStatus.CREATED)
    public GroundStationResponse create(@RequestBody final CreateGroundStationRequest request) {
        return groundStationRegistry.create(request);
    }

    @GetMapping("/ground-stations")
    public List<GroundStationResponse> list() {
        return groundStationRegistry.list();
    }

    @PatchMapping("/ground-stations/{groundStationId}")
    public GroundStationResponse update(@PathVariable final String groundStationId,
                                        @RequestBody final UpdateGroundStationRequest request) {
        return groundStationRegistry.update(groundStationId, request);
    }

    @DeleteMapping("/ground-stations/{groundStationId}")
    public DeletedResponse delete(@PathVariable final String groundStationId) {
        return groundStationRegistry.delete(groundStationId);
    }

    @PostMapping("/seed/mock-ground-stations")
    public SeedResponse seed() {
        return new SeedResponse(groundStationRegistry.seedDefaults());
    }
}
