package io.github.jakubt4.satti.controller;

import io.github.jakubt4.satti.dto.CreateSatelliteRequest;
import io.github.jakubt4.satti.dto.DeletedResponse;
import io.github.jakubt4.satti.dto.SatelliteResponse;
import io.github.jakubt4.satti.dto.SeedResponse;
import io.github.jakubt4.satti.dto.UpdateSatelliteRequest;
import io.github.jakubt4.satti.model.SatelliteType;
import io.github.jakubt4.satti.model.SatelliteTypeProfile;
import io.github.jakubt4.satti.service.registry.SatelliteRegistry;
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
import java.util.Map;

/**
 * Fleet management: satellite CRUD, mock fleet seeding and the static type catalogue.
 */
@RestController
@RequiredArgsConstructor
public class SatelliteController {

    private final SatelliteRegistry satelliteRegistry;

    @GetMapping("/satellite-types")
    public Map<SatelliteType, SatelliteTypeProfile> satelliteTypes() {
        return SatelliteTypeProfile.all();
    }

    @PostMapping("/satellites")
    @ResponseStatus(HttpStatus.CREATED)
    public SatelliteResponse create(@RequestBody final CreateSatelliteRequest request) {
        return satelliteRegistry.create(request);
    }

    @GetMapping("/satellites")
    public List<SatelliteResponse> list() {
        return satelliteRegistry.list();
    }

    @PatchMapping("/satellites/{satelliteId}")
    public SatelliteResponse update(@PathVariable final String satelliteId,
                                    @RequestBody final UpdateSatelliteRequest request) {
        return satelliteRegistry.update(satelliteId, request);
    }

    @DeleteMapping("/satellites/{satelliteId}")
    public DeletedResponse delete(@PathVariable final String satelliteId) {
        return satelliteRegistry.delete(satelliteId);
    }

    @PostMapping("/seed/mock-satellites")
    public SeedResponse seed() {
        return new SeedResponse(satelliteRegistry.seedDefaults());
    }
}
