package com.ecoWasteEngine.controller;

import com.ecoWasteEngine.dto.PickupCreateDTO;
import com.ecoWasteEngine.dto.PickupResponseDTO;
import com.ecoWasteEngine.dto.PickupTransitionDTO;
import com.ecoWasteEngine.model.Pickup;
import com.ecoWasteEngine.model.enums.PickupStatus;
import com.ecoWasteEngine.service.PickupStateMachine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/pickups")
@RequiredArgsConstructor
@Validated
public class PickupController {

    private final PickupStateMachine pickupStateMachine;

    @PostMapping
    public ResponseEntity<PickupResponseDTO> requestPickup(
            @Valid @RequestBody PickupCreateDTO body,
            Authentication authentication) {
        Pickup pickup = pickupStateMachine.requestPickup(authentication.getName(), body.getWasteEntryId(),
                body.getAddress(), body.getScheduledDate(), body.isManualHandling());
        return ResponseEntity.status(HttpStatus.CREATED).body(PickupResponseDTO.fromModel(pickup));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PickupResponseDTO> getPickup(@PathVariable String id) {
        return ResponseEntity.ok(PickupResponseDTO.fromModel(pickupStateMachine.get(id)));
    }

    /** Work queue for dispatchers and drivers, oldest first */
    @GetMapping
    public ResponseEntity<List<PickupResponseDTO>> listPickups(
            @RequestParam(defaultValue = "REQUESTED") PickupStatus status,
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit) {
        List<PickupResponseDTO> dtos = pickupStateMachine.listByStatus(status, limit).stream()
                .map(PickupResponseDTO::fromModel)
                .collect(Collectors.toList());
        return ResponseEntity.ok(dtos);
    }

    /** 409 PICKUP_CONFLICT on a stale version, 409 INVALID_TRANSITION on an edge outside the graph */
    @PostMapping("/{id}/transition")
    public ResponseEntity<PickupResponseDTO> transition(
            @PathVariable String id,
            @Valid @RequestBody PickupTransitionDTO body,
            Authentication authentication) {
        Pickup pickup = pickupStateMachine.transition(id, body.getToStatus(), body.getVersion(),
                authentication.getName(), body.getDriverId(), body.getReason());
        return ResponseEntity.ok(PickupResponseDTO.fromModel(pickup));
    }
}
