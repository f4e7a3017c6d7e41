package io.github.drompincen.playdeck.gateway.controller;

import io.github.drompincen.playdeck.persistence.document.InventoryDocument;
import io.github.drompincen.playdeck.persistence.repository.InventoryRepository;
import io.github.drompincen.playdeck.protocol.api.CreateInventoryRequest;
import io.github.drompincen.playdeck.protocol.api.InventoryDto;
import io.github.drompincen.playdeck.runtime.periodic.PeriodicTaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/inventories")
public class InventoryController {

    private final InventoryRepository inventoryRepository;
    private final PeriodicTaskService periodicTaskService;

    public InventoryController(InventoryRepository inventoryRepository, PeriodicTaskService periodicTaskService) {
        this.inventoryRepository = inventoryRepository;
        this.periodicTaskService = periodicTaskService;
    }

    @PostMapping
    public ResponseEntity<InventoryDto> create(@RequestBody CreateInventoryRequest req) {
        if (req.name() == null || req.name().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        InventoryDocument doc = new InventoryDocument();
        doc.setInventoryId(UUID.randomUUID().toString());
        doc.setName(req.name());
        doc.setHosts(req.hosts() != null ? req.hosts() : List.of());
        doc.setVariables(req.variables() != null ? req.variables() : Map.of());
        doc.setCreatedAt(Instant.now());
        doc.setUpdatedAt(Instant.now());
        inventoryRepository.save(doc);
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(doc));
    }

    @GetMapping
    public List<InventoryDto> list() {
        return inventoryRepository.findAllByOrderByNameAsc().stream()
                .map(this::toDto).collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<InventoryDto> get(@PathVariable String id) {
        return inventoryRepository.findById(id)
                .map(d -> ResponseEntity.ok(toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (inventoryRepository.existsById(id)) {
            periodicTaskService.deleteByInventory(id);
            inventoryRepository.deleteById(id);
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }

    private InventoryDto toDto(InventoryDocument doc) {
        return new InventoryDto(doc.getInventoryId(), doc.getName(), doc.getHosts(),
                doc.getVariables(), doc.getCreatedAt(), doc.getUpdatedAt());
    }
}
