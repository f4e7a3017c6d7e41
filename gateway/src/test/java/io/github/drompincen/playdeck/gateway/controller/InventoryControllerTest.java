package io.github.drompincen.playdeck.gateway.controller;

import io.github.drompincen.playdeck.persistence.document.InventoryDocument;
import io.github.drompincen.playdeck.persistence.repository.InventoryRepository;
import io.github.drompincen.playdeck.protocol.api.CreateInventoryRequest;
import io.github.drompincen.playdeck.protocol.api.InventoryDto;
import io.github.drompincen.playdeck.runtime.periodic.PeriodicTaskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InventoryControllerTest {

    @Mock private InventoryRepository inventoryRepository;
    @Mock private PeriodicTaskService periodicTaskService;

    private InventoryController controller;

    @BeforeEach
    void setUp() {
        controller = new InventoryController(inventoryRepository, periodicTaskService);
    }

    @Test
    void createStoresHostsAndVariables() {
        ResponseEntity<InventoryDto> response = controller.create(new CreateInventoryRequest(
                "prod", List.of("web1", "web2"), Map.of("ansible_user", "deploy")));

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody().hosts()).containsExactly("web1", "web2");
        assertThat(response.getBody().inventoryId()).isNotBlank();
        verify(inventoryRepository).save(any(InventoryDocument.class));
    }

    @Test
    void getReturnsInventoryWhenFound() {
        InventoryDocument doc = new InventoryDocument();
        doc.setInventoryId("i-1");
        doc.setName("prod");
        when(inventoryRepository.findById("i-1")).thenReturn(Optional.of(doc));

        ResponseEntity<InventoryDto> response = controller.get("i-1");

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody().name()).isEqualTo("prod");
    }

    @Test
    void listIsSortedByRepository() {
        when(inventoryRepository.findAllByOrderByNameAsc()).thenReturn(List.of(new InventoryDocument()));

        assertThat(controller.list()).hasSize(1);
    }

    @Test
    void deleteCascadesToPeriodicTasks() {
        when(inventoryRepository.existsById("i-1")).thenReturn(true);

        assertThat(controller.delete("i-1").getStatusCode().value()).isEqualTo(204);
        verify(periodicTaskService).deleteByInventory("i-1");
        verify(inventoryRepository).deleteById("i-1");
    }
}
