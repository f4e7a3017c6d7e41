package io.github.drompincen.playdeck.gateway.controller;

import io.github.drompincen.playdeck.persistence.document.ProjectDocument;
import io.github.drompincen.playdeck.persistence.repository.ProjectRepository;
import io.github.drompincen.playdeck.protocol.api.CreateProjectRequest;
import io.github.drompincen.playdeck.protocol.api.ProjectDto;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProjectControllerTest {

    @Mock private ProjectRepository projectRepository;
    @Mock private PeriodicTaskService periodicTaskService;

    private ProjectController controller;

    @BeforeEach
    void setUp() {
        controller = new ProjectController(projectRepository, periodicTaskService);
    }

    @Test
    void createStoresNewProject() {
        when(projectRepository.findByNameIgnoreCase("infra")).thenReturn(Optional.empty());

        ResponseEntity<ProjectDto> response = controller.create(
                new CreateProjectRequest("infra", "git@example.com:ops/infra.git", null));

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody().status()).isEqualTo(ProjectDto.ProjectStatus.NEW);
        assertThat(response.getBody().variables()).isEmpty();
        verify(projectRepository).save(any(ProjectDocument.class));
    }

    @Test
    void createRejectsDuplicateName() {
        when(projectRepository.findByNameIgnoreCase("infra")).thenReturn(Optional.of(new ProjectDocument()));

        ResponseEntity<ProjectDto> response = controller.create(new CreateProjectRequest("infra", null, Map.of()));

        assertThat(response.getStatusCode().value()).isEqualTo(409);
        verify(projectRepository, never()).save(any());
    }

    @Test
    void createRequiresName() {
        assertThatThrownBy(() -> controller.create(new CreateProjectRequest(" ", null, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listReturnsAllProjects() {
        ProjectDocument doc = new ProjectDocument();
        doc.setProjectId("p-1");
        doc.setName("infra");
        when(projectRepository.findAllByOrderByUpdatedAtDesc()).thenReturn(List.of(doc));

        assertThat(controller.list()).extracting(ProjectDto::name).containsExactly("infra");
    }

    @Test
    void getReturns404WhenNotFound() {
        when(projectRepository.findById("bad")).thenReturn(Optional.empty());

        assertThat(controller.get("bad").getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void deleteCascadesToPeriodicTasks() {
        when(projectRepository.existsById("p-1")).thenReturn(true);

        ResponseEntity<Void> response = controller.delete("p-1");

        assertThat(response.getStatusCode().value()).isEqualTo(204);
        var order = inOrder(periodicTaskService, projectRepository);
        order.verify(periodicTaskService).deleteByProject("p-1");
        order.verify(projectRepository).deleteById("p-1");
    }

    @Test
    void deleteReturns404WhenNotFound() {
        when(projectRepository.existsById("bad")).thenReturn(false);

        assertThat(controller.delete("bad").getStatusCode().value()).isEqualTo(404);
        verifyNoInteractions(periodicTaskService);
    }
}
