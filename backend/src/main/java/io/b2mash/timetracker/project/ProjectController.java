package io.b2mash.timetracker.project;

import io.b2mash.timetracker.client.ClientService;
import io.b2mash.timetracker.pagination.PageQuery;
import io.b2mash.timetracker.pagination.PagedResponse;
import io.b2mash.timetracker.pagination.Paginator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping({"/api/projects", "/api/v1/projects"})
public class ProjectController {

  private final ProjectService projectService;
  private final ClientService clientService;

  public ProjectController(ProjectService projectService, ClientService clientService) {
    this.projectService = projectService;
    this.clientService = clientService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProjectResponse> getProject(@PathVariable Long id) {
    return ResponseEntity.ok(toResponse(projectService.getProject(id)));
  }

  @GetMapping
  public ResponseEntity<PagedResponse<ProjectResponse>> listProjects(
      @RequestParam(defaultValue = "1") int page, @RequestParam(defaultValue = "5") int size) {
    return ResponseEntity.ok(
        Paginator.paginate(PageQuery.of(page, size), projectService::findPage, this::toResponses));
  }

  @PostMapping
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<ProjectResponse> createProject(@Valid @RequestBody ProjectRequest request) {
    var project = projectService.createProject(request.name(), request.clientId());
    return ResponseEntity.created(URI.create("/api/projects/" + project.getId()))
        .body(toResponse(project));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<ProjectResponse> updateProject(
      @PathVariable Long id, @Valid @RequestBody ProjectRequest request) {
    var project = projectService.updateProject(id, request.name(), request.clientId());
    return ResponseEntity.ok(toResponse(project));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Void> deleteProject(@PathVariable Long id) {
    projectService.deleteProject(id);
    return ResponseEntity.ok().build();
  }

  private ProjectResponse toResponse(Project project) {
    return toResponses(List.of(project)).get(0);
  }

  // Client names in one query per page
  private List<ProjectResponse> toResponses(List<Project> projects) {
    var clientIds = projects.stream().map(Project::getClientId).distinct().toList();
    Map<Long, String> clientNames = clientService.resolveNames(clientIds);
    return projects.stream()
        .map(p -> ProjectResponse.from(p, clientNames.get(p.getClientId())))
        .toList();
  }

  // --- DTOs ---

  public record ProjectRequest(
      @NotBlank(message = "name is required")
          @Size(max = 100, message = "name must be at most 100 characters")
          String name,
      @NotNull(message = "clientId is required") @Positive(message = "clientId must be positive")
          Long clientId) {}

  public record ProjectResponse(Long id, String name, Long clientId, String clientName) {

    public static ProjectResponse from(Project project, String clientName) {
      return new ProjectResponse(
          project.getId(), project.getName(), project.getClientId(), clientName);
    }
  }
}
