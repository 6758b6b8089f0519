package io.b2mash.timetracker.timeentry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.b2mash.timetracker.client.ClientService;
import io.b2mash.timetracker.pagination.PageQuery;
import io.b2mash.timetracker.pagination.PagedResponse;
import io.b2mash.timetracker.pagination.Paginator;
import io.b2mash.timetracker.project.Project;
import io.b2mash.timetracker.project.ProjectService;
import io.b2mash.timetracker.user.UserService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
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
@RequestMapping({"/api/time-entries", "/api/v1/time-entries"})
public class TimeEntryController {

  private final TimeEntryService timeEntryService;
  private final UserService userService;
  private final ProjectService projectService;
  private final ClientService clientService;

  public TimeEntryController(
      TimeEntryService timeEntryService,
      UserService userService,
      ProjectService projectService,
      ClientService clientService) {
    this.timeEntryService = timeEntryService;
    this.userService = userService;
    this.projectService = projectService;
    this.clientService = clientService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<TimeEntryResponse> getTimeEntry(@PathVariable Long id) {
    return ResponseEntity.ok(toResponse(timeEntryService.getTimeEntry(id)));
  }

  @GetMapping
  public ResponseEntity<PagedResponse<TimeEntryResponse>> listTimeEntries(
      @RequestParam(defaultValue = "1") int page, @RequestParam(defaultValue = "5") int size) {
    return ResponseEntity.ok(
        Paginator.paginate(
            PageQuery.of(page, size), timeEntryService::findPage, this::toResponses));
  }

  @GetMapping("/user/{userId}/{year}/{month}")
  public ResponseEntity<List<TimeEntryResponse>> listTimeEntriesForMonth(
      @PathVariable Long userId, @PathVariable int year, @PathVariable int month) {
    return ResponseEntity.ok(
        toResponses(timeEntryService.findByUserAndMonth(userId, year, month)));
  }

  @PostMapping
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<TimeEntryResponse> createTimeEntry(
      @Valid @RequestBody TimeEntryRequest request) {
    var entry =
        timeEntryService.createTimeEntry(
            request.userId(),
            request.projectId(),
            request.entryDate(),
            request.hours(),
            request.description());
    return ResponseEntity.created(URI.create("/api/time-entries/" + entry.getId()))
        .body(toResponse(entry));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<TimeEntryResponse> updateTimeEntry(
      @PathVariable Long id, @Valid @RequestBody TimeEntryRequest request) {
    var entry =
        timeEntryService.updateTimeEntry(
            id,
            request.userId(),
            request.projectId(),
            request.entryDate(),
            request.hours(),
            request.description());
    return ResponseEntity.ok(toResponse(entry));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Void> deleteTimeEntry(@PathVariable Long id) {
    timeEntryService.deleteTimeEntry(id);
    return ResponseEntity.ok().build();
  }

  private TimeEntryResponse toResponse(TimeEntry entry) {
    return toResponses(List.of(entry)).get(0);
  }

  // Batch-load user, project and client names (3 queries instead of 3N)
  private List<TimeEntryResponse> toResponses(List<TimeEntry> entries) {
    if (entries.isEmpty()) {
      return List.of();
    }
    var userNames =
        userService.resolveNames(entries.stream().map(TimeEntry::getUserId).distinct().toList());
    var projects =
        projectService.resolveProjects(
            entries.stream().map(TimeEntry::getProjectId).distinct().toList());
    var clientNames =
        clientService.resolveNames(
            projects.values().stream()
                .map(Project::getClientId)
                .filter(Objects::nonNull)
                .distinct()
                .toList());

    return entries.stream()
        .map(
            e -> {
              var project = projects.get(e.getProjectId());
              Long clientId = project != null ? project.getClientId() : null;
              return TimeEntryResponse.from(
                  e,
                  userNames.get(e.getUserId()),
                  project != null ? project.getName() : null,
                  clientId,
                  clientId != null ? clientNames.get(clientId) : null);
            })
        .toList();
  }

  // --- DTOs ---

  public record TimeEntryRequest(
      @NotNull(message = "userId is required") @Positive(message = "userId must be positive")
          Long userId,
      @NotNull(message = "projectId is required") @Positive(message = "projectId must be positive")
          Long projectId,
      @NotNull(message = "entryDate is required") LocalDate entryDate,
      @NotNull(message = "hours is required")
          @Min(value = 1, message = "hours must be at least 1")
          @Max(value = 24, message = "hours must be at most 24")
          Integer hours,
      @NotBlank(message = "description is required")
          @Size(max = 10000, message = "description must be at most 10000 characters")
          String description) {

    static final LocalDate EARLIEST_EXCLUSIVE = LocalDate.of(2019, 1, 1);
    static final LocalDate LATEST_EXCLUSIVE = LocalDate.of(2100, 1, 1);

    @JsonIgnore
    @AssertTrue(message = "entryDate must be after 2019-01-01 and before 2100-01-01")
    public boolean isEntryDateInRange() {
      return entryDate == null
          || (entryDate.isAfter(EARLIEST_EXCLUSIVE) && entryDate.isBefore(LATEST_EXCLUSIVE));
    }
  }

  public record TimeEntryResponse(
      Long id,
      Long userId,
      String userName,
      Long projectId,
      String projectName,
      Long clientId,
      String clientName,
      LocalDate entryDate,
      int hours,
      BigDecimal hourRate,
      String description) {

    public static TimeEntryResponse from(
        TimeEntry entry, String userName, String projectName, Long clientId, String clientName) {
      return new TimeEntryResponse(
          entry.getId(),
          entry.getUserId(),
          userName,
          entry.getProjectId(),
          projectName,
          clientId,
          clientName,
          entry.getEntryDate(),
          entry.getHours(),
          entry.getHourRate(),
          entry.getDescription());
    }
  }
}
