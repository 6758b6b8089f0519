package io.b2mash.timetracker.project;

import io.b2mash.timetracker.client.ClientRepository;
import io.b2mash.timetracker.exception.ResourceNotFoundException;
import io.b2mash.timetracker.timeentry.TimeEntryRepository;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository repository;
  private final ClientRepository clientRepository;
  private final TimeEntryRepository timeEntryRepository;

  public ProjectService(
      ProjectRepository repository,
      ClientRepository clientRepository,
      TimeEntryRepository timeEntryRepository) {
    this.repository = repository;
    this.clientRepository = clientRepository;
    this.timeEntryRepository = timeEntryRepository;
  }

  @Transactional(readOnly = true)
  public Project getProject(Long id) {
    return repository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Project", id));
  }

  @Transactional(readOnly = true)
  public Page<Project> findPage(Pageable pageable) {
    return repository.findAll(pageable);
  }

  @Transactional(readOnly = true)
  public Map<Long, Project> resolveProjects(Collection<Long> projectIds) {
    if (projectIds.isEmpty()) return Map.of();

    return repository.findAllById(projectIds).stream()
        .collect(Collectors.toMap(Project::getId, Function.identity(), (a, b) -> a));
  }

  @Transactional
  public Project createProject(String name, Long clientId) {
    requireClient(clientId);
    var project = repository.save(new Project(name, clientId));
    log.info("Created project {} ({}) for client {}", project.getId(), name, clientId);
    return project;
  }

  /** Name and client are replaced; the client must exist. */
  @Transactional
  public Project updateProject(Long id, String name, Long clientId) {
    var project = getProject(id);
    requireClient(clientId);
    project.update(name, clientId);
    project = repository.save(project);
    log.info("Updated project {}", id);
    return project;
  }

  /** Removes the project together with its time entries. */
  @Transactional
  public void deleteProject(Long id) {
    var project = getProject(id);
    int entries = timeEntryRepository.deleteByProjectIdIn(List.of(id));
    repository.delete(project);
    log.info("Deleted project {} and {} time entries", id, entries);
  }

  /** Removes every project of a client, and their time entries; returns the project count. */
  @Transactional
  public int deleteProjectsOfClient(Long clientId) {
    var projectIds = repository.findIdsByClientId(clientId);
    if (projectIds.isEmpty()) return 0;

    int entries = timeEntryRepository.deleteByProjectIdIn(projectIds);
    int projects = repository.deleteByClientId(clientId);
    log.info("Deleted {} projects and {} time entries of client {}", projects, entries, clientId);
    return projects;
  }

  private void requireClient(Long clientId) {
    if (!clientRepository.existsById(clientId)) {
      throw new ResourceNotFoundException("Client", clientId);
    }
  }
}
