package io.b2mash.timetracker.client;

import io.b2mash.timetracker.exception.ResourceNotFoundException;
import io.b2mash.timetracker.project.ProjectService;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ClientService {

  private static final Logger log = LoggerFactory.getLogger(ClientService.class);

  private final ClientRepository repository;
  private final ProjectService projectService;

  public ClientService(ClientRepository repository, ProjectService projectService) {
    this.repository = repository;
    this.projectService = projectService;
  }

  @Transactional(readOnly = true)
  public Client getClient(Long id) {
    return repository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Client", id));
  }

  @Transactional(readOnly = true)
  public Page<Client> findPage(Pageable pageable) {
    return repository.findAll(pageable);
  }

  /** Batch name lookup for view models; unknown ids are simply absent from the map. */
  @Transactional(readOnly = true)
  public Map<Long, String> resolveNames(Collection<Long> clientIds) {
    if (clientIds.isEmpty()) return Map.of();

    return repository.findAllById(clientIds).stream()
        .collect(Collectors.toMap(Client::getId, Client::getName, (a, b) -> a));
  }

  @Transactional
  public Client createClient(String name) {
    var client = repository.save(new Client(name));
    log.info("Created client {} ({})", client.getId(), client.getName());
    return client;
  }

  @Transactional
  public Client updateClient(Long id, String name) {
    var client = getClient(id);
    client.update(name);
    client = repository.save(client);
    log.info("Updated client {}", id);
    return client;
  }

  /** Cascades to the client's projects and their time entries. */
  @Transactional
  public void deleteClient(Long id) {
    var client = getClient(id);
    int projects = projectService.deleteProjectsOfClient(id);
    repository.delete(client);
    log.info("Deleted client {} with {} projects", id, projects);
  }
}
