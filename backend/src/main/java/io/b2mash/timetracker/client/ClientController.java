package io.b2mash.timetracker.client;

import io.b2mash.timetracker.pagination.PageQuery;
import io.b2mash.timetracker.pagination.PagedResponse;
import io.b2mash.timetracker.pagination.Paginator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
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
@RequestMapping({"/api/clients", "/api/v1/clients"})
public class ClientController {

  private final ClientService clientService;

  public ClientController(ClientService clientService) {
    this.clientService = clientService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<ClientResponse> getClient(@PathVariable Long id) {
    return ResponseEntity.ok(ClientResponse.from(clientService.getClient(id)));
  }

  @GetMapping
  public ResponseEntity<PagedResponse<ClientResponse>> listClients(
      @RequestParam(defaultValue = "1") int page, @RequestParam(defaultValue = "5") int size) {
    return ResponseEntity.ok(
        Paginator.paginate(
            PageQuery.of(page, size),
            clientService::findPage,
            clients -> clients.stream().map(ClientResponse::from).toList()));
  }

  @PostMapping
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<ClientResponse> createClient(@Valid @RequestBody ClientRequest request) {
    var client = clientService.createClient(request.name());
    return ResponseEntity.created(URI.create("/api/clients/" + client.getId()))
        .body(ClientResponse.from(client));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<ClientResponse> updateClient(
      @PathVariable Long id, @Valid @RequestBody ClientRequest request) {
    return ResponseEntity.ok(ClientResponse.from(clientService.updateClient(id, request.name())));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Void> deleteClient(@PathVariable Long id) {
    clientService.deleteClient(id);
    return ResponseEntity.ok().build();
  }

  // --- DTOs ---

  public record ClientRequest(
      @NotBlank(message = "name is required")
          @Size(max = 100, message = "name must be at most 100 characters")
          String name) {}

  public record ClientResponse(Long id, String name) {

    public static ClientResponse from(Client client) {
      return new ClientResponse(client.getId(), client.getName());
    }
  }
}
