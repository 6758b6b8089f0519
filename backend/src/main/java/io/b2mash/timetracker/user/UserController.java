package io.b2mash.timetracker.user;

import io.b2mash.timetracker.pagination.PageQuery;
import io.b2mash.timetracker.pagination.PagedResponse;
import io.b2mash.timetracker.pagination.Paginator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
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
@RequestMapping({"/api/users", "/api/v1/users"})
public class UserController {

  private final UserService userService;

  public UserController(UserService userService) {
    this.userService = userService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<UserResponse> getUser(@PathVariable Long id) {
    return ResponseEntity.ok(UserResponse.from(userService.getUser(id)));
  }

  @GetMapping
  public ResponseEntity<PagedResponse<UserResponse>> listUsers(
      @RequestParam(defaultValue = "1") int page, @RequestParam(defaultValue = "5") int size) {
    return ResponseEntity.ok(
        Paginator.paginate(
            PageQuery.of(page, size),
            userService::findPage,
            users -> users.stream().map(UserResponse::from).toList()));
  }

  @PostMapping
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<UserResponse> createUser(@Valid @RequestBody UserRequest request) {
    var user = userService.createUser(request.name(), request.hourRate());
    return ResponseEntity.created(URI.create("/api/users/" + user.getId()))
        .body(UserResponse.from(user));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<UserResponse> updateUser(
      @PathVariable Long id, @Valid @RequestBody UserRequest request) {
    var user = userService.updateUser(id, request.name(), request.hourRate());
    return ResponseEntity.ok(UserResponse.from(user));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Void> deleteUser(@PathVariable Long id) {
    userService.deleteUser(id);
    return ResponseEntity.ok().build();
  }

  // --- DTOs ---

  public record UserRequest(
      @NotBlank(message = "name is required")
          @Size(max = 100, message = "name must be at most 100 characters")
          String name,
      @NotNull(message = "hourRate is required")
          @DecimalMin(value = "0", inclusive = false, message = "hourRate must be greater than 0")
          @DecimalMax(
              value = "1000",
              inclusive = false,
              message = "hourRate must be less than 1000")
          @Digits(
              integer = 3,
              fraction = 2,
              message = "hourRate must have at most 3 integer digits and 2 decimals")
          BigDecimal hourRate) {}

  public record UserResponse(Long id, String name, BigDecimal hourRate) {

    public static UserResponse from(User user) {
      return new UserResponse(user.getId(), user.getName(), user.getHourRate());
    }
  }
}
