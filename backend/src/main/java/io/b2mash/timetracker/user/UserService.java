package io.b2mash.timetracker.user;

import io.b2mash.timetracker.exception.ResourceConflictException;
import io.b2mash.timetracker.exception.ResourceNotFoundException;
import io.b2mash.timetracker.timeentry.TimeEntryRepository;
import java.math.BigDecimal;
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
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);

  private final UserRepository repository;
  private final TimeEntryRepository timeEntryRepository;

  public UserService(UserRepository repository, TimeEntryRepository timeEntryRepository) {
    this.repository = repository;
    this.timeEntryRepository = timeEntryRepository;
  }

  @Transactional(readOnly = true)
  public User getUser(Long id) {
    return repository.findById(id).orElseThrow(() -> new ResourceNotFoundException("User", id));
  }

  @Transactional(readOnly = true)
  public Page<User> findPage(Pageable pageable) {
    return repository.findAll(pageable);
  }

  @Transactional(readOnly = true)
  public Map<Long, String> resolveNames(Collection<Long> userIds) {
    if (userIds.isEmpty()) return Map.of();

    return repository.findAllById(userIds).stream()
        .collect(Collectors.toMap(User::getId, User::getName, (a, b) -> a));
  }

  @Transactional
  public User createUser(String name, BigDecimal hourRate) {
    var user = repository.save(new User(name, hourRate));
    log.info("Created user {} ({})", user.getId(), user.getName());
    return user;
  }

  @Transactional
  public User updateUser(Long id, String name, BigDecimal hourRate) {
    var user = getUser(id);
    user.update(name, hourRate);
    user = repository.save(user);
    log.info("Updated user {}", id);
    return user;
  }

  @Transactional
  public void deleteUser(Long id) {
    var user = getUser(id);
    if (timeEntryRepository.existsByUserId(id)) {
      throw new ResourceConflictException(
          "User has time entries", "User " + id + " still has time entries and cannot be deleted");
    }
    repository.delete(user);
    log.info("Deleted user {}", id);
  }
}
