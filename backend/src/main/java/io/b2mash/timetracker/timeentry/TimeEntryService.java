package io.b2mash.timetracker.timeentry;

import io.b2mash.timetracker.exception.InvalidRequestException;
import io.b2mash.timetracker.exception.ResourceNotFoundException;
import io.b2mash.timetracker.project.ProjectRepository;
import io.b2mash.timetracker.user.User;
import io.b2mash.timetracker.user.UserRepository;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TimeEntryService {

  private static final Logger log = LoggerFactory.getLogger(TimeEntryService.class);

  private final TimeEntryRepository repository;
  private final UserRepository userRepository;
  private final ProjectRepository projectRepository;

  public TimeEntryService(
      TimeEntryRepository repository,
      UserRepository userRepository,
      ProjectRepository projectRepository) {
    this.repository = repository;
    this.userRepository = userRepository;
    this.projectRepository = projectRepository;
  }

  @Transactional(readOnly = true)
  public TimeEntry getTimeEntry(Long id) {
    return repository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Time entry", id));
  }

  @Transactional(readOnly = true)
  public Page<TimeEntry> findPage(Pageable pageable) {
    return repository.findAll(pageable);
  }

  /**
   * All entries of a user within one calendar month, ordered by date. An unknown user simply has
   * no entries.
   */
  @Transactional(readOnly = true)
  public List<TimeEntry> findByUserAndMonth(Long userId, int year, int month) {
    if (month < 1 || month > 12) {
      throw new InvalidRequestException(
          "Invalid month", "Month must be between 1 and 12 but was " + month);
    }
    if (year < 1 || year > 9999) {
      throw new InvalidRequestException(
          "Invalid year", "Year must be between 1 and 9999 but was " + year);
    }
    var yearMonth = YearMonth.of(year, month);
    var entries =
        repository.findByUserIdAndDateRange(userId, yearMonth.atDay(1), yearMonth.atEndOfMonth());
    log.debug("Found {} entries for user {} in {}", entries.size(), userId, yearMonth);
    return entries;
  }

  /** Creates an entry priced at the user's current hour rate. */
  @Transactional
  public TimeEntry createTimeEntry(
      Long userId, Long projectId, LocalDate entryDate, int hours, String description) {
    User user = requireUser(userId);
    requireProject(projectId);

    var entry =
        repository.save(
            new TimeEntry(userId, projectId, entryDate, hours, user.getHourRate(), description));
    log.info(
        "Created time entry {} for user {} on project {} ({}h on {})",
        entry.getId(),
        userId,
        projectId,
        hours,
        entryDate);
    return entry;
  }

  /**
   * Updates date, hours and description. The user and project must still exist but are not
   * reassigned; the rate snapshot is left alone.
   */
  @Transactional
  public TimeEntry updateTimeEntry(
      Long id, Long userId, Long projectId, LocalDate entryDate, int hours, String description) {
    var entry = getTimeEntry(id);
    requireUser(userId);
    requireProject(projectId);

    entry.update(entryDate, hours, description);
    entry = repository.save(entry);
    log.info("Updated time entry {}", id);
    return entry;
  }

  @Transactional
  public void deleteTimeEntry(Long id) {
    var entry = getTimeEntry(id);
    repository.delete(entry);
    log.info("Deleted time entry {}", id);
  }

  private User requireUser(Long userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }

  private void requireProject(Long projectId) {
    if (!projectRepository.existsById(projectId)) {
      throw new ResourceNotFoundException("Project", projectId);
    }
  }
}
