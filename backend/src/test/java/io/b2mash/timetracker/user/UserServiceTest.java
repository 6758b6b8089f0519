package io.b2mash.timetracker.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.timetracker.exception.ResourceConflictException;
import io.b2mash.timetracker.timeentry.TimeEntryRepository;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

  @Mock private UserRepository repository;
  @Mock private TimeEntryRepository timeEntryRepository;
  @InjectMocks private UserService service;

  @Test
  void createUser_storesRateInCents() {
    when(repository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));

    var user = service.createUser("Ann", new BigDecimal("25.5"));

    assertThat(user.getHourRate()).isEqualTo(new BigDecimal("25.50"));
  }

  @Test
  void createUser_subCentRate_isRejectedNotRounded() {
    assertThatThrownBy(() -> service.createUser("Ann", new BigDecimal("25.005")))
        .isInstanceOf(IllegalArgumentException.class);
    verify(repository, never()).save(any());
  }

  @Test
  void deleteUser_withTimeEntries_throwsConflict() {
    var user = new User("Busy", new BigDecimal("10"));
    when(repository.findById(4L)).thenReturn(Optional.of(user));
    when(timeEntryRepository.existsByUserId(4L)).thenReturn(true);

    assertThatThrownBy(() -> service.deleteUser(4L)).isInstanceOf(ResourceConflictException.class);
    verify(repository, never()).delete(any());
  }

  @Test
  void resolveNames_emptyInput_skipsQuery() {
    assertThat(service.resolveNames(List.of())).isEmpty();
    verifyNoInteractions(repository);
  }
}
