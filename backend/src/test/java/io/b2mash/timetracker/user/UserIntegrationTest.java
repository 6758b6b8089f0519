package io.b2mash.timetracker.user;

import static io.b2mash.timetracker.TestJwts.admin;
import static io.b2mash.timetracker.TestJwts.member;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.timetracker.client.Client;
import io.b2mash.timetracker.client.ClientRepository;
import io.b2mash.timetracker.project.Project;
import io.b2mash.timetracker.project.ProjectRepository;
import io.b2mash.timetracker.timeentry.TimeEntry;
import io.b2mash.timetracker.timeentry.TimeEntryRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.jdbc.JdbcTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class UserIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;
  @Autowired private UserRepository userRepository;
  @Autowired private ClientRepository clientRepository;
  @Autowired private ProjectRepository projectRepository;
  @Autowired private TimeEntryRepository timeEntryRepository;

  @BeforeEach
  void clearTables() {
    JdbcTestUtils.deleteFromTables(
        jdbcTemplate, "time_entries", "projects", "clients", "users");
  }

  // --- CRUD happy path ---

  @Test
  void shouldCreateAndGetUser() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/users")
                    .with(admin())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "John Doe", "hourRate": 25}
                        """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").exists())
            .andExpect(jsonPath("$.name").value("John Doe"))
            .andExpect(jsonPath("$.hourRate").value(25.0))
            .andReturn();

    long id = extractId(result);
    assertThat(result.getResponse().getHeader("Location")).isEqualTo("/api/users/" + id);

    mockMvc
        .perform(get("/api/users/" + id).with(member()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(id))
        .andExpect(jsonPath("$.name").value("John Doe"))
        .andExpect(jsonPath("$.hourRate").value(25.0));
  }

  @Test
  void versionedRoute_servesSameResource() throws Exception {
    var user = userRepository.save(new User("Joan Doe", new BigDecimal("30")));

    mockMvc
        .perform(get("/api/v1/users/" + user.getId()).with(member()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Joan Doe"));
  }

  @Test
  void shouldUpdateNameAndRate() throws Exception {
    var user = userRepository.save(new User("Old Name", new BigDecimal("10")));

    mockMvc
        .perform(
            put("/api/users/" + user.getId())
                .with(admin())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "New Name", "hourRate": 42.5}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("New Name"))
        .andExpect(jsonPath("$.hourRate").value(42.5));

    var reloaded = userRepository.findById(user.getId()).orElseThrow();
    assertThat(reloaded.getName()).isEqualTo("New Name");
    assertThat(reloaded.getHourRate()).isEqualByComparingTo("42.50");
  }

  @Test
  void updatingTwiceWithSameBody_isIdempotent() throws Exception {
    var user = userRepository.save(new User("Same", new BigDecimal("10")));
    var body =
        """
        {"name": "Same Again", "hourRate": 11}
        """;

    for (int i = 0; i < 2; i++) {
      mockMvc
          .perform(
              put("/api/users/" + user.getId())
                  .with(admin())
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(body))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.name").value("Same Again"))
          .andExpect(jsonPath("$.hourRate").value(11.0));
    }
    assertThat(userRepository.count()).isEqualTo(1);
  }

  @Test
  void shouldDeleteUser() throws Exception {
    var user = userRepository.save(new User("Short Lived", new BigDecimal("10")));

    mockMvc
        .perform(delete("/api/users/" + user.getId()).with(admin()))
        .andExpect(status().isOk())
        .andExpect(content -> assertThat(content.getResponse().getContentLength()).isZero());

    mockMvc
        .perform(get("/api/users/" + user.getId()).with(member()))
        .andExpect(status().isNotFound());
  }

  // --- Not found ---

  @Test
  void unknownUser_returns404Problem() throws Exception {
    mockMvc
        .perform(get("/api/users/999999").with(member()))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("User not found"))
        .andExpect(jsonPath("$.status").value(404));

    mockMvc
        .perform(
            put("/api/users/999999")
                .with(admin())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Nobody", "hourRate": 10}
                    """))
        .andExpect(status().isNotFound());

    mockMvc.perform(delete("/api/users/999999").with(admin())).andExpect(status().isNotFound());
  }

  // --- Validation ---

  @Test
  void blankName_returns400WithFieldErrors() throws Exception {
    mockMvc
        .perform(
            post("/api/users")
                .with(admin())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "", "hourRate": 10}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Validation failed"))
        .andExpect(jsonPath("$.errors.name").isArray());

    assertThat(userRepository.count()).isZero();
  }

  @Test
  void hourRateOutOfRange_returns400() throws Exception {
    for (String rate : new String[] {"0", "-1", "1000", "1500.5"}) {
      mockMvc
          .perform(
              post("/api/users")
                  .with(admin())
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"name\": \"Rate Test\", \"hourRate\": " + rate + "}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.errors.hourRate").isArray());
    }
    assertThat(userRepository.count()).isZero();
  }

  @Test
  void hourRateWithSubCentPrecision_returns400InsteadOfRounding() throws Exception {
    for (String rate : new String[] {"0.001", "999.999"}) {
      mockMvc
          .perform(
              post("/api/users")
                  .with(admin())
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"name\": \"Precise\", \"hourRate\": " + rate + "}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.title").value("Validation failed"))
          .andExpect(jsonPath("$.errors.hourRate").isArray());
    }
    assertThat(userRepository.count()).isZero();

    var user = userRepository.save(new User("Precise", new BigDecimal("10")));
    mockMvc
        .perform(
            put("/api/users/" + user.getId())
                .with(admin())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Precise", "hourRate": 999.999}
                    """))
        .andExpect(status().isBadRequest());
    assertThat(userRepository.findById(user.getId()).orElseThrow().getHourRate())
        .isEqualByComparingTo("10.00");
  }

  @Test
  void hourRateAtTheBoundsWithCents_isAccepted() throws Exception {
    for (String rate : new String[] {"0.01", "999.99"}) {
      mockMvc
          .perform(
              post("/api/users")
                  .with(admin())
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"name\": \"Edge\", \"hourRate\": " + rate + "}"))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.hourRate").value(Double.parseDouble(rate)));
    }
  }

  @Test
  void nameLongerThan100_returns400() throws Exception {
    String longName = "x".repeat(101);

    mockMvc
        .perform(
            post("/api/users")
                .with(admin())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"" + longName + "\", \"hourRate\": 10}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors.name").isArray());
  }

  // --- Authorization ---

  @Test
  void nonAdmin_cannotCreateUpdateOrDelete() throws Exception {
    var user = userRepository.save(new User("Protected", new BigDecimal("20")));

    mockMvc
        .perform(
            post("/api/users")
                .with(member())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Sneaky", "hourRate": 10}
                    """))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.title").value("Access denied"));

    mockMvc
        .perform(
            put("/api/users/" + user.getId())
                .with(member())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Renamed", "hourRate": 99}
                    """))
        .andExpect(status().isForbidden());

    mockMvc
        .perform(delete("/api/users/" + user.getId()).with(member()))
        .andExpect(status().isForbidden());

    var reloaded = userRepository.findById(user.getId()).orElseThrow();
    assertThat(reloaded.getName()).isEqualTo("Protected");
    assertThat(reloaded.getHourRate()).isEqualByComparingTo("20");
    assertThat(userRepository.count()).isEqualTo(1);
  }

  @Test
  void withoutToken_returns401() throws Exception {
    mockMvc.perform(get("/api/users")).andExpect(status().isUnauthorized());
  }

  // --- Paging ---

  @Test
  void list_defaultsToFirstPageOfFive() throws Exception {
    for (int i = 1; i <= 7; i++) {
      userRepository.save(new User("User " + i, new BigDecimal("10")));
    }

    mockMvc
        .perform(get("/api/users").with(member()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items.length()").value(5))
        .andExpect(jsonPath("$.items[0].name").value("User 1"))
        .andExpect(jsonPath("$.page").value(1))
        .andExpect(jsonPath("$.pageSize").value(5))
        .andExpect(jsonPath("$.totalCount").value(7))
        .andExpect(jsonPath("$.totalPages").value(2));

    mockMvc
        .perform(get("/api/users").param("page", "2").with(member()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items.length()").value(2))
        .andExpect(jsonPath("$.items[0].name").value("User 6"))
        .andExpect(jsonPath("$.items[1].name").value("User 7"));
  }

  @Test
  void secondPageOfThreeUsers_isEmpty() throws Exception {
    for (int i = 1; i <= 3; i++) {
      userRepository.save(new User("User " + i, new BigDecimal("10")));
    }

    mockMvc
        .perform(get("/api/users").param("page", "2").param("size", "5").with(member()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items").isEmpty())
        .andExpect(jsonPath("$.page").value(2))
        .andExpect(jsonPath("$.totalCount").value(3))
        .andExpect(jsonPath("$.totalPages").value(1));
  }

  @Test
  void invalidPageParameters_return400() throws Exception {
    mockMvc
        .perform(get("/api/users").param("page", "0").with(member()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid page request"));

    mockMvc
        .perform(get("/api/users").param("size", "0").with(member()))
        .andExpect(status().isBadRequest());

    mockMvc
        .perform(get("/api/users").param("size", "101").with(member()))
        .andExpect(status().isBadRequest());

    mockMvc
        .perform(get("/api/users").param("page", "abc").with(member()))
        .andExpect(status().isBadRequest());
  }

  @Test
  void pageFarBeyondAddressableOffset_returns400NotServerError() throws Exception {
    mockMvc
        .perform(get("/api/users").param("page", "30000000").param("size", "100").with(member()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid page request"));

    mockMvc
        .perform(get("/api/v1/users").param("page", "21474837").param("size", "100").with(member()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items").isEmpty());
  }

  // --- Referential protection ---

  @Test
  void userWithTimeEntries_cannotBeDeleted() throws Exception {
    var user = userRepository.save(new User("Busy", new BigDecimal("25")));
    var client = clientRepository.save(new Client("Client"));
    var project = projectRepository.save(new Project("Project", client.getId()));
    timeEntryRepository.save(
        new TimeEntry(
            user.getId(),
            project.getId(),
            LocalDate.of(2024, 5, 2),
            4,
            user.getHourRate(),
            "Work"));

    mockMvc
        .perform(delete("/api/users/" + user.getId()).with(admin()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.title").value("User has time entries"));

    assertThat(userRepository.existsById(user.getId())).isTrue();
    assertThat(timeEntryRepository.count()).isEqualTo(1);
  }

  // --- End-to-end ---

  @Test
  void annLifecycle_createReadForbiddenDeleteThenGone() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/users")
                    .with(admin())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "Ann", "hourRate": 25}
                        """))
            .andExpect(status().isCreated())
            .andReturn();
    long id = extractId(result);

    mockMvc
        .perform(get("/api/users/" + id).with(member()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(id))
        .andExpect(jsonPath("$.name").value("Ann"))
        .andExpect(jsonPath("$.hourRate").value(25.0));

    mockMvc.perform(delete("/api/users/" + id).with(member())).andExpect(status().isForbidden());
    mockMvc.perform(delete("/api/users/" + id).with(admin())).andExpect(status().isOk());
    mockMvc.perform(get("/api/users/" + id).with(member())).andExpect(status().isNotFound());
  }

  @Test
  void pageTwoOfSizeTenOverThreeUsers_isEmptyWithOneTotalPage() throws Exception {
    for (int i = 1; i <= 3; i++) {
      userRepository.save(new User("User " + i, new BigDecimal("10")));
    }

    mockMvc
        .perform(get("/api/users").param("page", "2").param("size", "10").with(member()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items").isEmpty())
        .andExpect(jsonPath("$.page").value(2))
        .andExpect(jsonPath("$.pageSize").value(10))
        .andExpect(jsonPath("$.totalCount").value(3))
        .andExpect(jsonPath("$.totalPages").value(1));
  }

  private long extractId(MvcResult result) throws Exception {
    Number id = JsonPath.read(result.getResponse().getContentAsString(), "$.id");
    return id.longValue();
  }
}
