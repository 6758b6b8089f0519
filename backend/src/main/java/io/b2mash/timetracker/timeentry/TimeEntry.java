package io.b2mash.timetracker.timeentry;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Hours booked by a user on a project for one day. {@code hourRate} is copied from the user when
 * the entry is created and never changes afterwards, nor do the user and project it belongs to.
 */
@Entity
@Table(name = "time_entries")
public class TimeEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private Long userId;

  @Column(name = "project_id", nullable = false, updatable = false)
  private Long projectId;

  @Column(name = "entry_date", nullable = false)
  private LocalDate entryDate;

  @Column(name = "hours", nullable = false)
  private int hours;

  @Column(name = "hour_rate", nullable = false, updatable = false, precision = 10, scale = 2)
  private BigDecimal hourRate;

  @Column(name = "description", nullable = false, length = 10000)
  private String description;

  protected TimeEntry() {}

  public TimeEntry(
      Long userId,
      Long projectId,
      LocalDate entryDate,
      int hours,
      BigDecimal hourRate,
      String description) {
    this.userId = userId;
    this.projectId = projectId;
    this.entryDate = entryDate;
    this.hours = hours;
    this.hourRate = hourRate.setScale(2, RoundingMode.HALF_UP);
    this.description = description;
  }

  public Long getId() {
    return id;
  }

  public Long getUserId() {
    return userId;
  }

  public Long getProjectId() {
    return projectId;
  }

  public LocalDate getEntryDate() {
    return entryDate;
  }

  public int getHours() {
    return hours;
  }

  public BigDecimal getHourRate() {
    return hourRate;
  }

  public String getDescription() {
    return description;
  }

  public void update(LocalDate entryDate, int hours, String description) {
    this.entryDate = entryDate;
    this.hours = hours;
    this.description = description;
  }
}
