package io.b2mash.timetracker.user;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.math.RoundingMode;

@Entity
@Table(name = "users")
public class User {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "hour_rate", nullable = false, precision = 10, scale = 2)
  private BigDecimal hourRate;

  protected User() {}

  public User(String name, BigDecimal hourRate) {
    this.name = name;
    this.hourRate = normalize(hourRate);
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public BigDecimal getHourRate() {
    return hourRate;
  }

  /** Changing the rate never touches time entries already booked; they keep their snapshot. */
  public void update(String name, BigDecimal hourRate) {
    this.name = name;
    this.hourRate = normalize(hourRate);
  }

  /** Widens to cents; a rate with sub-cent precision is rejected rather than rounded. */
  private static BigDecimal normalize(BigDecimal hourRate) {
    if (hourRate.stripTrailingZeros().scale() > 2) {
      throw new IllegalArgumentException("hourRate must have at most 2 decimals: " + hourRate);
    }
    return hourRate.setScale(2, RoundingMode.UNNECESSARY);
  }
}
