package io.b2mash.timetracker.project;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "projects")
public class Project {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "client_id", nullable = false)
  private Long clientId;

  protected Project() {}

  public Project(String name, Long clientId) {
    this.name = name;
    this.clientId = clientId;
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public Long getClientId() {
    return clientId;
  }

  public void update(String name, Long clientId) {
    this.name = name;
    this.clientId = clientId;
  }
}
