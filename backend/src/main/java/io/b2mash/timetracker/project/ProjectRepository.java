package io.b2mash.timetracker.project;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, Long> {

  @Query("SELECT p.id FROM Project p WHERE p.clientId = :clientId")
  List<Long> findIdsByClientId(@Param("clientId") Long clientId);

  @Modifying
  @Query("DELETE FROM Project p WHERE p.clientId = :clientId")
  int deleteByClientId(@Param("clientId") Long clientId);
}
