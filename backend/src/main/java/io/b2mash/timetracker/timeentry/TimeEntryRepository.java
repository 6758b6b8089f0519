package io.b2mash.timetracker.timeentry;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimeEntryRepository extends JpaRepository<TimeEntry, Long> {

  boolean existsByUserId(Long userId);

  @Modifying
  @Query("DELETE FROM TimeEntry te WHERE te.projectId IN :projectIds")
  int deleteByProjectIdIn(@Param("projectIds") Collection<Long> projectIds);

  /** Entries of one user between two dates, both inclusive, oldest first. */
  @Query(
      """
      SELECT te FROM TimeEntry te
      WHERE te.userId = :userId
        AND te.entryDate >= :from
        AND te.entryDate <= :to
      ORDER BY te.entryDate ASC, te.id ASC
      """)
  List<TimeEntry> findByUserIdAndDateRange(
      @Param("userId") Long userId, @Param("from") LocalDate from, @Param("to") LocalDate to);
}
