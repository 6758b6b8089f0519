package io.b2mash.timetracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TimeTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TimeTrackerApplication.class, args);
  }
}
