package io.breland.calhub.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CalendarHubApplication {

  public static void main(String[] args) {
    SpringApplication.run(CalendarHubApplication.class, args);
  }
}
