package com.github.spud.worksession;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkSessionApplication {

  public static void main(String[] args) {
    SpringApplication.run(WorkSessionApplication.class, args);
  }

}
