package com.jobmatch.matcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JobMatcherApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobMatcherApplication.class, args);
  }
}
