package com.curriculum.insight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CurriculumInsightApplication {

  public static void main(String[] args) {
    SpringApplication.run(CurriculumInsightApplication.class, args);
  }
}
