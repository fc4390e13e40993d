package com.github.spud.ai.lab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LabTeamApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(LabTeamApplication.class, args)));
  }

}
