package com.flamingo.ai.cliniclists;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/** Entry point for the clinical lists backend. */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ClinicalListsApplication {

  public static void main(String[] args) {
    SpringApplication.run(ClinicalListsApplication.class, args);
  }
}
