package com.delta.redirects;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RedirectResolverApplication {

  public static void main(String[] args) {
    SpringApplication.run(RedirectResolverApplication.class, args);
  }
}
