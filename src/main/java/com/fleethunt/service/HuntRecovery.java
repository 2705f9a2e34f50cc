package com.fleethunt.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Reloads persisted hunts at startup. Running hunts get their rules published again.
 */
@Component
public class HuntRecovery implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(HuntRecovery.class);

  private final HuntService huntService;

  public HuntRecovery(HuntService huntService) {
    this.huntService = huntService;
  }

  @Override
  public void run(ApplicationArguments args) {
    int restored = huntService.restoreAll();
    log.info("Restored {} hunt(s) from the attribute store", restored);
  }
}
