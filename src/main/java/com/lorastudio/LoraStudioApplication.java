package com.lorastudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class LoraStudioApplication {

    private static final Logger log = LoggerFactory.getLogger(LoraStudioApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(LoraStudioApplication.class, args);
        log.info("==========================================================");
        log.info("  LoRA Studio captioner is running at http://localhost:8080");
        log.info("  Start an LM Studio or Ollama server, or configure the");
        log.info("  WD14 / JoyCaption scripts, then POST /api/captions/batch.");
        log.info("==========================================================");
    }
}
