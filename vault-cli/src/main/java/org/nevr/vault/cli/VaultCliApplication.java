package org.nevr.vault.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VaultCliApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(VaultCliApplication.class, args)));
    }
}
