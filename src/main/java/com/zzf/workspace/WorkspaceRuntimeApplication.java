package com.zzf.workspace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkspaceRuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkspaceRuntimeApplication.class, args);
    }
}
