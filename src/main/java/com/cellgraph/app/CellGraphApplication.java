package com.cellgraph.app;

import com.cellgraph.app.config.SheetProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SheetProperties.class)
public class CellGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(CellGraphApplication.class, args);
    }
}
