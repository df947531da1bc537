package com.spreadsheet.formula;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FormulaApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormulaApplication.class, args);
    }
}
