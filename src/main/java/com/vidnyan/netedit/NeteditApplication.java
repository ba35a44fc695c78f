package com.vidnyan.netedit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * netedit - SPICE netlist editor
 *
 * Edits component values, parameters and directives in place, keeping the
 * rest of the file as it was written.
 */
@SpringBootApplication
public class NeteditApplication {

    public static void main(String[] args) {
        SpringApplication.run(NeteditApplication.class, args);
    }
}
