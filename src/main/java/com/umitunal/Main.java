package com.umitunal;

import com.umitunal.examples.*;

/**
 * Main class that runs all beeq examples against the Redis named by the environment.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== beeq Examples ===\n");

        BasicExample.main(args);
        RetryExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
