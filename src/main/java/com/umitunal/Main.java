package com.umitunal;

import com.umitunal.examples.*;

/**
 * Main class that runs all Elric examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== Elric Examples ===\n");

        RecurringJobExample.main(args);
        PersistentStoreExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
